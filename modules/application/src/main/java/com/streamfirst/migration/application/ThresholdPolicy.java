package com.streamfirst.migration.application;

import com.streamfirst.migration.domain.HealthSnapshot;
import com.streamfirst.migration.domain.MigrationState;
import com.streamfirst.migration.domain.ThresholdConfig;
import com.streamfirst.migration.domain.Verdict;

import java.util.Locale;

/**
 * Turns one health snapshot into a verdict. Rules are checked in order and the first match
 * wins:
 *
 * <ol>
 *   <li>replication lag above {@code maxLagMillis} - rollback</li>
 *   <li>error rate above {@code maxErrorRatePercent} - rollback</li>
 *   <li>healthy target fraction below {@code minHealthyFraction} - rollback</li>
 *   <li>this poll completes the health window - advance</li>
 *   <li>otherwise - hold</li>
 * </ol>
 *
 * <p>Thresholds are exclusive: a reading exactly at the limit is healthy. The policy holds
 * no state and has no side effects.
 */
public class ThresholdPolicy {

    /**
     * A verdict together with the reason it was reached, for audit detail.
     */
    public record Decision(Verdict verdict, String reason) {}

    public Verdict evaluate(HealthSnapshot snapshot, MigrationState state, ThresholdConfig config) {
        return decide(snapshot, state, config).verdict();
    }

    public Decision decide(HealthSnapshot snapshot, MigrationState state, ThresholdConfig config) {
        if (snapshot.replicationLagMillis() > config.maxLagMillis()) {
            return new Decision(Verdict.ROLLBACK, "replication lag " + snapshot.replicationLagMillis()
                    + "ms exceeds " + config.maxLagMillis() + "ms");
        }
        if (snapshot.errorRatePercent() > config.maxErrorRatePercent()) {
            return new Decision(Verdict.ROLLBACK, "error rate " + percent(snapshot.errorRatePercent())
                    + "% exceeds " + percent(config.maxErrorRatePercent()) + "%");
        }
        if (snapshot.healthyFraction() < config.minHealthyFraction()) {
            return new Decision(Verdict.ROLLBACK, "healthy targets " + snapshot.healthyTargetCount() + "/"
                    + snapshot.totalTargetCount() + " below " + percent(config.minHealthyFraction() * 100) + "%");
        }
        int goodPolls = state.getConsecutiveGoodPolls() + 1;
        if (goodPolls >= config.requiredGoodPollsToAdvance()) {
            return new Decision(Verdict.ADVANCE, goodPolls + "/" + config.requiredGoodPollsToAdvance()
                    + " healthy polls");
        }
        return new Decision(Verdict.HOLD, goodPolls + "/" + config.requiredGoodPollsToAdvance()
                + " healthy polls");
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
