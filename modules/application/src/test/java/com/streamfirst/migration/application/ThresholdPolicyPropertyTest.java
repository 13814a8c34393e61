package com.streamfirst.migration.application;

import com.streamfirst.migration.domain.HealthSnapshot;
import com.streamfirst.migration.domain.MigrationId;
import com.streamfirst.migration.domain.MigrationPhase;
import com.streamfirst.migration.domain.MigrationState;
import com.streamfirst.migration.domain.ThresholdConfig;
import com.streamfirst.migration.domain.Verdict;
import net.jqwik.api.Assume;
import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.LongRange;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ThresholdPolicyPropertyTest {

    private static final Instant NOW = Instant.parse("2024-06-01T10:00:00Z");
    private static final ThresholdConfig CONFIG = new ThresholdConfig(5_000L, 1.0, 0.8, 3, Duration.ofSeconds(30));

    private final ThresholdPolicy policy = new ThresholdPolicy();

    @Property
    @Label("Same snapshot and state always give the same verdict")
    void deterministic(@ForAll @LongRange(min = 0, max = 20_000) long lag,
                       @ForAll @DoubleRange(min = 0.0, max = 100.0) double errorRate,
                       @ForAll @IntRange(min = 0, max = 10) int healthy,
                       @ForAll @IntRange(min = 1, max = 10) int total,
                       @ForAll @IntRange(min = 0, max = 5) int goodPolls) {
        Assume.that(healthy <= total);
        var snapshot = new HealthSnapshot(lag, errorRate, healthy, total, NOW);
        var state = shifting(goodPolls);

        var first = policy.decide(snapshot, state, CONFIG);
        var second = policy.decide(snapshot, state, CONFIG);

        assertThat(second).isEqualTo(first);
        assertThat(policy.evaluate(snapshot, state, CONFIG)).isEqualTo(first.verdict());
    }

    @Property
    @Label("Any breached threshold rolls back regardless of the health window")
    void breachAlwaysRollsBack(@ForAll @LongRange(min = 5_001, max = 100_000) long lag,
                               @ForAll @IntRange(min = 0, max = 10) int goodPolls) {
        var snapshot = new HealthSnapshot(lag, 0.0, 4, 4, NOW);

        assertThat(policy.evaluate(snapshot, shifting(goodPolls), CONFIG)).isEqualTo(Verdict.ROLLBACK);
    }

    @Property
    @Label("A healthy snapshot never rolls back")
    void healthyNeverRollsBack(@ForAll @LongRange(min = 0, max = 5_000) long lag,
                               @ForAll @DoubleRange(min = 0.0, max = 1.0) double errorRate,
                               @ForAll @IntRange(min = 0, max = 10) int goodPolls) {
        var snapshot = new HealthSnapshot(lag, errorRate, 5, 5, NOW);

        assertThat(policy.evaluate(snapshot, shifting(goodPolls), CONFIG)).isNotEqualTo(Verdict.ROLLBACK);
    }

    private static MigrationState shifting(int goodPolls) {
        return MigrationState.initial(new MigrationId("prop"), 10, NOW)
                .withPhase(MigrationPhase.SHIFTING)
                .withConsecutiveGoodPolls(goodPolls);
    }
}
