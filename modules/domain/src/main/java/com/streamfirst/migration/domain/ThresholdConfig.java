package com.streamfirst.migration.domain;

import java.time.Duration;
import java.util.Objects;

/**
 * Health thresholds and pacing for a migration run. Immutable for the lifetime of the run.
 *
 * @param maxLagMillis replication lag above which the run rolls back
 * @param maxErrorRatePercent error rate above which the run rolls back, 0-100
 * @param minHealthyFraction healthy target fraction below which the run rolls back, 0.0-1.0
 * @param requiredGoodPollsToAdvance consecutive healthy polls needed before each advance
 * @param pollInterval time between health samples
 */
public record ThresholdConfig(long maxLagMillis,
                              double maxErrorRatePercent,
                              double minHealthyFraction,
                              int requiredGoodPollsToAdvance,
                              Duration pollInterval) {

    public static final ThresholdConfig DEFAULT =
            new ThresholdConfig(5_000L, 1.0, 0.8, 3, Duration.ofSeconds(30));

    public ThresholdConfig {
        Objects.requireNonNull(pollInterval, "Poll interval cannot be null");
        String violation = violation(maxLagMillis, maxErrorRatePercent, minHealthyFraction,
                requiredGoodPollsToAdvance, pollInterval);
        if (violation != null) {
            throw new IllegalArgumentException(violation);
        }
    }

    /**
     * Validating factory. Out-of-range values produce an
     * {@link ErrorKind#INVALID_CONFIGURATION} failure instead of an exception.
     */
    public static Result<ThresholdConfig> of(long maxLagMillis,
                                             double maxErrorRatePercent,
                                             double minHealthyFraction,
                                             int requiredGoodPollsToAdvance,
                                             Duration pollInterval) {
        if (pollInterval == null) {
            return Result.failure(MigrationError.invalidConfiguration("Poll interval must be set"));
        }
        String violation = violation(maxLagMillis, maxErrorRatePercent, minHealthyFraction,
                requiredGoodPollsToAdvance, pollInterval);
        if (violation != null) {
            return Result.failure(MigrationError.invalidConfiguration(violation));
        }
        return Result.success(new ThresholdConfig(maxLagMillis, maxErrorRatePercent, minHealthyFraction,
                requiredGoodPollsToAdvance, pollInterval));
    }

    private static String violation(long maxLagMillis,
                                    double maxErrorRatePercent,
                                    double minHealthyFraction,
                                    int requiredGoodPollsToAdvance,
                                    Duration pollInterval) {
        if (maxLagMillis < 0) {
            return "maxLagMillis must be >= 0, got " + maxLagMillis;
        }
        if (Double.isNaN(maxErrorRatePercent) || maxErrorRatePercent < 0.0 || maxErrorRatePercent > 100.0) {
            return "maxErrorRatePercent must be within 0-100, got " + maxErrorRatePercent;
        }
        if (Double.isNaN(minHealthyFraction) || minHealthyFraction < 0.0 || minHealthyFraction > 1.0) {
            return "minHealthyFraction must be within 0.0-1.0, got " + minHealthyFraction;
        }
        if (requiredGoodPollsToAdvance < 1) {
            return "requiredGoodPollsToAdvance must be >= 1, got " + requiredGoodPollsToAdvance;
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            return "pollInterval must be positive, got " + pollInterval;
        }
        return null;
    }
}
