package com.streamfirst.migration.domain;

import java.time.Duration;
import java.util.Objects;

/**
 * Operational knobs of the migration controller.
 *
 * @param stepSize percentage points moved per advance, 1-100
 * @param metricsTimeout bound on one health sample
 * @param routingTimeout bound on one routing mechanism call
 * @param casRetryLimit re-read and re-evaluate attempts after a lost compare-and-swap
 * @param rollbackBackoff retry policy for the rollback push
 */
public record ControllerSettings(int stepSize,
                                 Duration metricsTimeout,
                                 Duration routingTimeout,
                                 int casRetryLimit,
                                 BackoffPolicy rollbackBackoff) {

    public static final ControllerSettings DEFAULT = new ControllerSettings(
            10, Duration.ofSeconds(5), Duration.ofSeconds(5), 3, BackoffPolicy.DEFAULT);

    public ControllerSettings {
        Objects.requireNonNull(metricsTimeout, "Metrics timeout cannot be null");
        Objects.requireNonNull(routingTimeout, "Routing timeout cannot be null");
        Objects.requireNonNull(rollbackBackoff, "Rollback backoff cannot be null");
        String violation = violation(stepSize, metricsTimeout, routingTimeout, casRetryLimit);
        if (violation != null) {
            throw new IllegalArgumentException(violation);
        }
    }

    /**
     * Validating factory returning {@link ErrorKind#INVALID_CONFIGURATION} on bad input.
     */
    public static Result<ControllerSettings> of(int stepSize,
                                                Duration metricsTimeout,
                                                Duration routingTimeout,
                                                int casRetryLimit,
                                                BackoffPolicy rollbackBackoff) {
        if (metricsTimeout == null || routingTimeout == null || rollbackBackoff == null) {
            return Result.failure(MigrationError.invalidConfiguration("Timeouts and rollback backoff must be set"));
        }
        String violation = violation(stepSize, metricsTimeout, routingTimeout, casRetryLimit);
        if (violation != null) {
            return Result.failure(MigrationError.invalidConfiguration(violation));
        }
        return Result.success(new ControllerSettings(stepSize, metricsTimeout, routingTimeout,
                casRetryLimit, rollbackBackoff));
    }

    public ControllerSettings withStepSize(int newStepSize) {
        return new ControllerSettings(newStepSize, metricsTimeout, routingTimeout, casRetryLimit, rollbackBackoff);
    }

    public ControllerSettings withRollbackBackoff(BackoffPolicy backoff) {
        return new ControllerSettings(stepSize, metricsTimeout, routingTimeout, casRetryLimit, backoff);
    }

    private static String violation(int stepSize, Duration metricsTimeout, Duration routingTimeout,
                                    int casRetryLimit) {
        if (stepSize < 1 || stepSize > TrafficWeight.TOTAL) {
            return "stepSize must be within 1-100, got " + stepSize;
        }
        if (metricsTimeout.isNegative() || metricsTimeout.isZero()) {
            return "metricsTimeout must be positive, got " + metricsTimeout;
        }
        if (routingTimeout.isNegative() || routingTimeout.isZero()) {
            return "routingTimeout must be positive, got " + routingTimeout;
        }
        if (casRetryLimit < 0) {
            return "casRetryLimit must be >= 0, got " + casRetryLimit;
        }
        return null;
    }
}
