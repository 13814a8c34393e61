package com.streamfirst.migration.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time health of the replication pipeline and the target environment, taken once
 * per poll cycle.
 *
 * @param replicationLagMillis delay between a write on the source store and its visibility on the target
 * @param errorRatePercent request error rate, 0-100
 * @param healthyTargetCount targets currently passing health checks
 * @param totalTargetCount targets registered, always positive
 * @param observedAt when the sample was taken
 */
public record HealthSnapshot(long replicationLagMillis,
                             double errorRatePercent,
                             int healthyTargetCount,
                             int totalTargetCount,
                             Instant observedAt) {
    public HealthSnapshot {
        Objects.requireNonNull(observedAt, "Observation time cannot be null");
        if (replicationLagMillis < 0) {
            throw new IllegalArgumentException("Replication lag cannot be negative: " + replicationLagMillis);
        }
        if (Double.isNaN(errorRatePercent) || errorRatePercent < 0.0 || errorRatePercent > 100.0) {
            throw new IllegalArgumentException("Error rate must be within 0-100: " + errorRatePercent);
        }
        if (totalTargetCount <= 0) {
            throw new IllegalArgumentException("Total target count must be positive: " + totalTargetCount);
        }
        if (healthyTargetCount < 0 || healthyTargetCount > totalTargetCount) {
            throw new IllegalArgumentException("Healthy target count must be within 0-" + totalTargetCount
                                               + ": " + healthyTargetCount);
        }
    }

    /**
     * Fraction of registered targets that are healthy, 0.0-1.0.
     */
    public double healthyFraction() {
        return (double) healthyTargetCount / totalTargetCount;
    }

    @Override
    public String toString() {
        return "HealthSnapshot{lag=" + replicationLagMillis + "ms, errorRate=" + errorRatePercent
               + "%, healthy=" + healthyTargetCount + "/" + totalTargetCount + ", at=" + observedAt + '}';
    }
}
