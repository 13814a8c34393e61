package com.streamfirst.migration.application;

import com.streamfirst.migration.domain.CollaboratorUnavailableException;
import com.streamfirst.migration.domain.HealthSnapshot;
import com.streamfirst.migration.domain.MigrationError;
import com.streamfirst.migration.domain.MigrationId;
import com.streamfirst.migration.domain.Result;
import com.streamfirst.migration.ports.MetricsPort;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;

/**
 * Takes one {@link HealthSnapshot} per poll. The three metric reads run as a single call
 * bounded by the configured timeout; the loop thread never blocks longer than that.
 */
@Slf4j
@RequiredArgsConstructor
public class MetricsClient {

    @NonNull private final MetricsPort metricsPort;
    @NonNull private final Duration timeout;
    @NonNull private final Clock clock;
    @NonNull private final ExecutorService callExecutor;

    /**
     * Samples lag, error rate and target health.
     *
     * @return the snapshot, or an UNAVAILABLE failure on timeout, transport error or a
     *     reading that is out of range
     */
    public Result<HealthSnapshot> sample(MigrationId migrationId) {
        try {
            HealthSnapshot snapshot = BoundedCalls.call(callExecutor, timeout, "Metrics sample for " + migrationId,
                    () -> read(migrationId));
            log.debug("Sampled {} for {}", snapshot, migrationId);
            return Result.success(snapshot);
        } catch (CollaboratorUnavailableException e) {
            log.warn("Metrics unavailable for {}: {}", migrationId, e.getMessage());
            return Result.failure(MigrationError.unavailable(e.getMessage()));
        } catch (IllegalArgumentException e) {
            log.warn("Malformed metrics reading for {}: {}", migrationId, e.getMessage());
            return Result.failure(MigrationError.unavailable("Malformed metrics reading: " + e.getMessage()));
        }
    }

    private HealthSnapshot read(MigrationId migrationId) {
        long lag = metricsPort.replicationLagMillis(migrationId);
        double errorRate = metricsPort.errorRatePercent(migrationId);
        MetricsPort.TargetHealth health = metricsPort.targetHealth(migrationId);
        return new HealthSnapshot(lag, errorRate, health.healthy(), health.total(), clock.instant());
    }
}
