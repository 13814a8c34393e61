package com.streamfirst.migration.ports;

import com.streamfirst.migration.domain.CollaboratorUnavailableException;
import com.streamfirst.migration.domain.MigrationId;

/**
 * Port for the monitoring backend that observes the replication pipeline and the new
 * environment. Implementations wrap a metrics API (CloudWatch, Prometheus, a health
 * endpoint) and return raw readings; validation and timeout handling happen in the
 * application layer.
 */
public interface MetricsPort {

    /**
     * Current delay between a write on the source store and its visibility on the target.
     *
     * @param migrationId the run being observed
     * @return replication lag in milliseconds
     * @throws CollaboratorUnavailableException if the backend cannot be reached
     */
    long replicationLagMillis(MigrationId migrationId);

    /**
     * Current request error rate on the traffic being migrated.
     *
     * @param migrationId the run being observed
     * @return error rate in percent, 0-100
     * @throws CollaboratorUnavailableException if the backend cannot be reached
     */
    double errorRatePercent(MigrationId migrationId);

    /**
     * Health check results for the targets of the new environment.
     *
     * @param migrationId the run being observed
     * @return healthy and total target counts
     * @throws CollaboratorUnavailableException if the backend cannot be reached
     */
    TargetHealth targetHealth(MigrationId migrationId);

    /**
     * Target health counts as reported by the load balancer.
     *
     * @param healthy targets passing health checks
     * @param total targets registered
     */
    record TargetHealth(int healthy, int total) {}
}
