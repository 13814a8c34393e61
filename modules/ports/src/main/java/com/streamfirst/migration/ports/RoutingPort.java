package com.streamfirst.migration.ports;

import com.streamfirst.migration.domain.CollaboratorUnavailableException;
import com.streamfirst.migration.domain.MigrationId;
import com.streamfirst.migration.domain.TargetPair;
import com.streamfirst.migration.domain.TrafficWeight;

import java.util.Optional;

/**
 * Port for one traffic routing mechanism, such as load balancer weighted target groups or
 * weighted DNS records. A migration may drive several mechanisms at once; each is wrapped
 * by its own implementation.
 */
public interface RoutingPort {

    /**
     * Short name of the mechanism, used in logs and audit detail (e.g. "alb", "dns").
     */
    String mechanism();

    /**
     * Writes the weight pair for the two targets. Returns once the mechanism has accepted
     * the change; propagation is confirmed separately through {@link #currentWeights}.
     *
     * @param migrationId the run issuing the change
     * @param targets the old and new target names
     * @param weight the split to apply
     * @throws CollaboratorUnavailableException if the mechanism rejects the call or cannot be reached
     */
    void applyWeights(MigrationId migrationId, TargetPair targets, TrafficWeight weight);

    /**
     * Reads back the weight pair currently in effect.
     *
     * @param migrationId the run being queried
     * @param targets the old and new target names
     * @return the applied split, or empty if the mechanism has no weights for these targets yet
     * @throws CollaboratorUnavailableException if the mechanism cannot be reached
     */
    Optional<TrafficWeight> currentWeights(MigrationId migrationId, TargetPair targets);
}
