package com.streamfirst.migration.domain;

import java.util.Objects;

/**
 * Everything needed to start a migration run.
 *
 * @param migrationId identifier of the run
 * @param targets the environments traffic moves between
 * @param thresholds health thresholds for every step
 * @param settings controller knobs
 */
public record MigrationRequest(MigrationId migrationId,
                               TargetPair targets,
                               ThresholdConfig thresholds,
                               ControllerSettings settings) {
    public MigrationRequest {
        Objects.requireNonNull(migrationId, "Migration ID cannot be null");
        Objects.requireNonNull(targets, "Targets cannot be null");
        Objects.requireNonNull(thresholds, "Thresholds cannot be null");
        Objects.requireNonNull(settings, "Settings cannot be null");
    }
}
