package com.streamfirst.migration.domain;

import java.util.Objects;

/**
 * A {@link MigrationState} together with the store version it was read at. The version is
 * the precondition for the next compare-and-swap.
 *
 * @param state the committed state
 * @param version monotonically increasing store version, starting at 1
 */
public record VersionedState(MigrationState state, long version) {
    public VersionedState {
        Objects.requireNonNull(state, "State cannot be null");
        if (version < 1) {
            throw new IllegalArgumentException("Version must be positive: " + version);
        }
    }
}
