package com.streamfirst.migration.ports;

import com.streamfirst.migration.domain.ErrorKind;
import com.streamfirst.migration.domain.MigrationId;
import com.streamfirst.migration.domain.MigrationState;
import com.streamfirst.migration.domain.Result;
import com.streamfirst.migration.domain.VersionedState;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Port for the authoritative, versioned store of migration state. Every mutation is a
 * conditional write against the version the caller read; there is no unconditional update.
 */
public interface WeightStorePort {

    /**
     * Reads the current state and its version.
     *
     * @param migrationId the run to read
     * @return the versioned state, or empty if the run was never initialized
     */
    Optional<VersionedState> read(MigrationId migrationId);

    /**
     * Creates the state of a new run at version 1.
     *
     * @param initialState the state to store
     * @return the stored state, or a {@link ErrorKind#CONFLICT} failure if state already exists
     */
    Result<VersionedState> initialize(MigrationState initialState);

    /**
     * Replaces the state only if the stored version still equals {@code expectedVersion}.
     * Of two concurrent calls with the same expected version exactly one succeeds.
     *
     * @param migrationId the run to update
     * @param expectedVersion the version the new state was derived from
     * @param newState the state to commit
     * @return the committed state with its new version, or a {@link ErrorKind#CONFLICT} failure
     */
    Result<VersionedState> compareAndSwap(MigrationId migrationId, long expectedVersion, MigrationState newState);

    /**
     * Finds the current state of all runs matching the predicate.
     *
     * @param predicate filter applied to each stored state
     * @return matching states in no particular order
     */
    List<MigrationState> findMatching(Predicate<MigrationState> predicate);

    /**
     * Finds runs that have not reached a terminal phase.
     */
    default List<MigrationState> findActive() {
        return findMatching(state -> !state.getPhase().isTerminal());
    }
}
