package com.streamfirst.migration.domain;

import java.util.Set;

/**
 * State machine for the migration lifecycle.
 *
 * <ul>
 *   <li><b>Forward path</b>: INITIALIZING → VALIDATING → SHIFTING → COMPLETED</li>
 *   <li><b>Self-loop</b>: SHIFTING → SHIFTING on every weight step</li>
 *   <li><b>Rollback</b>: VALIDATING or SHIFTING → ROLLED_BACK</li>
 * </ul>
 *
 * <p>COMPLETED and ROLLED_BACK are terminal. A rolled back migration is retried by starting
 * a fresh run.
 */
public enum MigrationPhase {
    /** Run registered, waiting for a valid initial split and a first successful sample */
    INITIALIZING,
    /** New environment under observation with zero traffic */
    VALIDATING,
    /** Traffic being moved step by step */
    SHIFTING,
    /** All traffic on the new environment */
    COMPLETED,
    /** Traffic restored to the last known-good split after an adverse verdict or abort */
    ROLLED_BACK;

    /**
     * Returns valid transitions from this phase.
     */
    public Set<MigrationPhase> validTransitions() {
        return switch (this) {
            case INITIALIZING -> Set.of(VALIDATING);
            case VALIDATING -> Set.of(VALIDATING, SHIFTING, ROLLED_BACK);
            case SHIFTING -> Set.of(SHIFTING, COMPLETED, ROLLED_BACK);
            case COMPLETED, ROLLED_BACK -> Set.of();
        };
    }

    public boolean canTransitionTo(MigrationPhase next) {
        return validTransitions().contains(next);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == ROLLED_BACK;
    }

    /**
     * Checks if a rollback may be initiated from this phase.
     */
    public boolean isRollbackEligible() {
        return canTransitionTo(ROLLED_BACK);
    }
}
