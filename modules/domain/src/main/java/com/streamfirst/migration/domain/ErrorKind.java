package com.streamfirst.migration.domain;

/**
 * Classification of failures the orchestrator can encounter. Only {@link #UNRECOVERABLE}
 * and rollback verdicts ever change the externally visible phase.
 */
public enum ErrorKind {
    /** A metrics or routing collaborator could not be reached in time. Transient; the loop holds. */
    UNAVAILABLE(false),
    /** A compare-and-swap lost against a concurrent writer. Retried, then treated as a hold. */
    CONFLICT(false),
    /** Some routing mechanisms accepted a weight change and others did not. */
    PARTIALLY_APPLIED(false),
    /** Threshold or controller settings out of range. The run never starts. */
    INVALID_CONFIGURATION(true),
    /** A rollback push could not be confirmed. Operator intervention required. */
    UNRECOVERABLE(true);

    private final boolean fatal;

    ErrorKind(boolean fatal) {
        this.fatal = fatal;
    }

    public boolean isFatal() {
        return fatal;
    }
}
