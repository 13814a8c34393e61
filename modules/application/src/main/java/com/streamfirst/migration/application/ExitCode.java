package com.streamfirst.migration.application;

/**
 * Process exit status of a migration run.
 */
public enum ExitCode {
    /** Completed, rolled back cleanly, or stopped in a steady state */
    SUCCESS(0),
    /** Thresholds or settings rejected; the run never started */
    INVALID_CONFIGURATION(1),
    /** A rollback could not be confirmed; traffic needs manual attention */
    UNRECOVERABLE(2);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
