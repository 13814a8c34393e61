package com.streamfirst.migration.domain;

/**
 * Outcome of evaluating one health snapshot against the thresholds.
 */
public enum Verdict {
    /** Enough consecutive healthy polls; move to the next step */
    ADVANCE,
    /** Healthy but the window is not complete yet */
    HOLD,
    /** A threshold was breached; restore the last known-good weight */
    ROLLBACK
}
