package com.streamfirst.migration.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Operator notification raised when the controller cannot resolve a condition on its own.
 *
 * @param migrationId the affected run
 * @param severity how urgently an operator must act
 * @param kind the error that caused the alert
 * @param message human readable description
 * @param raisedAt when the alert was raised
 */
public record Alert(MigrationId migrationId, Severity severity, ErrorKind kind, String message, Instant raisedAt) {

    public enum Severity {
        /** Degraded but self-healing, e.g. repeated CAS conflicts */
        WARNING,
        /** Traffic state unknown; needs manual intervention */
        CRITICAL
    }

    public Alert {
        Objects.requireNonNull(migrationId, "Migration ID cannot be null");
        Objects.requireNonNull(severity, "Severity cannot be null");
        Objects.requireNonNull(kind, "Error kind cannot be null");
        Objects.requireNonNull(message, "Message cannot be null");
        Objects.requireNonNull(raisedAt, "Raised-at time cannot be null");
    }
}
