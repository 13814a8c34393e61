package com.streamfirst.migration.domain;

import java.util.Objects;

/**
 * A typed failure carried by {@link Result}.
 *
 * @param kind the error category
 * @param message human readable description
 */
public record MigrationError(ErrorKind kind, String message) {
    public MigrationError {
        Objects.requireNonNull(kind, "Error kind cannot be null");
        Objects.requireNonNull(message, "Error message cannot be null");
    }

    public static MigrationError unavailable(String message) {
        return new MigrationError(ErrorKind.UNAVAILABLE, message);
    }

    public static MigrationError conflict(String message) {
        return new MigrationError(ErrorKind.CONFLICT, message);
    }

    public static MigrationError invalidConfiguration(String message) {
        return new MigrationError(ErrorKind.INVALID_CONFIGURATION, message);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
