package com.streamfirst.migration.domain;

import java.util.Objects;

/**
 * Unique identifier for a migration run. All state, metrics, routing and audit records
 * are keyed by it.
 *
 * @param value the run identifier (e.g. "orders-db-cutover-2024-06")
 */
public record MigrationId(String value) {
  public MigrationId {
    Objects.requireNonNull(value, "Migration ID cannot be null");
    if (value.trim().isEmpty()) {
      throw new IllegalArgumentException("Migration ID cannot be empty");
    }
  }

  @Override
  public String toString() {
    return value;
  }
}
