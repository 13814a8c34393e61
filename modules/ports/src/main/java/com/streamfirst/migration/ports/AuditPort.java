package com.streamfirst.migration.ports;

import com.streamfirst.migration.domain.AuditEvent;
import com.streamfirst.migration.domain.MigrationId;

import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Port for the append-only audit trail. Events are never updated or removed.
 */
public interface AuditPort {

    /**
     * Appends an already sequenced event.
     *
     * @param event the event to persist
     * @throws RuntimeException if the event cannot be written
     */
    void append(AuditEvent event);

    /**
     * Gets all events matching the predicate.
     *
     * @param predicate filter applied to each stored event
     * @return matching events in append order
     */
    List<AuditEvent> getEvents(Predicate<AuditEvent> predicate);

    /**
     * Gets the trail of one run ordered by sequence number.
     */
    default List<AuditEvent> getEvents(MigrationId migrationId) {
        return getEvents(event -> event.getMigrationId().equals(migrationId)).stream()
                .sorted(Comparator.comparingLong(AuditEvent::getSequenceNumber))
                .collect(Collectors.toList());
    }

    /**
     * Highest sequence number recorded for the run, or 0 if it has no events.
     */
    default long lastSequenceNumber(MigrationId migrationId) {
        return getEvents(event -> event.getMigrationId().equals(migrationId)).stream()
                .mapToLong(AuditEvent::getSequenceNumber)
                .max()
                .orElse(0L);
    }
}
