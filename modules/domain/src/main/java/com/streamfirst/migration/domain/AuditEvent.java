package com.streamfirst.migration.domain;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.Optional;

/**
 * One entry of the append-only audit trail. Every evaluated poll, committed transition and
 * handled error produces exactly one event. Events carry either a verdict or an error kind.
 */
@Value
@EqualsAndHashCode(of = {"migrationId", "sequenceNumber"})
public class AuditEvent {
    /** Strictly increasing per migration; assigned when the event is appended */
    @With long sequenceNumber;

    @NonNull MigrationId migrationId;

    /** Phase after the event took effect */
    @NonNull MigrationPhase phase;

    @NonNull TrafficWeight weightBefore;

    @NonNull TrafficWeight weightAfter;

    /** Snapshot that drove the decision, absent for errors raised before sampling */
    HealthSnapshot triggeringSnapshot;

    Verdict verdict;

    ErrorKind errorKind;

    @NonNull String detail;

    @NonNull Instant timestamp;

    /**
     * Creates an unsequenced event recording a verdict.
     */
    public static AuditEvent ofVerdict(MigrationId migrationId, MigrationPhase phase,
                                       TrafficWeight weightBefore, TrafficWeight weightAfter,
                                       HealthSnapshot snapshot, @NonNull Verdict verdict,
                                       String detail, Instant timestamp) {
        return new AuditEvent(0L, migrationId, phase, weightBefore, weightAfter, snapshot, verdict,
                null, detail, timestamp);
    }

    /**
     * Creates an unsequenced event recording an error in place of a verdict.
     */
    public static AuditEvent ofError(MigrationId migrationId, MigrationPhase phase,
                                     TrafficWeight weightBefore, TrafficWeight weightAfter,
                                     HealthSnapshot snapshot, @NonNull ErrorKind errorKind,
                                     String detail, Instant timestamp) {
        return new AuditEvent(0L, migrationId, phase, weightBefore, weightAfter, snapshot, null,
                errorKind, detail, timestamp);
    }

    public Optional<HealthSnapshot> getSnapshot() {
        return Optional.ofNullable(triggeringSnapshot);
    }

    public boolean isError() {
        return errorKind != null;
    }

    public boolean changedWeight() {
        return !weightBefore.equals(weightAfter);
    }

    /**
     * The verdict or error kind name, whichever this event carries.
     */
    public String outcome() {
        return errorKind != null ? errorKind.name() : verdict.name();
    }

    @Override
    public String toString() {
        return "AuditEvent{" +
               "seq=" + sequenceNumber +
               ", migrationId=" + migrationId +
               ", phase=" + phase +
               ", weight=" + weightBefore + "->" + weightAfter +
               ", outcome=" + outcome() +
               ", detail='" + detail + '\'' +
               '}';
    }
}
