package com.streamfirst.migration.application;

import com.streamfirst.migration.domain.AuditEvent;
import com.streamfirst.migration.domain.ErrorKind;
import com.streamfirst.migration.domain.HealthSnapshot;
import com.streamfirst.migration.domain.MigrationId;
import com.streamfirst.migration.domain.MigrationState;
import com.streamfirst.migration.domain.TrafficWeight;
import com.streamfirst.migration.domain.Verdict;
import com.streamfirst.migration.ports.AuditPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns sequence numbers and appends events to the audit trail. Numbering continues from
 * whatever the trail already holds, so a restarted process never reuses a number.
 */
@Slf4j
@RequiredArgsConstructor
public class AuditLog {

    private final AuditPort auditPort;
    private final Clock clock;
    private final Map<MigrationId, Long> lastSequence = new HashMap<>();

    /**
     * Records a verdict. {@code before} and {@code after} are the states on either side of
     * the committed change; they are the same object for a verdict that changed nothing.
     */
    public AuditEvent verdict(MigrationState before, MigrationState after, HealthSnapshot snapshot,
                              Verdict verdict, String detail) {
        return append(AuditEvent.ofVerdict(after.getMigrationId(), after.getPhase(), before.getCurrentWeight(),
                after.getCurrentWeight(), snapshot, verdict, detail, clock.instant()));
    }

    /**
     * Records an error in place of a verdict.
     */
    public AuditEvent error(MigrationState state, HealthSnapshot snapshot, ErrorKind kind, String detail) {
        TrafficWeight weight = state.getCurrentWeight();
        return append(AuditEvent.ofError(state.getMigrationId(), state.getPhase(), weight, weight, snapshot,
                kind, detail, clock.instant()));
    }

    /**
     * Sequences and appends an event. Sequence numbers are only consumed by appends that
     * succeed.
     */
    public synchronized AuditEvent append(AuditEvent unsequenced) {
        MigrationId id = unsequenced.getMigrationId();
        long next = lastSequence.computeIfAbsent(id, auditPort::lastSequenceNumber) + 1;
        AuditEvent event = unsequenced.withSequenceNumber(next);
        auditPort.append(event);
        lastSequence.put(id, next);
        log.debug("Audit #{} {}", next, event);
        return event;
    }

    /**
     * The full trail of one run, oldest first.
     */
    public List<AuditEvent> history(MigrationId migrationId) {
        return auditPort.getEvents(migrationId);
    }
}
