package com.streamfirst.migration.application;

import com.streamfirst.migration.domain.Alert;
import com.streamfirst.migration.domain.BackoffPolicy;
import com.streamfirst.migration.domain.CollaboratorUnavailableException;
import com.streamfirst.migration.domain.ErrorKind;
import com.streamfirst.migration.domain.HealthSnapshot;
import com.streamfirst.migration.domain.MigrationId;
import com.streamfirst.migration.domain.MigrationState;
import com.streamfirst.migration.domain.Result;
import com.streamfirst.migration.domain.TrafficWeight;
import com.streamfirst.migration.domain.Verdict;
import com.streamfirst.migration.domain.VersionedState;
import com.streamfirst.migration.ports.AlertPort;
import com.streamfirst.migration.ports.WeightStorePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Restores the last known-good split. Routing is pushed first, with retries at exponential
 * backoff; the ROLLED_BACK state is committed only once every mechanism confirmed the split.
 * If the push cannot be confirmed the stored phase is left untouched and a critical alert is
 * raised, since the actual traffic split is then unknown.
 */
@Slf4j
@RequiredArgsConstructor
public class RollbackManager {

    private final WeightStorePort weightStore;
    private final TrafficRouterClient router;
    private final AuditLog auditLog;
    private final AlertPort alertPort;
    private final BackoffPolicy backoff;
    private final int casRetryLimit;
    private final Sleeper sleeper;
    private final Clock clock;

    /**
     * Rolls the run back to its last known-good weight.
     *
     * @param current the state and version the decision was based on
     * @param trigger the snapshot that breached a threshold, or null for an operator abort
     * @param reason audit detail
     * @return the committed ROLLED_BACK state; UNRECOVERABLE if routing could not be
     *     confirmed; UNAVAILABLE or CONFLICT if routing was restored but the state could not
     *     be committed yet
     */
    public Result<VersionedState> rollback(VersionedState current, HealthSnapshot trigger, String reason) {
        return rollback(current, trigger, reason, casRetryLimit);
    }

    private Result<VersionedState> rollback(VersionedState current, HealthSnapshot trigger, String reason,
                                            int conflictsLeft) {
        MigrationState state = current.state();
        MigrationId id = state.getMigrationId();
        if (!state.getPhase().isRollbackEligible()) {
            throw new IllegalStateException("Cannot roll back " + id + " from phase " + state.getPhase());
        }
        TrafficWeight target = state.getLastGoodWeight();
        log.warn("Rolling back {} from {} to {}: {}", id, state.getCurrentWeight(), target, reason);

        Result<TrafficWeight> pushed = pushWithRetry(id, target);
        if (pushed.isFailure()) {
            String detail = "Rollback to " + target + " not confirmed after " + backoff.totalAttempts()
                            + " attempts (" + pushed.getError().orElseThrow().message() + "); trigger: " + reason;
            log.error("Unrecoverable rollback failure for {}: {}", id, detail);
            alertPort.raise(new Alert(id, Alert.Severity.CRITICAL, ErrorKind.UNRECOVERABLE, detail, clock.instant()));
            auditLog.error(state, trigger, ErrorKind.UNRECOVERABLE, detail);
            return Result.failure(ErrorKind.UNRECOVERABLE, detail);
        }

        MigrationState rolledBack = state.rolledBack(clock.instant());
        Result<VersionedState> committed;
        try {
            committed = weightStore.compareAndSwap(id, current.version(), rolledBack);
        } catch (CollaboratorUnavailableException e) {
            String detail = "Traffic restored to " + target + " but state store unavailable: " + e.getMessage();
            log.warn("Rollback commit for {} deferred: {}", id, detail);
            auditLog.error(state, trigger, ErrorKind.UNAVAILABLE, detail);
            return Result.failure(ErrorKind.UNAVAILABLE, detail);
        }

        if (committed.isFailure()) {
            if (conflictsLeft <= 0) {
                String detail = "Traffic restored to " + target + " but ROLLED_BACK lost " + (casRetryLimit + 1)
                                + " compare-and-swap attempts";
                log.warn("Rollback commit for {} gave up: {}", id, detail);
                alertPort.raise(new Alert(id, Alert.Severity.WARNING, ErrorKind.CONFLICT, detail, clock.instant()));
                auditLog.error(state, trigger, ErrorKind.CONFLICT, detail);
                return Result.failure(ErrorKind.CONFLICT, detail);
            }
            Optional<VersionedState> reread;
            try {
                reread = weightStore.read(id);
            } catch (CollaboratorUnavailableException e) {
                auditLog.error(state, trigger, ErrorKind.UNAVAILABLE, "State store unavailable: " + e.getMessage());
                return Result.failure(ErrorKind.UNAVAILABLE, e.getMessage());
            }
            if (reread.isEmpty()) {
                String detail = "Traffic restored to " + target + " but the stored state of " + id + " is gone";
                log.error("Unrecoverable rollback failure for {}: {}", id, detail);
                alertPort.raise(new Alert(id, Alert.Severity.CRITICAL, ErrorKind.UNRECOVERABLE, detail, clock.instant()));
                auditLog.error(state, trigger, ErrorKind.UNRECOVERABLE, detail);
                return Result.failure(ErrorKind.UNRECOVERABLE, detail);
            }
            if (reread.get().state().getPhase().isTerminal()) {
                log.info("{} already {} when committing rollback", id, reread.get().state().getPhase());
                return Result.success(reread.get());
            }
            log.debug("Rollback commit for {} conflicted, retrying against version {}", id, reread.get().version());
            return rollback(reread.get(), trigger, reason, conflictsLeft - 1);
        }

        auditLog.verdict(state, rolledBack, trigger, Verdict.ROLLBACK, reason);
        log.info("{} rolled back to {} ({})", id, target, reason);
        return committed;
    }

    /**
     * Applies the split, retrying failed attempts with the configured backoff.
     *
     * @return the confirmed split, or the failure of the last attempt
     */
    public Result<TrafficWeight> pushWithRetry(MigrationId id, TrafficWeight weight) {
        Result<TrafficWeight> result = router.apply(id, weight);
        for (int retry = 1; result.isFailure() && retry <= backoff.maxRetries(); retry++) {
            Duration delay = backoff.delayBefore(retry);
            log.warn("Push of {} for {} failed ({}), retry {}/{} in {}ms", weight, id,
                    result.getError().orElseThrow(), retry, backoff.maxRetries(), delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Retry backoff for {} interrupted after {} attempts", id, retry);
                return result;
            }
            result = router.apply(id, weight);
        }
        return result;
    }
}
