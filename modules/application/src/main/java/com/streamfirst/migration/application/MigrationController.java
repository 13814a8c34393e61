package com.streamfirst.migration.application;

import com.streamfirst.migration.domain.Alert;
import com.streamfirst.migration.domain.CollaboratorUnavailableException;
import com.streamfirst.migration.domain.ErrorKind;
import com.streamfirst.migration.domain.HealthSnapshot;
import com.streamfirst.migration.domain.MigrationError;
import com.streamfirst.migration.domain.MigrationId;
import com.streamfirst.migration.domain.MigrationPhase;
import com.streamfirst.migration.domain.MigrationRequest;
import com.streamfirst.migration.domain.MigrationState;
import com.streamfirst.migration.domain.Result;
import com.streamfirst.migration.domain.TrafficWeight;
import com.streamfirst.migration.domain.Verdict;
import com.streamfirst.migration.domain.VersionedState;
import com.streamfirst.migration.ports.AlertPort;
import com.streamfirst.migration.ports.WeightStorePort;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives one migration run through its lifecycle, one poll at a time.
 *
 * <p>Each {@link #step()} reads the stored state, samples health, evaluates the thresholds
 * and commits the resulting state with compare-and-swap before pushing any weight change to
 * routing. A lost compare-and-swap re-reads and re-evaluates the whole step. If the push
 * after a committed step fails, routing is brought back to the pre-step split wherever it may
 * have moved and a compensating write restores the state from before the step, so the store
 * never claims a split routing does not serve.
 *
 * <p>The step that reaches all-new traffic is the exception: COMPLETED is terminal, so routing
 * is pushed and confirmed first and COMPLETED is committed only afterwards.
 *
 * <p>{@link #run()} loops until the run is terminal or unrecoverable, waiting the poll
 * interval between steps. {@link #abort()} wakes the wait and turns the next step into a
 * rollback.
 */
@Slf4j
public class MigrationController {

    private final MigrationRequest request;
    private final WeightStorePort weightStore;
    private final MetricsClient metricsClient;
    private final ThresholdPolicy policy;
    private final TrafficRouterClient router;
    private final RollbackManager rollbackManager;
    private final AuditLog auditLog;
    private final AlertPort alertPort;
    private final Sleeper sleeper;
    private final Clock clock;

    private final ReentrantLock stepLock = new ReentrantLock();
    private final CountDownLatch abortSignal = new CountDownLatch(1);
    private volatile boolean abortRequested;
    private volatile boolean stoppedBeforeValidation;
    private volatile String pendingRollbackReason;
    private volatile VersionedState lastSeen;
    private volatile boolean interrupted;

    public MigrationController(MigrationRequest request,
                               VersionedState initial,
                               WeightStorePort weightStore,
                               MetricsClient metricsClient,
                               ThresholdPolicy policy,
                               TrafficRouterClient router,
                               RollbackManager rollbackManager,
                               AuditLog auditLog,
                               AlertPort alertPort,
                               Sleeper sleeper,
                               Clock clock) {
        this.request = request;
        this.lastSeen = initial;
        this.weightStore = weightStore;
        this.metricsClient = metricsClient;
        this.policy = policy;
        this.router = router;
        this.rollbackManager = rollbackManager;
        this.auditLog = auditLog;
        this.alertPort = alertPort;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Runs steps until the run reaches a terminal phase or cannot continue.
     *
     * @return SUCCESS once terminal, UNRECOVERABLE if a rollback or compensation could not
     *     be confirmed or the stored state is gone, INVALID_CONFIGURATION if the stored state
     *     cannot be started
     */
    public ExitCode run() {
        try {
            return loop();
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private ExitCode loop() {
        log.info("Starting migration {} ({}), step {}%, poll every {}s", id(), request.targets(),
                request.settings().stepSize(), request.thresholds().pollInterval().toSeconds());
        while (true) {
            Result<MigrationState> outcome;
            try {
                outcome = step();
            } catch (RuntimeException e) {
                log.error("Unexpected failure in step of {}", id(), e);
                outcome = Result.failure(ErrorKind.UNAVAILABLE, String.valueOf(e.getMessage()));
            }

            if (outcome.isFailureOf(ErrorKind.UNRECOVERABLE)) {
                log.error("Migration {} halted in phase {}: operator intervention required", id(),
                        lastSeen.state().getPhase());
                return ExitCode.UNRECOVERABLE;
            }
            if (outcome.isFailureOf(ErrorKind.INVALID_CONFIGURATION)) {
                return ExitCode.INVALID_CONFIGURATION;
            }
            if (outcome.isSuccess() && (outcome.orElseThrow().getPhase().isTerminal() || stoppedBeforeValidation)) {
                MigrationState last = outcome.orElseThrow();
                log.info("Migration {} finished in phase {} at {}", id(), last.getPhase(), last.getCurrentWeight());
                return ExitCode.SUCCESS;
            }
            pause(outcome.isFailure());
        }
    }

    /**
     * Performs one poll cycle. Never runs concurrently with itself.
     *
     * @return the state after the step, or the error that made the step hold
     * @throws IllegalStateException if called while another step is in progress
     */
    public Result<MigrationState> step() {
        if (!stepLock.tryLock()) {
            throw new IllegalStateException("Step already in progress for " + id());
        }
        try {
            Result<VersionedState> loaded = reload();
            if (loaded.isFailure()) {
                return reloadFailed(lastSeen.state(), null, loaded.getError().orElseThrow());
            }
            VersionedState current = loaded.orElseThrow();
            MigrationState state = current.state();
            if (state.getPhase().isTerminal() || stoppedBeforeValidation) {
                return Result.success(state);
            }
            if (abortRequested) {
                return abortRun(current);
            }
            if (pendingRollbackReason != null) {
                return rollback(current, null, pendingRollbackReason);
            }

            Result<HealthSnapshot> sample = metricsClient.sample(id());
            if (sample.isFailure()) {
                return hold(state, null, sample.getError().orElseThrow());
            }
            return evaluate(current, sample.orElseThrow());
        } finally {
            stepLock.unlock();
        }
    }

    /**
     * Requests cancellation. The next step rolls back to the last known-good split; a wait
     * between polls ends immediately. Has no effect on a finished run.
     */
    public void abort() {
        if (!abortRequested) {
            log.info("Abort requested for {}", id());
        }
        abortRequested = true;
        abortSignal.countDown();
    }

    public boolean isAbortRequested() {
        return abortRequested;
    }

    public MigrationId getMigrationId() {
        return id();
    }

    /** Most recently read or committed state. */
    public VersionedState getLastSeen() {
        return lastSeen;
    }

    private Result<MigrationState> evaluate(VersionedState current, HealthSnapshot snapshot) {
        int casRetryLimit = request.settings().casRetryLimit();
        for (int attempt = 0; ; attempt++) {
            MigrationState state = current.state();
            if (state.getPhase().isTerminal()) {
                return Result.success(state);
            }

            Result<MigrationState> outcome;
            if (state.getPhase() == MigrationPhase.INITIALIZING) {
                outcome = enterValidation(current, snapshot);
            } else {
                ThresholdPolicy.Decision decision = policy.decide(snapshot, state, request.thresholds());
                log.debug("{} in {} at {}: {} ({})", id(), state.getPhase(), state.getCurrentWeight(),
                        decision.verdict(), decision.reason());
                outcome = switch (decision.verdict()) {
                    case ROLLBACK -> rollback(current, snapshot, decision.reason());
                    case ADVANCE -> advance(current, snapshot, decision);
                    case HOLD -> recordHold(current, snapshot, decision);
                };
                if (decision.verdict() == Verdict.ROLLBACK) {
                    return outcome;
                }
            }

            if (!outcome.isFailureOf(ErrorKind.CONFLICT)) {
                return outcome;
            }
            if (attempt >= casRetryLimit) {
                String detail = "Lost " + (attempt + 1) + " compare-and-swap attempts at version " + current.version()
                                + ", holding";
                log.warn("{}: {}", id(), detail);
                alertPort.raise(new Alert(id(), Alert.Severity.WARNING, ErrorKind.CONFLICT, detail, clock.instant()));
                auditLog.error(state, snapshot, ErrorKind.CONFLICT, detail);
                return Result.failure(ErrorKind.CONFLICT, detail);
            }
            Result<VersionedState> reloaded = reload();
            if (reloaded.isFailure()) {
                return reloadFailed(state, snapshot, reloaded.getError().orElseThrow());
            }
            current = reloaded.orElseThrow();
            log.debug("CAS conflict for {}, re-evaluating against version {}", id(), current.version());
        }
    }

    private Result<MigrationState> enterValidation(VersionedState current, HealthSnapshot snapshot) {
        MigrationState state = current.state();
        if (!state.getCurrentWeight().isAllOld()) {
            String detail = "Run must start from " + TrafficWeight.ALL_OLD + " but stored split is " + state.getCurrentWeight();
            log.error("{}: {}", id(), detail);
            auditLog.error(state, snapshot, ErrorKind.INVALID_CONFIGURATION, detail);
            return Result.failure(ErrorKind.INVALID_CONFIGURATION, detail);
        }
        Result<TrafficWeight> pushed = router.apply(id(), TrafficWeight.ALL_OLD);
        if (pushed.isFailure()) {
            return hold(state, snapshot, pushed.getError().orElseThrow());
        }

        MigrationState next = state.transitionTo(MigrationPhase.VALIDATING, clock.instant());
        Result<VersionedState> committed = commit(current, next);
        if (committed.isFailure()) {
            return passConflictOrHold(state, snapshot, committed.getError().orElseThrow());
        }
        auditLog.verdict(state, next, snapshot, Verdict.HOLD, "First health sample received, validating new environment");
        log.info("{} entered VALIDATING at {}", id(), next.getCurrentWeight());
        return Result.success(next);
    }

    private Result<MigrationState> recordHold(VersionedState current, HealthSnapshot snapshot,
                                              ThresholdPolicy.Decision decision) {
        MigrationState state = current.state();
        MigrationState next = state.recordGoodPoll(clock.instant());
        Result<VersionedState> committed = commit(current, next);
        if (committed.isFailure()) {
            return passConflictOrHold(state, snapshot, committed.getError().orElseThrow());
        }
        auditLog.verdict(state, next, snapshot, Verdict.HOLD, decision.reason());
        return Result.success(next);
    }

    private Result<MigrationState> advance(VersionedState current, HealthSnapshot snapshot,
                                           ThresholdPolicy.Decision decision) {
        MigrationState state = current.state();
        if (state.getPhase() == MigrationPhase.VALIDATING) {
            MigrationState next = state.transitionTo(MigrationPhase.SHIFTING, clock.instant())
                    .withConsecutiveGoodPolls(0);
            Result<VersionedState> committed = commit(current, next);
            if (committed.isFailure()) {
                return passConflictOrHold(state, snapshot, committed.getError().orElseThrow());
            }
            auditLog.verdict(state, next, snapshot, Verdict.ADVANCE, "Validation passed: " + decision.reason());
            log.info("{} validated ({}), starting to shift traffic", id(), decision.reason());
            return Result.success(next);
        }

        MigrationState next = state.shiftStep(clock.instant());
        if (next.getPhase() == MigrationPhase.COMPLETED) {
            return complete(current, snapshot, decision, next);
        }
        Result<VersionedState> committed = commit(current, next);
        if (committed.isFailure()) {
            return passConflictOrHold(state, snapshot, committed.getError().orElseThrow());
        }
        Result<TrafficWeight> pushed = router.apply(id(), next.getCurrentWeight());
        if (pushed.isFailure()) {
            return compensate(committed.orElseThrow(), state, snapshot, pushed.getError().orElseThrow());
        }
        auditLog.verdict(state, next, snapshot, Verdict.ADVANCE, decision.reason());
        log.info("{} shifted {} -> {}", id(), state.getCurrentWeight(), next.getCurrentWeight());
        return Result.success(next);
    }

    /**
     * Last step to all-new traffic. Nothing may be committed after COMPLETED, so routing is
     * confirmed before the terminal state is written; if that write then fails, routing goes
     * back to the split the store still holds.
     */
    private Result<MigrationState> complete(VersionedState current, HealthSnapshot snapshot,
                                            ThresholdPolicy.Decision decision, MigrationState next) {
        MigrationState state = current.state();
        TrafficWeight target = next.getCurrentWeight();
        Result<TrafficWeight> pushed = router.apply(id(), target);
        if (pushed.isFailure()) {
            MigrationError pushError = pushed.getError().orElseThrow();
            if (pushError.kind() == ErrorKind.PARTIALLY_APPLIED) {
                Result<TrafficWeight> restored = restoreRouting(state, snapshot, target, state.getCurrentWeight());
                if (restored.isFailure()) {
                    return Result.failure(restored.getError().orElseThrow());
                }
            }
            return hold(state, snapshot, pushError);
        }

        Result<VersionedState> committed = commit(current, next);
        if (committed.isFailure()) {
            MigrationError commitError = committed.getError().orElseThrow();
            TrafficWeight stored = storedWeightOr(state.getCurrentWeight());
            log.warn("{} at {} but COMPLETED not committed ({}), returning routing to {}", id(), target,
                    commitError, stored);
            Result<TrafficWeight> restored = restoreRouting(state, snapshot, target, stored);
            if (restored.isFailure()) {
                return Result.failure(restored.getError().orElseThrow());
            }
            return passConflictOrHold(state, snapshot, commitError);
        }
        auditLog.verdict(state, next, snapshot, Verdict.ADVANCE, decision.reason());
        log.info("{} shifted {} -> {}", id(), state.getCurrentWeight(), target);
        log.info("{} completed: all traffic on {}", id(), request.targets().newTarget());
        return Result.success(next);
    }

    /**
     * Undoes a committed step whose routing push failed. Unless every mechanism rejected the
     * write, the pre-step weight is re-applied first; then the pre-step state is written back.
     */
    private Result<MigrationState> compensate(VersionedState committed, MigrationState before,
                                              HealthSnapshot snapshot, MigrationError pushError) {
        TrafficWeight attempted = committed.state().getCurrentWeight();
        TrafficWeight restore = before.getCurrentWeight();
        if (pushError.kind() != ErrorKind.UNAVAILABLE) {
            Result<TrafficWeight> restored = restoreRouting(committed.state(), snapshot, attempted, restore);
            if (restored.isFailure()) {
                return Result.failure(restored.getError().orElseThrow());
            }
        }

        Result<VersionedState> reverted = commit(committed, before.withUpdatedAt(clock.instant()));
        if (reverted.isFailure()) {
            return unrecoverable(committed.state(), snapshot, "Push of " + attempted + " failed and the stored split"
                    + " could not be reverted to " + restore + ": " + reverted.getError().orElseThrow().message());
        }
        String detail = "Push of " + attempted + " failed, reverted to " + restore + ": " + pushError.message();
        log.warn("{}: {}", id(), detail);
        auditLog.error(before, snapshot, pushError.kind(), detail);
        return Result.failure(pushError);
    }

    /**
     * Re-applies {@code restore} after a push of {@code attempted} that may have reached some
     * mechanisms. Failing that, routing state is unknown and the run is unrecoverable.
     */
    private Result<TrafficWeight> restoreRouting(MigrationState state, HealthSnapshot snapshot,
                                                 TrafficWeight attempted, TrafficWeight restore) {
        Result<TrafficWeight> restored = rollbackManager.pushWithRetry(id(), restore);
        if (restored.isFailure()) {
            Result<MigrationState> halted = unrecoverable(state, snapshot, "Routing diverged applying " + attempted
                    + " and " + restore + " could not be re-applied: " + restored.getError().orElseThrow().message());
            return Result.failure(halted.getError().orElseThrow());
        }
        return restored;
    }

    private TrafficWeight storedWeightOr(TrafficWeight fallback) {
        try {
            return weightStore.read(id()).map(stored -> stored.state().getCurrentWeight()).orElse(fallback);
        } catch (CollaboratorUnavailableException e) {
            log.warn("Cannot re-read state of {}, assuming {}: {}", id(), fallback, e.getMessage());
            return fallback;
        }
    }

    private Result<MigrationState> rollback(VersionedState current, HealthSnapshot snapshot, String reason) {
        Result<VersionedState> result = rollbackManager.rollback(current, snapshot, reason);
        if (result.isSuccess()) {
            pendingRollbackReason = null;
            lastSeen = result.orElseThrow();
            return Result.success(result.orElseThrow().state());
        }
        MigrationError error = result.getError().orElseThrow();
        if (error.kind() != ErrorKind.UNRECOVERABLE) {
            pendingRollbackReason = reason;
            log.warn("Rollback of {} pending: {}", id(), error.message());
        }
        return Result.failure(error);
    }

    private Result<MigrationState> abortRun(VersionedState current) {
        MigrationState state = current.state();
        if (state.getPhase() == MigrationPhase.INITIALIZING) {
            auditLog.verdict(state, state, null, Verdict.ROLLBACK, "Operator abort before validation, no traffic moved");
            stoppedBeforeValidation = true;
            log.info("{} aborted before validation at {}", id(), state.getCurrentWeight());
            return Result.success(state);
        }
        return rollback(current, null, "Operator abort");
    }

    private Result<MigrationState> unrecoverable(MigrationState state, HealthSnapshot snapshot, String detail) {
        log.error("{}: {}", id(), detail);
        alertPort.raise(new Alert(id(), Alert.Severity.CRITICAL, ErrorKind.UNRECOVERABLE, detail, clock.instant()));
        auditLog.error(state, snapshot, ErrorKind.UNRECOVERABLE, detail);
        return Result.failure(ErrorKind.UNRECOVERABLE, detail);
    }

    /** Transient error: audit it and keep the stored state as it is. */
    private Result<MigrationState> hold(MigrationState state, HealthSnapshot snapshot, MigrationError error) {
        log.warn("{} holding at {} in {}: {}", id(), state.getCurrentWeight(), state.getPhase(), error);
        auditLog.error(state, snapshot, error.kind(), error.message());
        return Result.failure(error);
    }

    private Result<MigrationState> reloadFailed(MigrationState state, HealthSnapshot snapshot, MigrationError error) {
        if (error.kind() == ErrorKind.UNRECOVERABLE) {
            return unrecoverable(state, snapshot, error.message());
        }
        return hold(state, snapshot, error);
    }

    private Result<MigrationState> passConflictOrHold(MigrationState state, HealthSnapshot snapshot, MigrationError error) {
        if (error.kind() == ErrorKind.CONFLICT) {
            return Result.failure(error);
        }
        return hold(state, snapshot, error);
    }

    private Result<VersionedState> commit(VersionedState current, MigrationState next) {
        Result<VersionedState> result;
        try {
            result = weightStore.compareAndSwap(id(), current.version(), next);
        } catch (CollaboratorUnavailableException e) {
            return Result.failure(MigrationError.unavailable("State store unavailable: " + e.getMessage()));
        }
        result.onSuccess(committed -> lastSeen = committed);
        return result;
    }

    /**
     * Reads the stored state. A missing row means the run can no longer be tracked, which is
     * unrecoverable rather than transient.
     */
    private Result<VersionedState> reload() {
        Optional<VersionedState> current;
        try {
            current = weightStore.read(id());
        } catch (CollaboratorUnavailableException e) {
            return Result.failure(MigrationError.unavailable("State store unavailable: " + e.getMessage()));
        }
        if (current.isEmpty()) {
            return Result.failure(ErrorKind.UNRECOVERABLE, "No state stored for " + id() + " any more");
        }
        lastSeen = current.get();
        return Result.success(current.get());
    }

    /**
     * Waits for the next poll. An abort ends the wait early; once aborting, a failed step is
     * retried after one poll interval instead. An interrupt requests an abort; the flag is
     * cleared so the rollback can still block on collaborators, and {@link #run()} sets it
     * again on exit.
     */
    private void pause(boolean lastStepFailed) {
        Duration interval = request.thresholds().pollInterval();
        try {
            if (!abortRequested) {
                abortSignal.await(interval.toMillis(), TimeUnit.MILLISECONDS);
            } else if (lastStepFailed) {
                sleeper.sleep(interval);
            }
        } catch (InterruptedException e) {
            log.warn("Loop of {} interrupted, rolling back", id());
            interrupted = true;
            abort();
        }
    }

    private MigrationId id() {
        return request.migrationId();
    }
}
