package com.streamfirst.migration.application;

import com.streamfirst.migration.domain.AuditEvent;
import com.streamfirst.migration.domain.CollaboratorUnavailableException;
import com.streamfirst.migration.domain.ErrorKind;
import com.streamfirst.migration.domain.MigrationError;
import com.streamfirst.migration.domain.MigrationId;
import com.streamfirst.migration.domain.MigrationRequest;
import com.streamfirst.migration.domain.MigrationState;
import com.streamfirst.migration.domain.Result;
import com.streamfirst.migration.domain.VersionedState;
import com.streamfirst.migration.ports.AlertPort;
import com.streamfirst.migration.ports.AuditPort;
import com.streamfirst.migration.ports.MetricsPort;
import com.streamfirst.migration.ports.RoutingPort;
import com.streamfirst.migration.ports.WeightStorePort;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Control surface for migration runs: start, observe, abort and wait. Each run gets its own
 * controller on a dedicated worker thread; collaborator calls run on a shared pool so they
 * can be abandoned on timeout.
 *
 * <p>A run whose stored state is not terminal is resumed by {@link #start}, which lets a
 * restarted process pick up where the previous one stopped.
 */
@Slf4j
public class MigrationService implements AutoCloseable {

  private final WeightStorePort weightStore;
  private final MetricsPort metricsPort;
  private final List<RoutingPort> routingPorts;
  private final AlertPort alertPort;
  private final AuditLog auditLog;
  private final ThresholdPolicy policy = new ThresholdPolicy();
  private final Sleeper sleeper;
  private final Clock clock;
  private final ExecutorService callExecutor;
  private final Map<MigrationId, RunHandle> runs = new ConcurrentHashMap<>();

  private record RunHandle(MigrationController controller, ExecutorService worker, Future<ExitCode> exit) {}

  public MigrationService(WeightStorePort weightStore,
                          MetricsPort metricsPort,
                          List<RoutingPort> routingPorts,
                          AuditPort auditPort,
                          AlertPort alertPort,
                          Sleeper sleeper,
                          Clock clock) {
    if (routingPorts.isEmpty()) {
      throw new IllegalArgumentException("At least one routing mechanism is required");
    }
    this.weightStore = weightStore;
    this.metricsPort = metricsPort;
    this.routingPorts = List.copyOf(routingPorts);
    this.alertPort = alertPort;
    this.auditLog = new AuditLog(auditPort, clock);
    this.sleeper = sleeper;
    this.clock = clock;
    this.callExecutor = Executors.newCachedThreadPool(daemonThreads("migration-io-"));
  }

  /**
   * Starts, or resumes, a run.
   *
   * @return the state the run starts from; CONFLICT if the run is already active in this
   *     process or already finished; UNAVAILABLE if the state store cannot be reached
   */
  public synchronized Result<MigrationState> start(MigrationRequest request) {
    MigrationId id = request.migrationId();
    RunHandle existing = runs.get(id);
    if (existing != null && !existing.exit().isDone()) {
      log.warn("Refusing to start {}: already running", id);
      return Result.failure(MigrationError.conflict("Migration " + id + " is already running"));
    }

    Result<VersionedState> initial;
    try {
      initial = loadOrInitialize(request);
    } catch (CollaboratorUnavailableException e) {
      log.warn("Cannot start {}: {}", id, e.getMessage());
      return Result.failure(MigrationError.unavailable(e.getMessage()));
    }
    if (initial.isFailure()) {
      return Result.failure(initial.getError().orElseThrow());
    }

    MigrationController controller = newController(request, initial.orElseThrow());
    ExecutorService worker = Executors.newSingleThreadExecutor(daemonThreads("migration-" + id + "-"));
    Future<ExitCode> exit = worker.submit(controller::run);
    worker.shutdown();
    runs.put(id, new RunHandle(controller, worker, exit));
    return Result.success(initial.orElseThrow().state());
  }

  /**
   * The last committed state of a run, read from the store.
   */
  public Optional<MigrationState> status(MigrationId id) {
    return weightStore.read(id).map(VersionedState::state);
  }

  /**
   * Signals a running run to roll back and stop.
   *
   * @return true if an active run in this process was signalled
   */
  public boolean abort(MigrationId id) {
    RunHandle handle = runs.get(id);
    if (handle == null || handle.exit().isDone()) {
      log.info("Abort of {} ignored: no active run", id);
      return false;
    }
    handle.controller().abort();
    return true;
  }

  /**
   * Signals every active run to roll back.
   *
   * @return ids of the runs that were signalled
   */
  public List<MigrationId> abortAll() {
    return runs.keySet().stream().filter(this::abort).toList();
  }

  /**
   * Waits for a run to finish.
   *
   * @return the exit code, or empty if the run is unknown or still running after the timeout
   */
  public Optional<ExitCode> awaitTermination(MigrationId id, Duration timeout) throws InterruptedException {
    RunHandle handle = runs.get(id);
    if (handle == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(handle.exit().get(timeout.toMillis(), TimeUnit.MILLISECONDS));
    } catch (TimeoutException e) {
      return Optional.empty();
    } catch (ExecutionException e) {
      log.error("Run {} terminated abnormally", id, e.getCause());
      return Optional.of(ExitCode.UNRECOVERABLE);
    }
  }

  /**
   * The ordered audit trail of a run.
   */
  public List<AuditEvent> history(MigrationId id) {
    return auditLog.history(id);
  }

  public List<MigrationId> activeRuns() {
    return runs.entrySet().stream()
        .filter(entry -> !entry.getValue().exit().isDone())
        .map(Map.Entry::getKey)
        .toList();
  }

  /**
   * Stops all worker threads without rolling back. Use {@link #abortAll()} first for an
   * orderly shutdown.
   */
  @Override
  public void close() {
    runs.values().forEach(handle -> handle.worker().shutdownNow());
    callExecutor.shutdownNow();
  }

  private Result<VersionedState> loadOrInitialize(MigrationRequest request) {
    MigrationId id = request.migrationId();
    MigrationState fresh = MigrationState.initial(id, request.settings().stepSize(), clock.instant());
    Result<VersionedState> created = weightStore.initialize(fresh);
    if (created.isSuccess()) {
      log.info("Created migration {} ({})", id, request.targets());
      return created;
    }
    if (!created.isFailureOf(ErrorKind.CONFLICT)) {
      return created;
    }
    Optional<VersionedState> stored = weightStore.read(id);
    if (stored.isEmpty()) {
      return Result.failure(MigrationError.conflict("State of " + id + " changed during start, retry"));
    }
    MigrationState state = stored.get().state();
    if (state.getPhase().isTerminal()) {
      log.warn("Refusing to start {}: already {}", id, state.getPhase());
      return Result.failure(MigrationError.conflict("Migration " + id + " already " + state.getPhase()));
    }
    log.info("Resuming migration {} in {} at {}", id, state.getPhase(), state.getCurrentWeight());
    return Result.success(stored.get());
  }

  private MigrationController newController(MigrationRequest request, VersionedState initial) {
    var settings = request.settings();
    var metricsClient = new MetricsClient(metricsPort, settings.metricsTimeout(), clock, callExecutor);
    var router = new TrafficRouterClient(routingPorts, request.targets(), settings.routingTimeout(), callExecutor);
    var rollbackManager = new RollbackManager(weightStore, router, auditLog, alertPort,
        settings.rollbackBackoff(), settings.casRetryLimit(), sleeper, clock);
    return new MigrationController(request, initial, weightStore, metricsClient, policy, router,
        rollbackManager, auditLog, alertPort, sleeper, clock);
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
