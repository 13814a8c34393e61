package com.streamfirst.migration.application;

import com.streamfirst.migration.adapters.InMemoryAlertAdapter;
import com.streamfirst.migration.adapters.InMemoryAuditAdapter;
import com.streamfirst.migration.adapters.InMemoryMetricsAdapter;
import com.streamfirst.migration.adapters.InMemoryRoutingAdapter;
import com.streamfirst.migration.domain.Alert;
import com.streamfirst.migration.domain.AuditEvent;
import com.streamfirst.migration.domain.BackoffPolicy;
import com.streamfirst.migration.domain.ControllerSettings;
import com.streamfirst.migration.domain.ErrorKind;
import com.streamfirst.migration.domain.MigrationId;
import com.streamfirst.migration.domain.MigrationPhase;
import com.streamfirst.migration.domain.MigrationRequest;
import com.streamfirst.migration.domain.MigrationState;
import com.streamfirst.migration.domain.Result;
import com.streamfirst.migration.domain.TargetPair;
import com.streamfirst.migration.domain.ThresholdConfig;
import com.streamfirst.migration.domain.TrafficWeight;
import com.streamfirst.migration.domain.Verdict;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class MigrationControllerTest {

  private static final MigrationId ID = new MigrationId("orders-cutover");
  private static final TargetPair TARGETS = new TargetPair("blue", "green");
  private static final Instant NOW = Instant.parse("2024-06-01T10:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  private final ScriptedWeightStore store = new ScriptedWeightStore();
  private final InMemoryMetricsAdapter metrics = new InMemoryMetricsAdapter();
  private final InMemoryRoutingAdapter alb = new InMemoryRoutingAdapter("alb");
  private final InMemoryRoutingAdapter dns = new InMemoryRoutingAdapter("dns");
  private final InMemoryAuditAdapter audit = new InMemoryAuditAdapter();
  private final InMemoryAlertAdapter alerts = new InMemoryAlertAdapter();
  private final RecordingSleeper sleeper = new RecordingSleeper();
  private final ExecutorService executor = Executors.newCachedThreadPool();

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void first_healthy_sample_enters_validation_at_all_old() {
    var controller = controller(20, 3);

    var result = controller.step();

    assertThat(result.orElseThrow().getPhase()).isEqualTo(MigrationPhase.VALIDATING);
    assertThat(alb.getWriteHistory()).containsExactly(TrafficWeight.ALL_OLD);
    assertThat(dns.getWriteHistory()).containsExactly(TrafficWeight.ALL_OLD);
    assertThat(audit.getEvents(ID)).singleElement()
        .extracting(AuditEvent::getVerdict).isEqualTo(Verdict.HOLD);
  }

  @Test
  void validation_window_must_pass_before_traffic_moves() {
    var controller = controller(20, 2);

    var afterValidation = steps(controller, 3);
    assertThat(afterValidation.getPhase()).isEqualTo(MigrationPhase.SHIFTING);
    assertThat(afterValidation.getCurrentWeight()).isEqualTo(TrafficWeight.ALL_OLD);
    assertThat(alb.getWriteHistory()).containsExactly(TrafficWeight.ALL_OLD);

    var afterFirstShift = steps(controller, 2);
    assertThat(afterFirstShift.getCurrentWeight()).isEqualTo(new TrafficWeight(80, 20));
    assertThat(afterFirstShift.getLastGoodWeight()).isEqualTo(TrafficWeight.ALL_OLD);
    assertThat(alb.getWriteHistory()).containsExactly(TrafficWeight.ALL_OLD, new TrafficWeight(80, 20));
  }

  @Test
  void healthy_run_completes_and_stops_moving_traffic() {
    var controller = controller(50, 1);

    var completed = steps(controller, 4);
    var afterCompletion = controller.step();

    assertThat(completed.getPhase()).isEqualTo(MigrationPhase.COMPLETED);
    assertThat(afterCompletion.orElseThrow()).isEqualTo(completed);
    assertThat(alb.getWriteHistory())
        .containsExactly(TrafficWeight.ALL_OLD, new TrafficWeight(50, 50), TrafficWeight.ALL_NEW);
    assertThat(audit.getEvents(ID)).extracting(AuditEvent::getSequenceNumber).containsExactly(1L, 2L, 3L, 4L);
    assertThat(audit.getEvents(ID)).extracting(AuditEvent::getVerdict)
        .containsExactly(Verdict.HOLD, Verdict.ADVANCE, Verdict.ADVANCE, Verdict.ADVANCE);
  }

  @Test
  void error_rate_breach_rolls_back_to_last_good_split() {
    var controller = controller(20, 1);
    assertThat(steps(controller, 4).getCurrentWeight()).isEqualTo(new TrafficWeight(60, 40));

    metrics.setReading(ID, new InMemoryMetricsAdapter.Reading(100L, 5.0, 4, 4));
    var result = controller.step();

    var rolledBack = result.orElseThrow();
    assertThat(rolledBack.getPhase()).isEqualTo(MigrationPhase.ROLLED_BACK);
    assertThat(rolledBack.getCurrentWeight()).isEqualTo(new TrafficWeight(80, 20));
    assertThat(alb.getApplied(ID)).contains(new TrafficWeight(80, 20));
    assertThat(dns.getApplied(ID)).contains(new TrafficWeight(80, 20));

    var last = lastEvent();
    assertThat(last.getVerdict()).isEqualTo(Verdict.ROLLBACK);
    assertThat(last.getSnapshot().orElseThrow().errorRatePercent()).isEqualTo(5.0);

    int eventsAfterRollback = audit.size();
    controller.step();
    assertThat(audit.size()).isEqualTo(eventsAfterRollback);
  }

  @Test
  void metrics_outage_holds_without_touching_state() {
    var controller = controller(20, 1);
    controller.step();
    long version = store.read(ID).orElseThrow().version();

    metrics.setUnavailable(ID, true);
    var held = controller.step();

    assertThat(held.isFailureOf(ErrorKind.UNAVAILABLE)).isTrue();
    assertThat(store.read(ID).orElseThrow().version()).isEqualTo(version);
    assertThat(lastEvent().getErrorKind()).isEqualTo(ErrorKind.UNAVAILABLE);
    assertThat(lastEvent().getSnapshot()).isEmpty();

    metrics.setUnavailable(ID, false);
    assertThat(controller.step().orElseThrow().getPhase()).isEqualTo(MigrationPhase.SHIFTING);
  }

  @Test
  void single_lost_swap_is_re_evaluated() {
    var controller = controller(20, 3);
    controller.step();

    store.conflictNextSwaps(1);
    var result = controller.step();

    assertThat(result.orElseThrow().getConsecutiveGoodPolls()).isEqualTo(1);
    assertThat(alerts.getAlerts()).isEmpty();
  }

  @Test
  void exhausted_swap_retries_hold_and_warn() {
    var controller = controller(20, 3);
    controller.step();
    long version = store.read(ID).orElseThrow().version();

    store.conflictNextSwaps(10);
    var result = controller.step();

    assertThat(result.isFailureOf(ErrorKind.CONFLICT)).isTrue();
    assertThat(store.read(ID).orElseThrow().version()).isEqualTo(version);
    assertThat(alerts.getAlerts()).singleElement()
        .extracting(Alert::severity).isEqualTo(Alert.Severity.WARNING);
    assertThat(lastEvent().getErrorKind()).isEqualTo(ErrorKind.CONFLICT);
  }

  @Test
  void store_outage_holds() {
    var controller = controller(20, 3);
    controller.step();

    store.failNextSwaps(1);
    var result = controller.step();

    assertThat(result.isFailureOf(ErrorKind.UNAVAILABLE)).isTrue();
    assertThat(lastEvent().getErrorKind()).isEqualTo(ErrorKind.UNAVAILABLE);
    assertThat(store.read(ID).orElseThrow().state().getConsecutiveGoodPolls()).isZero();
  }

  @Test
  void failed_push_reverts_the_committed_step() {
    var controller = controller(20, 1);
    steps(controller, 2);

    alb.setUnavailable(true);
    dns.setUnavailable(true);
    var result = controller.step();

    assertThat(result.isFailureOf(ErrorKind.UNAVAILABLE)).isTrue();
    var stored = store.read(ID).orElseThrow().state();
    assertThat(stored.getPhase()).isEqualTo(MigrationPhase.SHIFTING);
    assertThat(stored.getCurrentWeight()).isEqualTo(TrafficWeight.ALL_OLD);
    assertThat(lastEvent().getErrorKind()).isEqualTo(ErrorKind.UNAVAILABLE);
    assertThat(alerts.getAlerts()).isEmpty();

    alb.setUnavailable(false);
    dns.setUnavailable(false);
    assertThat(controller.step().orElseThrow().getCurrentWeight()).isEqualTo(new TrafficWeight(80, 20));
  }

  @Test
  void partial_push_re_applies_previous_split() {
    var controller = controller(20, 1);
    steps(controller, 2);

    dns.failNextApplies(1);
    var result = controller.step();

    assertThat(result.isFailureOf(ErrorKind.PARTIALLY_APPLIED)).isTrue();
    assertThat(alb.getWriteHistory())
        .containsExactly(TrafficWeight.ALL_OLD, new TrafficWeight(80, 20), TrafficWeight.ALL_OLD);
    assertThat(dns.getApplied(ID)).contains(TrafficWeight.ALL_OLD);
    assertThat(store.read(ID).orElseThrow().state().getCurrentWeight()).isEqualTo(TrafficWeight.ALL_OLD);
    assertThat(sleeper.getSleeps()).isEmpty();
  }

  @Test
  void partial_push_that_cannot_be_repaired_is_unrecoverable() {
    var controller = controller(20, 1);
    steps(controller, 2);

    dns.setUnavailable(true);
    var result = controller.step();

    assertThat(result.isFailureOf(ErrorKind.UNRECOVERABLE)).isTrue();
    assertThat(sleeper.getSleeps())
        .containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4));
    assertThat(alerts.getAlerts()).singleElement()
        .extracting(Alert::severity).isEqualTo(Alert.Severity.CRITICAL);
    assertThat(lastEvent().getErrorKind()).isEqualTo(ErrorKind.UNRECOVERABLE);
  }

  @Test
  void accepted_but_unconfirmed_push_is_undone_on_routing_too() {
    var controller = controller(20, 1);
    steps(controller, 2);

    alb.failNextReads(2);
    dns.failNextApplies(1);
    var result = controller.step();

    assertThat(result.isFailureOf(ErrorKind.PARTIALLY_APPLIED)).isTrue();
    var stored = store.read(ID).orElseThrow().state().getCurrentWeight();
    assertThat(stored).isEqualTo(TrafficWeight.ALL_OLD);
    assertThat(alb.getApplied(ID)).contains(stored);
    assertThat(dns.getApplied(ID)).contains(stored);
    assertThat(alb.getWriteHistory())
        .containsExactly(TrafficWeight.ALL_OLD, new TrafficWeight(80, 20), TrafficWeight.ALL_OLD);
    assertThat(alerts.getAlerts()).isEmpty();
  }

  @Test
  void final_push_failure_holds_without_committing_completed() {
    var controller = controller(50, 1);
    assertThat(steps(controller, 3).getCurrentWeight()).isEqualTo(new TrafficWeight(50, 50));

    alb.setUnavailable(true);
    dns.setUnavailable(true);
    var held = controller.step();

    assertThat(held.isFailureOf(ErrorKind.UNAVAILABLE)).isTrue();
    var stored = store.read(ID).orElseThrow().state();
    assertThat(stored.getPhase()).isEqualTo(MigrationPhase.SHIFTING);
    assertThat(stored.getCurrentWeight()).isEqualTo(new TrafficWeight(50, 50));
    assertThat(store.getCommittedPhases()).doesNotContain(MigrationPhase.COMPLETED);

    alb.setUnavailable(false);
    dns.setUnavailable(false);
    assertThat(controller.step().orElseThrow().getPhase()).isEqualTo(MigrationPhase.COMPLETED);
    controller.step();

    assertThat(store.getCommittedPhases())
        .containsExactly(MigrationPhase.VALIDATING, MigrationPhase.SHIFTING, MigrationPhase.SHIFTING,
            MigrationPhase.COMPLETED);
    assertThat(alb.getWriteHistory())
        .containsExactly(TrafficWeight.ALL_OLD, new TrafficWeight(50, 50), TrafficWeight.ALL_NEW);
  }

  @Test
  void lost_completion_commit_returns_routing_to_stored_split() {
    var controller = controller(50, 1);
    steps(controller, 3);

    store.conflictNextSwaps(10);
    var result = controller.step();

    assertThat(result.isFailureOf(ErrorKind.CONFLICT)).isTrue();
    var stored = store.read(ID).orElseThrow().state();
    assertThat(stored.getPhase()).isEqualTo(MigrationPhase.SHIFTING);
    assertThat(alb.getApplied(ID)).contains(stored.getCurrentWeight());
    assertThat(dns.getApplied(ID)).contains(stored.getCurrentWeight());
    assertThat(store.getCommittedPhases()).doesNotContain(MigrationPhase.COMPLETED);
    assertThat(alerts.getAlerts()).singleElement()
        .extracting(Alert::severity).isEqualTo(Alert.Severity.WARNING);
  }

  @Test
  void vanished_state_halts_the_run() {
    var controller = controller(20, 1, Duration.ofMillis(10));
    controller.step();

    store.clear();
    var exit = controller.run();

    assertThat(exit).isEqualTo(ExitCode.UNRECOVERABLE);
    assertThat(alerts.getAlerts()).extracting(Alert::severity).containsExactly(Alert.Severity.CRITICAL);
    assertThat(lastEvent().getErrorKind()).isEqualTo(ErrorKind.UNRECOVERABLE);
  }

  @Test
  void interrupt_rolls_back_and_is_passed_on_to_the_caller() throws Exception {
    var controller = controller(20, 3, Duration.ofMinutes(5));
    var exit = new AtomicReference<ExitCode>();
    var interruptedAfterRun = new AtomicBoolean();
    var worker = new Thread(() -> {
      exit.set(controller.run());
      interruptedAfterRun.set(Thread.currentThread().isInterrupted());
    });
    worker.start();

    await().atMost(Duration.ofSeconds(5))
        .until(() -> store.read(ID).orElseThrow().state().getPhase() == MigrationPhase.VALIDATING);
    worker.interrupt();
    worker.join(5_000);

    assertThat(exit.get()).isEqualTo(ExitCode.SUCCESS);
    assertThat(interruptedAfterRun).isTrue();
    assertThat(store.read(ID).orElseThrow().state().getPhase()).isEqualTo(MigrationPhase.ROLLED_BACK);
  }

  @Test
  void abort_while_shifting_rolls_back_to_last_good_split() {
    var controller = controller(20, 1);
    assertThat(steps(controller, 3).getCurrentWeight()).isEqualTo(new TrafficWeight(80, 20));

    controller.abort();
    var result = controller.step();

    assertThat(controller.isAbortRequested()).isTrue();
    assertThat(result.orElseThrow().getPhase()).isEqualTo(MigrationPhase.ROLLED_BACK);
    assertThat(result.orElseThrow().getCurrentWeight()).isEqualTo(TrafficWeight.ALL_OLD);
    assertThat(alb.getApplied(ID)).contains(TrafficWeight.ALL_OLD);
    assertThat(lastEvent().getDetail()).isEqualTo("Operator abort");
    assertThat(lastEvent().getSnapshot()).isEmpty();
  }

  @Test
  void abort_before_validation_moves_no_traffic() {
    var controller = controller(20, 3);

    controller.abort();
    var result = controller.step();
    controller.step();

    assertThat(result.orElseThrow().getPhase()).isEqualTo(MigrationPhase.INITIALIZING);
    assertThat(store.read(ID).orElseThrow().state().getPhase()).isEqualTo(MigrationPhase.INITIALIZING);
    assertThat(alb.getWriteCount()).isZero();
    assertThat(audit.getEvents(ID)).singleElement()
        .extracting(AuditEvent::getDetail).isEqualTo("Operator abort before validation, no traffic moved");
  }

  @Test
  void rollback_pending_on_store_outage_is_retried_next_step() {
    var controller = controller(20, 1);
    steps(controller, 3);

    metrics.setReading(ID, new InMemoryMetricsAdapter.Reading(60_000L, 0.0, 4, 4));
    store.failNextSwaps(1);
    var first = controller.step();
    metrics.setReading(ID, InMemoryMetricsAdapter.HEALTHY);
    var second = controller.step();

    assertThat(first.isFailureOf(ErrorKind.UNAVAILABLE)).isTrue();
    assertThat(second.orElseThrow().getPhase()).isEqualTo(MigrationPhase.ROLLED_BACK);
    assertThat(second.orElseThrow().getCurrentWeight()).isEqualTo(TrafficWeight.ALL_OLD);
  }

  @Test
  void run_returns_success_once_completed() {
    var controller = controller(100, 1, Duration.ofMillis(10));

    var exit = controller.run();

    assertThat(exit).isEqualTo(ExitCode.SUCCESS);
    assertThat(store.read(ID).orElseThrow().state().getPhase()).isEqualTo(MigrationPhase.COMPLETED);
    assertThat(alb.getApplied(ID)).contains(TrafficWeight.ALL_NEW);
  }

  @Test
  void run_halts_when_rollback_cannot_be_confirmed() {
    var controller = controller(20, 1, Duration.ofMillis(10));
    controller.step();

    metrics.setReading(ID, new InMemoryMetricsAdapter.Reading(60_000L, 0.0, 4, 4));
    alb.setUnavailable(true);
    dns.setUnavailable(true);
    var exit = controller.run();

    assertThat(exit).isEqualTo(ExitCode.UNRECOVERABLE);
    assertThat(store.read(ID).orElseThrow().state().getPhase()).isEqualTo(MigrationPhase.VALIDATING);
    assertThat(alerts.getAlerts()).extracting(Alert::severity).containsExactly(Alert.Severity.CRITICAL);
  }

  @Test
  void abort_wakes_a_waiting_run() throws Exception {
    var controller = controller(20, 3, Duration.ofMinutes(5));
    var exit = executor.submit(controller::run);

    await().atMost(Duration.ofSeconds(5))
        .until(() -> store.read(ID).orElseThrow().state().getPhase() == MigrationPhase.VALIDATING);
    controller.abort();

    assertThat(exit.get(5, TimeUnit.SECONDS)).isEqualTo(ExitCode.SUCCESS);
    var stored = store.read(ID).orElseThrow().state();
    assertThat(stored.getPhase()).isEqualTo(MigrationPhase.ROLLED_BACK);
    assertThat(stored.getCurrentWeight()).isEqualTo(TrafficWeight.ALL_OLD);
  }

  private MigrationController controller(int stepSize, int requiredPolls) {
    return controller(stepSize, requiredPolls, Duration.ofSeconds(30));
  }

  private MigrationController controller(int stepSize, int requiredPolls, Duration pollInterval) {
    var request = new MigrationRequest(ID, TARGETS,
        new ThresholdConfig(5_000L, 1.0, 0.8, requiredPolls, pollInterval),
        ControllerSettings.DEFAULT.withStepSize(stepSize));
    var initial = store.initialize(MigrationState.initial(ID, stepSize, NOW)).orElseThrow();
    var router = new TrafficRouterClient(List.of(alb, dns), TARGETS, Duration.ofMillis(500), executor);
    var auditLog = new AuditLog(audit, CLOCK);
    var rollbackManager = new RollbackManager(store, router, auditLog, alerts, BackoffPolicy.DEFAULT, 3,
        sleeper, CLOCK);
    var metricsClient = new MetricsClient(metrics, Duration.ofMillis(500), CLOCK, executor);
    return new MigrationController(request, initial, store, metricsClient, new ThresholdPolicy(), router,
        rollbackManager, auditLog, alerts, sleeper, CLOCK);
  }

  private static MigrationState steps(MigrationController controller, int count) {
    Result<MigrationState> result = null;
    for (int i = 0; i < count; i++) {
      result = controller.step();
    }
    return result.orElseThrow();
  }

  private AuditEvent lastEvent() {
    var events = audit.getEvents(ID);
    return events.get(events.size() - 1);
  }
}
