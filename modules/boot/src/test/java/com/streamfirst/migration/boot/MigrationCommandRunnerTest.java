package com.streamfirst.migration.boot;

import com.streamfirst.migration.adapters.InMemoryAlertAdapter;
import com.streamfirst.migration.adapters.InMemoryAuditAdapter;
import com.streamfirst.migration.adapters.InMemoryMetricsAdapter;
import com.streamfirst.migration.adapters.InMemoryRoutingAdapter;
import com.streamfirst.migration.adapters.InMemoryWeightStoreAdapter;
import com.streamfirst.migration.application.MigrationService;
import com.streamfirst.migration.domain.MigrationId;
import com.streamfirst.migration.domain.MigrationPhase;
import com.streamfirst.migration.domain.MigrationState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class MigrationCommandRunnerTest {

  private static final MigrationId ID = new MigrationId("orders-db-cutover");

  private final InMemoryWeightStoreAdapter store = new InMemoryWeightStoreAdapter();
  private final MigrationService service = new MigrationService(store, new InMemoryMetricsAdapter(),
      List.of(new InMemoryRoutingAdapter("alb")), new InMemoryAuditAdapter(), new InMemoryAlertAdapter(),
      duration -> { }, Clock.systemUTC());

  @AfterEach
  void tearDown() {
    service.close();
  }

  @Test
  void healthy_run_exits_zero() throws Exception {
    var runner = new MigrationCommandRunner(service, properties(Duration.ofMillis(10)));

    runner.run();

    assertThat(runner.getExitCode()).isZero();
    assertThat(store.read(ID).orElseThrow().state().getPhase()).isEqualTo(MigrationPhase.COMPLETED);
  }

  @Test
  void invalid_configuration_exits_one_without_starting() throws Exception {
    var properties = properties(Duration.ofMillis(10));
    properties.getController().setStepSize(500);
    var runner = new MigrationCommandRunner(service, properties);

    runner.run();

    assertThat(runner.getExitCode()).isEqualTo(1);
    assertThat(store.read(ID)).isEmpty();
  }

  @Test
  void shutdown_rolls_back_the_active_run() throws Exception {
    var runner = new MigrationCommandRunner(service, properties(Duration.ofMinutes(5)));
    var pool = Executors.newSingleThreadExecutor();
    try {
      var running = pool.submit(() -> {
        runner.run();
        return runner.getExitCode();
      });
      await().atMost(Duration.ofSeconds(10)).until(() -> store.read(ID)
          .map(versioned -> versioned.state().getPhase() == MigrationPhase.VALIDATING)
          .orElse(false));

      runner.destroy();

      assertThat(running.get(10, TimeUnit.SECONDS)).isZero();
      MigrationState state = store.read(ID).orElseThrow().state();
      assertThat(state.getPhase()).isEqualTo(MigrationPhase.ROLLED_BACK);
    } finally {
      pool.shutdownNow();
    }
  }

  private static MigrationProperties properties(Duration pollInterval) {
    var properties = new MigrationProperties();
    properties.setId(ID.value());
    properties.setRoutingMechanisms(List.of("alb"));
    properties.getThresholds().setPollInterval(pollInterval);
    properties.getThresholds().setRequiredGoodPolls(1);
    properties.getController().setStepSize(50);
    return properties;
  }
}
