package com.streamfirst.migration.boot;

import com.streamfirst.migration.adapters.InMemoryAuditAdapter;
import com.streamfirst.migration.adapters.InMemoryWeightStoreAdapter;
import com.streamfirst.migration.adapters.jsonl.JsonLinesAuditAdapter;
import com.streamfirst.migration.application.MigrationService;
import com.streamfirst.migration.ports.AuditPort;
import com.streamfirst.migration.ports.WeightStorePort;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class MigrationAppConfigurationTest {

  private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
      .withUserConfiguration(MigrationAppConfiguration.class)
      .withPropertyValues("migration.id=orders-db-cutover");

  @Test
  void defaults_wire_in_memory_store_and_audit() {
    contextRunner.run(context -> {
      assertThat(context).hasSingleBean(MigrationService.class);
      assertThat(context).hasSingleBean(MigrationCommandRunner.class);
      assertThat(context.getBean(WeightStorePort.class)).isInstanceOf(InMemoryWeightStoreAdapter.class);
      assertThat(context.getBean(AuditPort.class)).isInstanceOf(InMemoryAuditAdapter.class);
    });
  }

  @Test
  void json_lines_audit_is_selected_by_property(@TempDir Path dir) {
    contextRunner
        .withPropertyValues("migration.audit.type=jsonl", "migration.audit.file=" + dir.resolve("audit.jsonl"))
        .run(context -> {
          var audit = context.getBean(AuditPort.class);
          assertThat(audit).isInstanceOf(JsonLinesAuditAdapter.class);
          assertThat(((JsonLinesAuditAdapter) audit).getFile()).isEqualTo(dir.resolve("audit.jsonl"));
        });
  }

  @Test
  void jdbc_store_without_url_fails_startup() {
    contextRunner
        .withPropertyValues("migration.store.type=jdbc")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void properties_are_bound() {
    contextRunner
        .withPropertyValues("migration.controller.step-size=25", "migration.thresholds.poll-interval=5s")
        .run(context -> {
          var properties = context.getBean(MigrationProperties.class);
          var request = properties.toRequest().orElseThrow();
          assertThat(request.settings().stepSize()).isEqualTo(25);
          assertThat(request.thresholds().pollInterval().getSeconds()).isEqualTo(5L);
        });
  }
}
