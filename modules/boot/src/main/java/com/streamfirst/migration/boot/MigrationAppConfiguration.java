package com.streamfirst.migration.boot;

import com.streamfirst.migration.adapters.InMemoryAlertAdapter;
import com.streamfirst.migration.adapters.InMemoryAuditAdapter;
import com.streamfirst.migration.adapters.InMemoryMetricsAdapter;
import com.streamfirst.migration.adapters.InMemoryRoutingAdapter;
import com.streamfirst.migration.adapters.InMemoryWeightStoreAdapter;
import com.streamfirst.migration.adapters.jdbc.JdbcWeightStoreAdapter;
import com.streamfirst.migration.adapters.jsonl.JsonLinesAuditAdapter;
import com.streamfirst.migration.application.MigrationService;
import com.streamfirst.migration.application.Sleeper;
import com.streamfirst.migration.ports.AlertPort;
import com.streamfirst.migration.ports.AuditPort;
import com.streamfirst.migration.ports.MetricsPort;
import com.streamfirst.migration.ports.RoutingPort;
import com.streamfirst.migration.ports.WeightStorePort;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Wires the migration service. The weight store and the audit sink are selected by
 * {@code migration.store.type} and {@code migration.audit.type}; metrics, routing and
 * alerting use the in-memory adapters.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(MigrationProperties.class)
public class MigrationAppConfiguration {

    // --- Weight store ---

    @Bean
    @ConditionalOnProperty(name = "migration.store.type", havingValue = "memory", matchIfMissing = true)
    public WeightStorePort inMemoryWeightStore() {
        log.info("Using in-memory weight store; state is lost on exit");
        return new InMemoryWeightStoreAdapter();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "migration.store.type", havingValue = "jdbc")
    public HikariDataSource migrationDataSource(MigrationProperties properties) {
        MigrationProperties.Store store = properties.getStore();
        if (store.getUrl() == null || store.getUrl().isBlank()) {
            throw new IllegalStateException("migration.store.url is required when migration.store.type=jdbc");
        }
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(store.getUrl());
        config.setUsername(store.getUsername());
        config.setPassword(store.getPassword());
        config.setMaximumPoolSize(store.getMaxPoolSize());
        config.setPoolName("migration-state");
        log.info("Using JDBC weight store at {}", store.getUrl());
        return new HikariDataSource(config);
    }

    @Bean
    @ConditionalOnProperty(name = "migration.store.type", havingValue = "jdbc")
    public WeightStorePort jdbcWeightStore(HikariDataSource migrationDataSource) {
        JdbcWeightStoreAdapter store = new JdbcWeightStoreAdapter(new JdbcTemplate(migrationDataSource));
        store.ensureSchema();
        return store;
    }

    // --- Audit sink ---

    @Bean
    @ConditionalOnProperty(name = "migration.audit.type", havingValue = "memory", matchIfMissing = true)
    public AuditPort inMemoryAudit() {
        return new InMemoryAuditAdapter();
    }

    @Bean
    @ConditionalOnProperty(name = "migration.audit.type", havingValue = "jsonl")
    public AuditPort jsonLinesAudit(MigrationProperties properties) {
        log.info("Writing audit trail to {}", properties.getAudit().getFile().toAbsolutePath());
        return new JsonLinesAuditAdapter(properties.getAudit().getFile());
    }

    // --- Collaborators without a production adapter ---

    @Bean
    public MetricsPort metricsPort() {
        return new InMemoryMetricsAdapter();
    }

    @Bean
    public AlertPort alertPort() {
        return new InMemoryAlertAdapter();
    }

    // --- Application ---

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public MigrationService migrationService(WeightStorePort weightStore,
                                             MetricsPort metricsPort,
                                             AuditPort auditPort,
                                             AlertPort alertPort,
                                             Clock clock,
                                             MigrationProperties properties) {
        List<RoutingPort> routingPorts = properties.getRoutingMechanisms().stream()
                .<RoutingPort>map(InMemoryRoutingAdapter::new)
                .toList();
        return new MigrationService(weightStore, metricsPort, routingPorts, auditPort, alertPort, Sleeper.SYSTEM, clock);
    }

    @Bean
    public MigrationCommandRunner migrationCommandRunner(MigrationService migrationService,
                                                         MigrationProperties properties) {
        return new MigrationCommandRunner(migrationService, properties);
    }
}
