package com.streamfirst.migration.adapters;

import com.streamfirst.migration.domain.Alert;
import com.streamfirst.migration.ports.AlertPort;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * AlertPort that writes alerts to the log and keeps them in memory. Used as the default
 * alert sink when no paging integration is configured.
 */
@Slf4j
public class InMemoryAlertAdapter implements AlertPort {

  private final List<Alert> alerts = new CopyOnWriteArrayList<>();

  @Override
  public void raise(Alert alert) {
    alerts.add(alert);
    if (alert.severity() == Alert.Severity.CRITICAL) {
      log.error("ALERT [{}] {} {}: {}", alert.severity(), alert.migrationId(), alert.kind(), alert.message());
    } else {
      log.warn("ALERT [{}] {} {}: {}", alert.severity(), alert.migrationId(), alert.kind(), alert.message());
    }
  }

  public List<Alert> getAlerts() {
    return List.copyOf(alerts);
  }

  public void clear() {
    alerts.clear();
  }
}
