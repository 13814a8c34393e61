package com.streamfirst.migration.adapters;

import com.streamfirst.migration.domain.AuditEvent;
import com.streamfirst.migration.ports.AuditPort;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * In-memory implementation of AuditPort for testing and development.
 */
@Slf4j
public class InMemoryAuditAdapter implements AuditPort {

  private final List<AuditEvent> events = new CopyOnWriteArrayList<>();

  @Override
  public void append(AuditEvent event) {
    events.add(event);
    log.trace("Appended audit event {}", event);
  }

  @Override
  public List<AuditEvent> getEvents(Predicate<AuditEvent> predicate) {
    return events.stream().filter(predicate).toList();
  }

  public int size() {
    return events.size();
  }

  public void clear() {
    events.clear();
  }
}
