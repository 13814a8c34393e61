package com.streamfirst.migration.adapters;

import com.streamfirst.migration.domain.CollaboratorUnavailableException;
import com.streamfirst.migration.domain.MigrationId;
import com.streamfirst.migration.domain.TargetPair;
import com.streamfirst.migration.domain.TrafficWeight;
import com.streamfirst.migration.ports.RoutingPort;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of RoutingPort simulating one weighted routing mechanism, such
 * as a load balancer listener or a pair of weighted DNS records. Every accepted write is
 * recorded so tests can assert on the exact sequence of splits pushed.
 */
@Slf4j
public class InMemoryRoutingAdapter implements RoutingPort {

  private final String mechanism;
  private final Map<MigrationId, TrafficWeight> applied = new ConcurrentHashMap<>();
  private final List<TrafficWeight> writeHistory = Collections.synchronizedList(new ArrayList<>());
  private final AtomicInteger failuresRemaining = new AtomicInteger();
  private final AtomicInteger readFailuresRemaining = new AtomicInteger();
  private volatile boolean unavailable;
  private volatile boolean silentlyDropWrites;
  private volatile Duration responseDelay = Duration.ZERO;

  public InMemoryRoutingAdapter(String mechanism) {
    this.mechanism = mechanism;
  }

  @Override
  public String mechanism() {
    return mechanism;
  }

  @Override
  public void applyWeights(MigrationId migrationId, TargetPair targets, TrafficWeight weight) {
    simulateLatency();
    if (unavailable || failuresRemaining.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
      log.debug("Routing mechanism '{}' rejecting {} for {}", mechanism, weight, migrationId);
      throw new CollaboratorUnavailableException(
          "Routing mechanism '" + mechanism + "' unavailable for " + migrationId);
    }
    writeHistory.add(weight);
    if (silentlyDropWrites) {
      log.debug("Routing mechanism '{}' accepted but dropped {} for {}", mechanism, weight, migrationId);
      return;
    }
    applied.put(migrationId, weight);
    log.debug("Routing mechanism '{}' now at {} for {} ({})", mechanism, weight, migrationId, targets);
  }

  @Override
  public Optional<TrafficWeight> currentWeights(MigrationId migrationId, TargetPair targets) {
    if (unavailable || readFailuresRemaining.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
      throw new CollaboratorUnavailableException(
          "Routing mechanism '" + mechanism + "' unavailable for " + migrationId);
    }
    return Optional.ofNullable(applied.get(migrationId));
  }

  /** Rejects every call until switched back. */
  public void setUnavailable(boolean down) {
    this.unavailable = down;
  }

  /** Rejects the next {@code count} writes, then recovers. */
  public void failNextApplies(int count) {
    failuresRemaining.set(count);
  }

  /** Fails the next {@code count} read-backs while still accepting writes. */
  public void failNextReads(int count) {
    readFailuresRemaining.set(count);
  }

  /** Accepts writes without changing the weight read back. */
  public void setSilentlyDropWrites(boolean drop) {
    this.silentlyDropWrites = drop;
  }

  public void setResponseDelay(Duration delay) {
    this.responseDelay = delay;
  }

  /** Seeds the weight currently in effect, as if set outside the orchestrator. */
  public void preset(MigrationId migrationId, TrafficWeight weight) {
    applied.put(migrationId, weight);
  }

  public Optional<TrafficWeight> getApplied(MigrationId migrationId) {
    return Optional.ofNullable(applied.get(migrationId));
  }

  /** Every split accepted by this mechanism, in order. */
  public List<TrafficWeight> getWriteHistory() {
    synchronized (writeHistory) {
      return List.copyOf(writeHistory);
    }
  }

  public int getWriteCount() {
    return writeHistory.size();
  }

  private void simulateLatency() {
    Duration delay = responseDelay;
    if (delay.isZero()) {
      return;
    }
    try {
      Thread.sleep(delay.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CollaboratorUnavailableException("Routing call to '" + mechanism + "' interrupted", e);
    }
  }

  public void clear() {
    applied.clear();
    writeHistory.clear();
    failuresRemaining.set(0);
    readFailuresRemaining.set(0);
    unavailable = false;
    silentlyDropWrites = false;
    responseDelay = Duration.ZERO;
  }
}
