package com.streamfirst.migration.adapters;

import com.streamfirst.migration.domain.CollaboratorUnavailableException;
import com.streamfirst.migration.domain.MigrationId;
import com.streamfirst.migration.ports.MetricsPort;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of MetricsPort for testing and development. Readings are set
 * per migration by the caller and returned until replaced. Outages and slow responses can
 * be simulated to exercise timeout handling.
 */
@Slf4j
public class InMemoryMetricsAdapter implements MetricsPort {

  /** Reading returned for runs that have no explicit reading: healthy, no lag. */
  public static final Reading HEALTHY = new Reading(0L, 0.0, 4, 4);

  private final Map<MigrationId, Reading> readings = new ConcurrentHashMap<>();
  private final Set<MigrationId> unavailable = ConcurrentHashMap.newKeySet();
  private final AtomicLong readCount = new AtomicLong();
  private volatile Duration responseDelay = Duration.ZERO;

  /**
   * Raw metric values, deliberately unvalidated so malformed readings can be simulated.
   */
  public record Reading(long lagMillis, double errorRatePercent, int healthy, int total) {}

  public void setReading(MigrationId migrationId, Reading reading) {
    log.debug("Metrics for {} set to {}", migrationId, reading);
    readings.put(migrationId, reading);
  }

  public void setUnavailable(MigrationId migrationId, boolean down) {
    if (down) {
      unavailable.add(migrationId);
    } else {
      unavailable.remove(migrationId);
    }
  }

  public void setResponseDelay(Duration delay) {
    this.responseDelay = delay;
  }

  @Override
  public long replicationLagMillis(MigrationId migrationId) {
    return read(migrationId).lagMillis();
  }

  @Override
  public double errorRatePercent(MigrationId migrationId) {
    return read(migrationId).errorRatePercent();
  }

  @Override
  public TargetHealth targetHealth(MigrationId migrationId) {
    Reading reading = read(migrationId);
    return new TargetHealth(reading.healthy(), reading.total());
  }

  private Reading read(MigrationId migrationId) {
    readCount.incrementAndGet();
    simulateLatency();
    if (unavailable.contains(migrationId)) {
      throw new CollaboratorUnavailableException("Metrics backend unreachable for " + migrationId);
    }
    return readings.getOrDefault(migrationId, HEALTHY);
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
      throw new CollaboratorUnavailableException("Metrics read interrupted", e);
    }
  }

  /** Number of individual metric reads served. */
  public long getReadCount() {
    return readCount.get();
  }

  public void clear() {
    readings.clear();
    unavailable.clear();
    readCount.set(0);
    responseDelay = Duration.ZERO;
  }
}
