package com.streamfirst.migration.application;

import com.streamfirst.migration.domain.CollaboratorUnavailableException;
import com.streamfirst.migration.domain.ErrorKind;
import com.streamfirst.migration.domain.MigrationId;
import com.streamfirst.migration.domain.Result;
import com.streamfirst.migration.domain.TargetPair;
import com.streamfirst.migration.domain.TrafficWeight;
import com.streamfirst.migration.ports.RoutingPort;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pushes a traffic split to every configured routing mechanism and confirms each by reading
 * it back.
 *
 * <p>A mechanism already reporting the requested split is not written again, so applying
 * the same split twice has the same effect as applying it once. The result is
 * {@link ErrorKind#UNAVAILABLE} only when every mechanism rejected the write, which leaves
 * routing as it was. Any other failure is {@link ErrorKind#PARTIALLY_APPLIED}: some mechanism
 * may now serve the new split, including one that accepted the write (or timed out on it) but
 * could not confirm it. Calls are serialized and every mechanism call is bounded by the
 * routing timeout.
 */
@Slf4j
public class TrafficRouterClient {

  private enum Outcome { CONFIRMED, UNCONFIRMED, REJECTED }

  private final List<RoutingPort> routingPorts;
  private final TargetPair targets;
  private final Duration timeout;
  private final ExecutorService callExecutor;
  private final ReentrantLock lock = new ReentrantLock();

  public TrafficRouterClient(List<RoutingPort> routingPorts, TargetPair targets, Duration timeout,
                             ExecutorService callExecutor) {
    if (routingPorts.isEmpty()) {
      throw new IllegalArgumentException("At least one routing mechanism is required");
    }
    this.routingPorts = List.copyOf(routingPorts);
    this.targets = targets;
    this.timeout = timeout;
    this.callExecutor = callExecutor;
  }

  /**
   * Applies the split on all mechanisms.
   *
   * @return the confirmed split, or an UNAVAILABLE / PARTIALLY_APPLIED failure
   */
  public Result<TrafficWeight> apply(MigrationId migrationId, TrafficWeight weight) {
    lock.lock();
    try {
      Map<Outcome, List<String>> outcomes = new EnumMap<>(Outcome.class);
      for (Outcome outcome : Outcome.values()) {
        outcomes.put(outcome, new ArrayList<>());
      }
      for (RoutingPort port : routingPorts) {
        outcomes.get(applyOne(migrationId, port, weight)).add(port.mechanism());
      }
      List<String> confirmed = outcomes.get(Outcome.CONFIRMED);
      List<String> unconfirmed = outcomes.get(Outcome.UNCONFIRMED);
      List<String> rejected = outcomes.get(Outcome.REJECTED);

      if (unconfirmed.isEmpty() && rejected.isEmpty()) {
        log.info("Traffic for {} at {} on {}", migrationId, weight, confirmed);
        return Result.success(weight);
      }
      if (confirmed.isEmpty() && unconfirmed.isEmpty()) {
        log.warn("No routing mechanism accepted {} for {}: {}", weight, migrationId, rejected);
        return Result.failure(ErrorKind.UNAVAILABLE,
            "No routing mechanism accepted " + weight + " (rejected by " + rejected + ")");
      }
      log.warn("Routing for {} may have diverged: {} confirmed on {}, unconfirmed on {}, rejected by {}",
          migrationId, weight, confirmed, unconfirmed, rejected);
      return Result.failure(ErrorKind.PARTIALLY_APPLIED,
          weight + " confirmed on " + confirmed + ", unconfirmed on " + unconfirmed + ", rejected by " + rejected);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Reads back the split in effect on every mechanism, empty where a mechanism has none or
   * cannot be reached.
   */
  public List<Optional<TrafficWeight>> currentWeights(MigrationId migrationId) {
    lock.lock();
    try {
      List<Optional<TrafficWeight>> weights = new ArrayList<>();
      for (RoutingPort port : routingPorts) {
        try {
          weights.add(readBack(migrationId, port));
        } catch (CollaboratorUnavailableException | IllegalArgumentException e) {
          log.warn("Cannot read weights from '{}' for {}: {}", port.mechanism(), migrationId, e.getMessage());
          weights.add(Optional.empty());
        }
      }
      return weights;
    } finally {
      lock.unlock();
    }
  }

  private Outcome applyOne(MigrationId migrationId, RoutingPort port, TrafficWeight weight) {
    try {
      if (readBack(migrationId, port).filter(weight::equals).isPresent()) {
        log.debug("'{}' already at {} for {}, skipping write", port.mechanism(), weight, migrationId);
        return Outcome.CONFIRMED;
      }
    } catch (CollaboratorUnavailableException | IllegalArgumentException e) {
      log.debug("Pre-read of '{}' failed for {}, writing anyway: {}", port.mechanism(), migrationId, e.getMessage());
    }

    try {
      BoundedCalls.call(callExecutor, timeout, "Routing write to '" + port.mechanism() + "'", () -> {
        port.applyWeights(migrationId, targets, weight);
        return weight;
      });
    } catch (CollaboratorUnavailableException e) {
      if (e.getCause() instanceof TimeoutException) {
        log.warn("Write of {} to '{}' for {} timed out, outcome unknown", weight, port.mechanism(), migrationId);
        return Outcome.UNCONFIRMED;
      }
      log.warn("Routing mechanism '{}' rejected {} for {}: {}", port.mechanism(), weight, migrationId, e.getMessage());
      return Outcome.REJECTED;
    } catch (IllegalArgumentException e) {
      log.warn("Routing mechanism '{}' rejected {} for {}: {}", port.mechanism(), weight, migrationId, e.getMessage());
      return Outcome.REJECTED;
    }

    try {
      Optional<TrafficWeight> after = readBack(migrationId, port);
      if (after.filter(weight::equals).isPresent()) {
        return Outcome.CONFIRMED;
      }
      log.warn("'{}' accepted {} for {} but reports {}", port.mechanism(), weight, migrationId,
          after.map(TrafficWeight::toString).orElse("no weights"));
    } catch (CollaboratorUnavailableException | IllegalArgumentException e) {
      log.warn("'{}' accepted {} for {} but read-back failed: {}", port.mechanism(), weight, migrationId,
          e.getMessage());
    }
    return Outcome.UNCONFIRMED;
  }

  private Optional<TrafficWeight> readBack(MigrationId migrationId, RoutingPort port) {
    return BoundedCalls.call(callExecutor, timeout, "Routing read-back from '" + port.mechanism() + "'",
        () -> port.currentWeights(migrationId, targets));
  }

  public TargetPair getTargets() {
    return targets;
  }
}
