package com.streamfirst.migration.adapters;

import com.streamfirst.migration.domain.MigrationError;
import com.streamfirst.migration.domain.MigrationId;
import com.streamfirst.migration.domain.MigrationState;
import com.streamfirst.migration.domain.Result;
import com.streamfirst.migration.domain.VersionedState;
import com.streamfirst.migration.ports.WeightStorePort;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * In-memory implementation of WeightStorePort. Each run's state sits in its own
 * AtomicReference so compare-and-swap is a single atomic reference swap.
 */
@Slf4j
public class InMemoryWeightStoreAdapter implements WeightStorePort {

    private final Map<MigrationId, AtomicReference<VersionedState>> states = new ConcurrentHashMap<>();
    private final AtomicLong successfulSwaps = new AtomicLong();
    private final AtomicLong conflicts = new AtomicLong();

    @Override
    public Optional<VersionedState> read(MigrationId migrationId) {
        AtomicReference<VersionedState> ref = states.get(migrationId);
        return ref == null ? Optional.empty() : Optional.of(ref.get());
    }

    @Override
    public Result<VersionedState> initialize(MigrationState initialState) {
        VersionedState first = new VersionedState(initialState, 1L);
        AtomicReference<VersionedState> existing =
                states.putIfAbsent(initialState.getMigrationId(), new AtomicReference<>(first));
        if (existing != null) {
            log.warn("State for {} already exists at version {}", initialState.getMigrationId(), existing.get().version());
            return Result.failure(MigrationError.conflict("State already initialized for " + initialState.getMigrationId()));
        }
        log.info("Initialized state for {} at version 1", initialState.getMigrationId());
        return Result.success(first);
    }

    @Override
    public Result<VersionedState> compareAndSwap(MigrationId migrationId, long expectedVersion, MigrationState newState) {
        AtomicReference<VersionedState> ref = states.get(migrationId);
        if (ref == null) {
            return Result.failure(MigrationError.conflict("No state stored for " + migrationId));
        }
        VersionedState current = ref.get();
        if (current.version() != expectedVersion) {
            conflicts.incrementAndGet();
            log.debug("CAS conflict for {}: expected version {}, stored {}", migrationId, expectedVersion, current.version());
            return Result.failure(MigrationError.conflict(
                    "Expected version " + expectedVersion + " but found " + current.version()));
        }
        VersionedState next = new VersionedState(newState, expectedVersion + 1);
        if (!ref.compareAndSet(current, next)) {
            conflicts.incrementAndGet();
            log.debug("CAS conflict for {}: lost race at version {}", migrationId, expectedVersion);
            return Result.failure(MigrationError.conflict("Concurrent update at version " + expectedVersion));
        }
        successfulSwaps.incrementAndGet();
        log.debug("Committed {} at version {}", newState, next.version());
        return Result.success(next);
    }

    @Override
    public List<MigrationState> findMatching(Predicate<MigrationState> predicate) {
        return states.values().stream()
                .map(ref -> ref.get().state())
                .filter(predicate)
                .toList();
    }

    public long getSuccessfulSwapCount() {
        return successfulSwaps.get();
    }

    public long getConflictCount() {
        return conflicts.get();
    }

    public void clear() {
        states.clear();
        successfulSwaps.set(0);
        conflicts.set(0);
    }
}
