package com.streamfirst.migration.domain;

import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Authoritative state of one migration run as held by the weight store. Instances are
 * immutable; every change produces a new copy that is committed with compare-and-swap
 * against the version it was derived from.
 */
@Value
@With
public class MigrationState {
    /** The run this state belongs to */
    @NonNull MigrationId migrationId;

    /** Current lifecycle phase */
    @NonNull MigrationPhase phase;

    /** Split currently committed and pushed to routing */
    @NonNull TrafficWeight currentWeight;

    /** Split that last passed its health window; the rollback destination */
    @NonNull TrafficWeight lastGoodWeight;

    /** Percentage points moved to the new environment per advance, 1-100 */
    int stepSize;

    /** Healthy polls observed since the last weight change */
    int consecutiveGoodPolls;

    @NonNull Instant createdAt;

    @NonNull Instant updatedAt;

    public MigrationState(@NonNull MigrationId migrationId,
                          @NonNull MigrationPhase phase,
                          @NonNull TrafficWeight currentWeight,
                          @NonNull TrafficWeight lastGoodWeight,
                          int stepSize,
                          int consecutiveGoodPolls,
                          @NonNull Instant createdAt,
                          @NonNull Instant updatedAt) {
        if (stepSize < 1 || stepSize > TrafficWeight.TOTAL) {
            throw new IllegalArgumentException("Step size must be within 1-100, got " + stepSize);
        }
        if (consecutiveGoodPolls < 0) {
            throw new IllegalArgumentException("Good poll count cannot be negative: " + consecutiveGoodPolls);
        }
        this.migrationId = migrationId;
        this.phase = phase;
        this.currentWeight = currentWeight;
        this.lastGoodWeight = lastGoodWeight;
        this.stepSize = stepSize;
        this.consecutiveGoodPolls = consecutiveGoodPolls;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    /**
     * Creates the state a new run starts from: INITIALIZING with all traffic on the old
     * environment.
     */
    public static MigrationState initial(MigrationId migrationId, int stepSize, Instant now) {
        return new MigrationState(migrationId, MigrationPhase.INITIALIZING, TrafficWeight.ALL_OLD,
                TrafficWeight.ALL_OLD, stepSize, 0, now, now);
    }

    /**
     * Moves to the given phase, rejecting transitions the lifecycle does not allow.
     *
     * @throws IllegalStateException if {@code next} is not reachable from the current phase
     */
    public MigrationState transitionTo(MigrationPhase next, Instant now) {
        if (!phase.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal phase transition " + phase + " -> " + next
                                            + " for " + migrationId);
        }
        return withPhase(next).withUpdatedAt(now);
    }

    /**
     * Records one more healthy poll without moving traffic.
     */
    public MigrationState recordGoodPoll(Instant now) {
        return withConsecutiveGoodPolls(consecutiveGoodPolls + 1).withUpdatedAt(now);
    }

    /**
     * Moves one step of traffic to the new environment. The weight before the step becomes
     * the last known-good weight and the health window restarts. Reaching 0/100 completes
     * the run in the same transition.
     */
    public MigrationState shiftStep(Instant now) {
        TrafficWeight next = currentWeight.shiftBy(stepSize);
        MigrationPhase nextPhase = next.isAllNew() ? MigrationPhase.COMPLETED : MigrationPhase.SHIFTING;
        return transitionTo(nextPhase, now)
                .withLastGoodWeight(currentWeight)
                .withCurrentWeight(next)
                .withConsecutiveGoodPolls(0);
    }

    /**
     * Restores the last known-good weight and ends the run.
     */
    public MigrationState rolledBack(Instant now) {
        return transitionTo(MigrationPhase.ROLLED_BACK, now)
                .withCurrentWeight(lastGoodWeight)
                .withConsecutiveGoodPolls(0);
    }

    @Override
    public String toString() {
        return "MigrationState{" +
               "migrationId=" + migrationId +
               ", phase=" + phase +
               ", currentWeight=" + currentWeight +
               ", lastGoodWeight=" + lastGoodWeight +
               ", stepSize=" + stepSize +
               ", consecutiveGoodPolls=" + consecutiveGoodPolls +
               ", updatedAt=" + updatedAt +
               '}';
    }
}
