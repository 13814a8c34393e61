package com.streamfirst.migration.domain;

/**
 * Percentage split of live traffic between the old and the new environment.
 *
 * <p>Examples:
 * <ul>
 *   <li>{@code 100/0} - all traffic on the old environment (initial split)</li>
 *   <li>{@code 60/40} - 40% of requests reach the new environment</li>
 *   <li>{@code 0/100} - cutover complete</li>
 * </ul>
 *
 * @param oldWeight share routed to the old environment, 0-100
 * @param newWeight share routed to the new environment, 0-100
 */
public record TrafficWeight(int oldWeight, int newWeight) {
    public static final int TOTAL = 100;

    /** Initial split: all traffic to the old environment. */
    public static final TrafficWeight ALL_OLD = new TrafficWeight(TOTAL, 0);

    /** Final split: all traffic to the new environment. */
    public static final TrafficWeight ALL_NEW = new TrafficWeight(0, TOTAL);

    public TrafficWeight {
        if (oldWeight < 0 || oldWeight > TOTAL || newWeight < 0 || newWeight > TOTAL) {
            throw new IllegalArgumentException("Weights must be within 0-100, got " + oldWeight + "/" + newWeight);
        }
        if (oldWeight + newWeight != TOTAL) {
            throw new IllegalArgumentException("Weights must sum to 100, got " + oldWeight + "/" + newWeight);
        }
    }

    /**
     * Creates a split from the share of traffic the new environment should receive.
     */
    public static TrafficWeight ofNewWeight(int newWeight) {
        return new TrafficWeight(TOTAL - newWeight, newWeight);
    }

    /**
     * Moves {@code stepSize} percentage points to the new environment, capped at 100.
     */
    public TrafficWeight shiftBy(int stepSize) {
        if (stepSize < 1 || stepSize > TOTAL) {
            throw new IllegalArgumentException("Step size must be within 1-100, got " + stepSize);
        }
        return ofNewWeight(Math.min(TOTAL, newWeight + stepSize));
    }

    public boolean isAllOld() {
        return newWeight == 0;
    }

    public boolean isAllNew() {
        return newWeight == TOTAL;
    }

    @Override
    public String toString() {
        return oldWeight + "/" + newWeight;
    }
}
