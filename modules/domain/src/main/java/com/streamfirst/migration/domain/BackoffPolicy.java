package com.streamfirst.migration.domain;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff for retried routing pushes.
 *
 * @param maxRetries retries after the first attempt
 * @param baseDelay delay before the first retry
 * @param multiplier growth factor between retries, at least 1.0
 * @param maxDelay upper bound on any single delay
 */
public record BackoffPolicy(int maxRetries, Duration baseDelay, double multiplier, Duration maxDelay) {

    public static final BackoffPolicy DEFAULT =
            new BackoffPolicy(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(8));

    /** No retries at all. */
    public static final BackoffPolicy NONE =
            new BackoffPolicy(0, Duration.ZERO, 1.0, Duration.ZERO);

    public BackoffPolicy {
        Objects.requireNonNull(baseDelay, "Base delay cannot be null");
        Objects.requireNonNull(maxDelay, "Max delay cannot be null");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Backoff delays cannot be negative");
        }
        if (Double.isNaN(multiplier) || multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, got " + multiplier);
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be shorter than baseDelay");
        }
    }

    /**
     * Delay before the given retry, 1-based: {@code baseDelay * multiplier^(retry-1)},
     * capped at {@code maxDelay}.
     */
    public Duration delayBefore(int retry) {
        if (retry < 1) {
            throw new IllegalArgumentException("Retry number is 1-based, got " + retry);
        }
        double millis = baseDelay.toMillis() * Math.pow(multiplier, retry - 1);
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    /**
     * Total attempts including the first one.
     */
    public int totalAttempts() {
        return maxRetries + 1;
    }
}
