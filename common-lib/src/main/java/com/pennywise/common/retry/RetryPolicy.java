package com.pennywise.common.retry;

import java.time.Duration;

/**
 * Bounded exponential backoff: one initial attempt plus {@code maxAttempts} retries,
 * waiting {@code baseDelay * 2^(k-1)} before retry {@code k}.
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofSeconds(1));

    public RetryPolicy {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative, was " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be zero or positive");
        }
    }

    public static RetryPolicy of(int maxAttempts, Duration baseDelay) {
        return new RetryPolicy(maxAttempts, baseDelay);
    }

    /** Total calls the executor may make. */
    public int totalAttempts() {
        return maxAttempts + 1;
    }

    /**
     * Backoff before retry {@code retry} (1-based).
     */
    public Duration delayBefore(int retry) {
        if (retry < 1) {
            return Duration.ZERO;
        }
        return baseDelay.multipliedBy(1L << Math.min(retry - 1, 30));
    }
}
