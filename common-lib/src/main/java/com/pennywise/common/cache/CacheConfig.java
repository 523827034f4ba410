package com.pennywise.common.cache;

import java.time.Duration;

/**
 * Tuning knobs of a {@link CacheStore}.
 *
 * @param maxSize         entries kept before least-recently-accessed eviction
 * @param defaultTtl      TTL applied when {@code set} is called without one
 * @param cleanupInterval period of the background sweep; zero or {@code null} disables it
 * @param statsEnabled    whether {@code get} counts hits and misses
 * @param singleFlight    whether concurrent {@code getOrSet} misses share one producer call
 */
public record CacheConfig(
    int maxSize,
    Duration defaultTtl,
    Duration cleanupInterval,
    boolean statsEnabled,
    boolean singleFlight
) {

    public static final int DEFAULT_MAX_SIZE = 1000;
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    public static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofMinutes(1);

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, was " + maxSize);
        }
        if (defaultTtl == null) {
            throw new IllegalArgumentException("defaultTtl is required");
        }
    }

    public static CacheConfig defaults() {
        return new CacheConfig(DEFAULT_MAX_SIZE, DEFAULT_TTL, DEFAULT_CLEANUP_INTERVAL, true, false);
    }

    public CacheConfig withMaxSize(int size) {
        return new CacheConfig(size, defaultTtl, cleanupInterval, statsEnabled, singleFlight);
    }

    public CacheConfig withDefaultTtl(Duration ttl) {
        return new CacheConfig(maxSize, ttl, cleanupInterval, statsEnabled, singleFlight);
    }

    public CacheConfig withCleanupInterval(Duration interval) {
        return new CacheConfig(maxSize, defaultTtl, interval, statsEnabled, singleFlight);
    }

    public CacheConfig withStatsEnabled(boolean enabled) {
        return new CacheConfig(maxSize, defaultTtl, cleanupInterval, enabled, singleFlight);
    }

    public CacheConfig withSingleFlight(boolean enabled) {
        return new CacheConfig(maxSize, defaultTtl, cleanupInterval, statsEnabled, enabled);
    }

    boolean sweepEnabled() {
        return cleanupInterval != null && !cleanupInterval.isZero() && !cleanupInterval.isNegative();
    }
}
