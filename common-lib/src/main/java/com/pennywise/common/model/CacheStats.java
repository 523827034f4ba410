package com.pennywise.common.model;

import java.time.Instant;

/**
 * Point-in-time statistics of a cache store. Derived on demand.
 *
 * <p>{@code estimatedMemoryBytes} is a heuristic based on the serialised length of
 * keys and values; it is not byte-exact. {@code oldestEntry} / {@code newestEntry}
 * are {@code null} when the store is empty.
 */
public record CacheStats(
    long hits,
    long misses,
    double hitRate,
    int size,
    Instant oldestEntry,
    Instant newestEntry,
    long estimatedMemoryBytes
) {}
