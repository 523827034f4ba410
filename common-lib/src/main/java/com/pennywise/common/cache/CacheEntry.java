package com.pennywise.common.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable cache slot. A non-positive {@code ttl} makes the entry expired from the
 * moment it is written.
 */
public record CacheEntry<V>(
    V value,
    Instant insertedAt,
    Duration ttl
) {

    public boolean isExpired(Instant now) {
        if (ttl.isZero() || ttl.isNegative()) {
            return true;
        }
        return Duration.between(insertedAt, now).compareTo(ttl) > 0;
    }

    CacheEntry<V> extendedBy(Duration additional) {
        return new CacheEntry<>(value, insertedAt, ttl.plus(additional));
    }
}
