package com.pennywise.common.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pennywise.common.exception.CacheException;
import com.pennywise.common.model.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * In-memory key/value cache with per-entry TTL, bounded size and hit/miss statistics.
 *
 * <p><strong>Expiry:</strong> lazy on read ({@link #get}, {@link #has}) plus a periodic
 * background sweep ({@link CacheConfig#cleanupInterval()}) so that keys which are
 * written but never read do not pile up. {@link #close()} stops the sweep.
 *
 * <p><strong>Eviction:</strong> entries live in an insertion-ordered {@link LinkedHashMap}
 * and are re-linked at the tail on every read or write touch, so the head is always the
 * least-recently-accessed entry. Inserting a new key into a full store evicts the head
 * first. {@link #has} does not count as a touch.
 *
 * <p>Values are stored by reference; nothing is copied or serialised on the write path.
 * All map access is synchronized on the store because Reactor callbacks may run on
 * different threads.
 *
 * @param <V> value type
 */
public class CacheStore<V> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

    /** Fixed per-entry allowance for timestamps and map bookkeeping in the memory estimate. */
    static final long ENTRY_OVERHEAD_BYTES = 64;

    private final String name;
    private final CacheConfig config;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    private final LinkedHashMap<String, CacheEntry<V>> entries = new LinkedHashMap<>();
    private final Map<String, Mono<V>> inFlight = new ConcurrentHashMap<>();

    private final AtomicLong hits   = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    private final Disposable sweep;

    public CacheStore(String name, CacheConfig config) {
        this(name, config, Clock.systemUTC(), new ObjectMapper().findAndRegisterModules());
    }

    public CacheStore(String name, CacheConfig config, Clock clock, ObjectMapper objectMapper) {
        this.name         = name;
        this.config       = config;
        this.clock        = clock;
        this.objectMapper = objectMapper;
        this.sweep        = config.sweepEnabled() ? startSweep(config.cleanupInterval()) : null;
    }

    // ── basic operations ───────────────────────────────────────────────────

    public void set(String key, V value) {
        set(key, value, null);
    }

    /**
     * Inserts or replaces {@code key}. A {@code null} ttl means the configured default;
     * a zero or negative ttl stores an entry that is already expired.
     */
    public synchronized void set(String key, V value, Duration ttl) {
        Duration effectiveTtl = ttl != null ? ttl : config.defaultTtl();

        if (entries.remove(key) == null && entries.size() >= config.maxSize()) {
            evictEldest();
        }
        entries.put(key, new CacheEntry<>(value, clock.instant(), effectiveTtl));
    }

    /**
     * Returns the live value for {@code key}. An expired entry is removed as a side effect.
     * Counts one hit or one miss when statistics are enabled.
     */
    public synchronized Optional<V> get(String key) {
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            recordMiss();
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key);
            recordMiss();
            return Optional.empty();
        }
        touch(key, entry);
        recordHit();
        return Optional.ofNullable(entry.value());
    }

    /** Same expiry semantics as {@link #get} without touching statistics or recency. */
    public synchronized boolean has(String key) {
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return false;
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key);
            return false;
        }
        return true;
    }

    public synchronized boolean delete(String key) {
        return entries.remove(key) != null;
    }

    /** Drops every entry. Cumulative hit/miss counters are kept; see {@link #resetStats()}. */
    public synchronized void clear() {
        entries.clear();
    }

    public void resetStats() {
        hits.set(0);
        misses.set(0);
    }

    /** Adds {@code additional} to the TTL of a present entry. */
    public synchronized boolean extendTtl(String key, Duration additional) {
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return false;
        }
        entries.put(key, entry.extendedBy(additional));
        return true;
    }

    public synchronized int size() {
        return entries.size();
    }

    // ── reactive compositions ──────────────────────────────────────────────

    public Mono<V> getOrSet(String key, Supplier<Mono<V>> producer) {
        return getOrSet(key, producer, null);
    }

    /**
     * Returns the live value for {@code key} or subscribes to {@code producer}, stores
     * what it emits and returns it.
     *
     * <p>Without {@link CacheConfig#singleFlight()} two callers that miss concurrently
     * each invoke the producer. With it, callers arriving while a producer for the same
     * key is still running share that producer's outcome.
     */
    public Mono<V> getOrSet(String key, Supplier<Mono<V>> producer, Duration ttl) {
        return Mono.defer(() -> {
            Optional<V> cached = get(key);
            if (cached.isPresent()) {
                return Mono.just(cached.get());
            }
            if (!config.singleFlight()) {
                return produceAndStore(key, producer, ttl);
            }
            return inFlight.computeIfAbsent(key, k ->
                produceAndStore(k, producer, ttl)
                    .doFinally(signal -> inFlight.remove(k))
                    .cache());
        });
    }

    public Mono<Map<String, V>> batchGet(List<String> keys,
                                         Function<List<String>, Mono<Map<String, V>>> producer) {
        return batchGet(keys, producer, null);
    }

    /**
     * Resolves many keys at once. Live keys are answered from the store; the producer is
     * subscribed at most once, with only the missing keys (input order, no duplicates).
     * Everything it returns is stored with {@code ttl}.
     *
     * <p>If the producer fails, values of entries that were found expired while
     * partitioning are returned instead; missing keys without such a stale value are
     * left out. The returned map follows the order of {@code keys}.
     */
    public Mono<Map<String, V>> batchGet(List<String> keys,
                                         Function<List<String>, Mono<Map<String, V>>> producer,
                                         Duration ttl) {
        return Mono.defer(() -> {
            List<String> requested = new ArrayList<>(new LinkedHashSet<>(keys));
            Map<String, V> found   = new HashMap<>();
            Map<String, V> stale   = new HashMap<>();
            List<String>   missing = new ArrayList<>();

            synchronized (this) {
                Instant now = clock.instant();
                for (String key : requested) {
                    CacheEntry<V> entry = entries.get(key);
                    if (entry != null && !entry.isExpired(now)) {
                        touch(key, entry);
                        recordHit();
                        found.put(key, entry.value());
                        continue;
                    }
                    if (entry != null) {
                        entries.remove(key);
                        stale.put(key, entry.value());
                    }
                    recordMiss();
                    missing.add(key);
                }
            }

            if (missing.isEmpty()) {
                return Mono.just(ordered(requested, found, Map.of()));
            }

            log.debug("CACHE_BATCH cache={} hits={} misses={}", name, found.size(), missing.size());

            return producer.apply(List.copyOf(missing))
                .defaultIfEmpty(Map.of())
                .map(fetched -> {
                    fetched.forEach((key, value) -> {
                        if (value != null) {
                            set(key, value, ttl);
                        }
                    });
                    return ordered(requested, found, fetched);
                })
                .onErrorResume(e -> {
                    log.warn("CACHE_BATCH_PRODUCER_FAILED cache={} missing={} staleServed={} error={}",
                             name, missing.size(), stale.size(), e.getMessage());
                    return Mono.just(ordered(requested, found, stale));
                });
        });
    }

    // ── diagnostics ────────────────────────────────────────────────────────

    public synchronized CacheStats getStats() {
        long hitCount  = hits.get();
        long missCount = misses.get();
        long total     = hitCount + missCount;
        double hitRate = total > 0 ? (double) hitCount / total : 0.0;

        Instant oldest = null;
        Instant newest = null;
        long memory = 0;
        for (Map.Entry<String, CacheEntry<V>> e : entries.entrySet()) {
            Instant insertedAt = e.getValue().insertedAt();
            if (oldest == null || insertedAt.isBefore(oldest)) {
                oldest = insertedAt;
            }
            if (newest == null || insertedAt.isAfter(newest)) {
                newest = insertedAt;
            }
            memory += estimateBytes(e.getKey(), e.getValue().value());
        }

        return new CacheStats(hitCount, missCount, hitRate, entries.size(), oldest, newest, memory);
    }

    /** Keys whose TTL has elapsed but which have not been swept or read yet. */
    public synchronized List<String> getExpiredItems() {
        Instant now = clock.instant();
        List<String> expired = new ArrayList<>();
        entries.forEach((key, entry) -> {
            if (entry.isExpired(now)) {
                expired.add(key);
            }
        });
        return expired;
    }

    /**
     * Removes expired entries, then trims the store back to {@code maxSize} by
     * least-recent access.
     *
     * @return number of entries removed
     */
    public synchronized int cleanup() {
        Instant now = clock.instant();
        int removed = 0;

        Iterator<CacheEntry<V>> it = entries.values().iterator();
        while (it.hasNext()) {
            if (it.next().isExpired(now)) {
                it.remove();
                removed++;
            }
        }
        while (entries.size() > config.maxSize()) {
            evictEldest();
            removed++;
        }

        if (removed > 0) {
            log.debug("CACHE_SWEEP cache={} removed={} remaining={}", name, removed, entries.size());
        }
        return removed;
    }

    /** Stops the background sweep and drops all entries. */
    @Override
    public void close() {
        if (sweep != null && !sweep.isDisposed()) {
            sweep.dispose();
        }
        clear();
        log.info("CACHE_CLOSED cache={}", name);
    }

    boolean isSweepActive() {
        return sweep != null && !sweep.isDisposed();
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private Mono<V> produceAndStore(String key, Supplier<Mono<V>> producer, Duration ttl) {
        return producer.get().doOnNext(value -> set(key, value, ttl));
    }

    private Disposable startSweep(Duration interval) {
        log.info("CACHE_SWEEP_STARTED cache={} intervalMs={}", name, interval.toMillis());
        return Flux.interval(interval, interval)
            .subscribe(
                tick -> cleanup(),
                err  -> log.error("Cache sweep stopped unexpectedly. cache={}", name, err)
            );
    }

    /** Moves {@code key} to the most-recently-used end. Caller holds the lock. */
    private void touch(String key, CacheEntry<V> entry) {
        entries.remove(key);
        entries.put(key, entry);
    }

    /** Caller holds the lock. */
    private void evictEldest() {
        Iterator<String> it = entries.keySet().iterator();
        if (it.hasNext()) {
            String eldest = it.next();
            it.remove();
            log.debug("CACHE_EVICT cache={} key={}", name, eldest);
        }
    }

    private void recordHit() {
        if (config.statsEnabled()) {
            hits.incrementAndGet();
        }
    }

    private void recordMiss() {
        if (config.statsEnabled()) {
            misses.incrementAndGet();
        }
    }

    private long estimateBytes(String key, V value) {
        long bytes = key.length() * 2L + ENTRY_OVERHEAD_BYTES;
        try {
            bytes += objectMapper.writeValueAsString(value).length() * 2L;
        } catch (JsonProcessingException | RuntimeException | StackOverflowError e) {
            // cyclic values recurse until the stack gives out; only the overhead is counted
            log.warn("CACHE_ESTIMATE_FAILED cache={} key={}", name, key,
                     new CacheException("memory estimate failed for key " + key, e));
        }
        return bytes;
    }

    private static <V> Map<String, V> ordered(List<String> keys, Map<String, V> first, Map<String, V> second) {
        Map<String, V> result = new LinkedHashMap<>();
        for (String key : keys) {
            V value = first.containsKey(key) ? first.get(key) : second.get(key);
            if (value != null) {
                result.put(key, value);
            }
        }
        return result;
    }
}
