package com.pennywise.marketdata.batch;

import com.pennywise.common.cache.CacheKeys;
import com.pennywise.common.cache.CacheStore;
import com.pennywise.common.model.Quote;
import com.pennywise.common.retry.Sleeper;
import com.pennywise.marketdata.router.ProviderRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Multi-symbol quote resolution on top of the quote cache.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Normalise and de-duplicate the requested symbols.</li>
 *   <li>{@link CacheStore#batchGet} answers live keys and hands the misses over once.</li>
 *   <li>Misses are fetched in chunks of {@code batchSize}: chunks run one after the
 *       other with {@code batchDelay} between them, symbols inside a chunk run
 *       concurrently.</li>
 *   <li>Successful quotes are written back to the cache by {@code batchGet}; failed
 *       symbols are simply absent from the result.</li>
 * </ol>
 *
 * <p>The returned map is keyed by symbol in request order.
 */
public class BatchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BatchCoordinator.class);

    public static final int DEFAULT_BATCH_SIZE = 10;
    public static final Duration DEFAULT_BATCH_DELAY = Duration.ofMillis(100);

    private final CacheStore<Quote> quoteCache;
    private final ProviderRouter router;
    private final Sleeper sleeper;
    private final int batchSize;
    private final Duration batchDelay;
    private final Duration quoteTtl;

    public BatchCoordinator(CacheStore<Quote> quoteCache, ProviderRouter router, Sleeper sleeper,
                            int batchSize, Duration batchDelay, Duration quoteTtl) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, was " + batchSize);
        }
        this.quoteCache = quoteCache;
        this.router     = router;
        this.sleeper    = sleeper;
        this.batchSize  = batchSize;
        this.batchDelay = batchDelay;
        this.quoteTtl   = quoteTtl;
    }

    public Mono<Map<String, Quote>> getMany(List<String> symbols) {
        List<String> keys = new ArrayList<>(new LinkedHashSet<>(
            symbols.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(s -> CacheKeys.quote(s.trim().toUpperCase(Locale.ROOT)))
                .toList()));

        if (keys.isEmpty()) {
            return Mono.just(Map.of());
        }

        return quoteCache.batchGet(keys, this::fetchMissing, quoteTtl)
            .map(byKey -> {
                Map<String, Quote> bySymbol = new LinkedHashMap<>();
                byKey.forEach((key, quote) -> bySymbol.put(CacheKeys.symbolOfQuoteKey(key), quote));
                log.info("BATCH_COMPLETE requested={} resolved={}", keys.size(), bySymbol.size());
                return bySymbol;
            });
    }

    // ── private ───────────────────────────────────────────────────────────────

    private Mono<Map<String, Quote>> fetchMissing(List<String> missingKeys) {
        List<List<String>> chunks = partition(missingKeys, batchSize);
        Map<String, Quote> fetched = new ConcurrentHashMap<>();

        return Flux.range(0, chunks.size())
            .concatMap(i -> (i == 0 ? Mono.<Void>empty() : sleeper.sleep(batchDelay))
                .then(fetchChunk(i, chunks.get(i), fetched)))
            .then(Mono.fromSupplier(() -> (Map<String, Quote>) fetched));
    }

    private Mono<Void> fetchChunk(int index, List<String> keys, Map<String, Quote> fetched) {
        return Mono.defer(() -> {
            log.debug("BATCH_CHUNK index={} size={}", index, keys.size());
            return Flux.fromIterable(keys)
                .flatMap(key -> {
                    String symbol = CacheKeys.symbolOfQuoteKey(key);
                    return router.getQuote(symbol)
                        .doOnNext(result -> {
                            if (result.success() && result.data() != null) {
                                fetched.put(key, result.data());
                            } else {
                                log.warn("BATCH_SYMBOL_FAILED symbol={} error={}", symbol, result.error());
                            }
                        })
                        .onErrorResume(e -> {
                            log.warn("BATCH_SYMBOL_FAILED symbol={} error={}", symbol, e.getMessage());
                            return Mono.empty();
                        });
                })
                .then();
        });
    }

    static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> chunks = new ArrayList<>();
        for (int from = 0; from < items.size(); from += size) {
            chunks.add(items.subList(from, Math.min(items.size(), from + size)));
        }
        return chunks;
    }
}
