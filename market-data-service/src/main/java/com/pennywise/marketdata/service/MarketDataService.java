package com.pennywise.marketdata.service;

import com.pennywise.common.cache.CacheKeys;
import com.pennywise.common.cache.CacheStore;
import com.pennywise.common.classifier.SymbolClassifier;
import com.pennywise.common.model.CacheStats;
import com.pennywise.common.model.FailureRecord;
import com.pennywise.common.model.MarketRegion;
import com.pennywise.common.model.Quote;
import com.pennywise.common.retry.LogSink;
import com.pennywise.marketdata.batch.BatchCoordinator;
import com.pennywise.marketdata.model.HealthStatus;
import com.pennywise.marketdata.model.MultiQuoteResponse;
import com.pennywise.marketdata.model.QuoteResponse;
import com.pennywise.marketdata.provider.MarketDataProvider;
import com.pennywise.marketdata.router.ProviderRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Entry point for dashboard and chat callers. Composes the quote cache, the
 * {@link ProviderRouter} and the {@link BatchCoordinator}.
 *
 * <p><strong>Single quote flow:</strong>
 * <ol>
 *   <li>Check the quote cache; a live entry is returned with {@code cached=true}.</li>
 *   <li>On miss, resolve through the router (retries and fallback included).</li>
 *   <li>Successful quotes are cached with the quote TTL; failures are reported in the
 *       response, never thrown and never cached.</li>
 * </ol>
 *
 * <p>Symbol validation has its own cache with twice the quote TTL.
 */
public class MarketDataService {

    private static final Logger log = LoggerFactory.getLogger(MarketDataService.class);

    static final String SYMBOL_REQUIRED = "Symbol is required";

    private final ProviderRouter router;
    private final BatchCoordinator batchCoordinator;
    private final CacheStore<Quote> quoteCache;
    private final CacheStore<Boolean> validationCache;
    private final LogSink failureLog;
    private final Duration quoteTtl;
    private final String primaryProbe;
    private final String fallbackProbe;

    public MarketDataService(ProviderRouter router, BatchCoordinator batchCoordinator,
                             CacheStore<Quote> quoteCache, CacheStore<Boolean> validationCache,
                             LogSink failureLog, Duration quoteTtl,
                             String primaryProbe, String fallbackProbe) {
        this.router           = router;
        this.batchCoordinator = batchCoordinator;
        this.quoteCache       = quoteCache;
        this.validationCache  = validationCache;
        this.failureLog       = failureLog;
        this.quoteTtl         = quoteTtl;
        this.primaryProbe     = primaryProbe;
        this.fallbackProbe    = fallbackProbe;
    }

    // ── quotes ────────────────────────────────────────────────────────────────

    public Mono<QuoteResponse> getQuote(String symbol) {
        if (isBlank(symbol)) {
            return Mono.just(QuoteResponse.failure(SYMBOL_REQUIRED));
        }
        String normalized = normalize(symbol);
        String key = CacheKeys.quote(normalized);

        return Mono.defer(() -> {
            Optional<Quote> cached = quoteCache.get(key);
            if (cached.isPresent()) {
                log.info("CACHE_HIT symbol={} source={}", normalized, cached.get().source());
                return Mono.just(QuoteResponse.fromCache(cached.get()));
            }

            log.info("CACHE_MISS symbol={}", normalized);
            return router.getQuote(normalized)
                .map(result -> {
                    if (result.success()) {
                        quoteCache.set(key, result.data(), quoteTtl);
                    } else {
                        log.warn("QUOTE_UNAVAILABLE symbol={} error={}", normalized, result.error());
                    }
                    return QuoteResponse.fromResult(result);
                });
        });
    }

    public Mono<MultiQuoteResponse> getMultipleQuotes(List<String> symbols) {
        if (symbols == null || symbols.isEmpty()) {
            return Mono.just(MultiQuoteResponse.of(List.of()));
        }
        return batchCoordinator.getMany(symbols)
            .map(bySymbol -> MultiQuoteResponse.of(new ArrayList<>(bySymbol.values())))
            .onErrorResume(e -> {
                log.error("Batch quote request failed. symbols={}", symbols.size(), e);
                return Mono.just(new MultiQuoteResponse(false, List.of(), e.getMessage()));
            });
    }

    // ── validation ────────────────────────────────────────────────────────────

    /**
     * True when a provider knows the ticker. Unclassifiable input is rejected without a
     * lookup. Definite answers are cached; lookup failures answer {@code false} and are
     * not cached.
     */
    public Mono<Boolean> validateSymbol(String symbol) {
        if (isBlank(symbol)) {
            return Mono.just(false);
        }
        String normalized = normalize(symbol);
        if (SymbolClassifier.classify(normalized).region() == MarketRegion.UNKNOWN) {
            log.debug("VALIDATION_REJECTED symbol={} reason=unclassifiable", normalized);
            return Mono.just(false);
        }
        String key = CacheKeys.validation(normalized);

        return Mono.defer(() -> {
            Optional<Boolean> cached = validationCache.get(key);
            if (cached.isPresent()) {
                return Mono.just(cached.get());
            }
            return router.symbolExists(normalized)
                .map(result -> {
                    if (!result.success()) {
                        log.warn("VALIDATION_LOOKUP_FAILED symbol={} error={}", normalized, result.error());
                        return false;
                    }
                    boolean exists = Boolean.TRUE.equals(result.data());
                    validationCache.set(key, exists, validationTtl());
                    return exists;
                });
        });
    }

    // ── cache management ──────────────────────────────────────────────────────

    public CacheStats getCacheStats() {
        return quoteCache.getStats();
    }

    public void clearCache() {
        quoteCache.clear();
        validationCache.clear();
        log.info("CACHE_CLEARED caches=quote,validation");
    }

    // ── health ────────────────────────────────────────────────────────────────

    /** Probes both providers directly (no retries) and reports which ones answered. */
    public Mono<HealthStatus> healthCheck() {
        MarketDataProvider primary   = router.getPrimary();
        MarketDataProvider secondary = router.getSecondary();

        return Mono.zip(probe(primary, primaryProbe), probe(secondary, fallbackProbe))
            .map(t -> new HealthStatus(t.getT1(), t.getT2(), primary.id(), secondary.id(), getCacheStats()))
            .doOnNext(h -> log.info("HEALTH_CHECK {}={} {}={}",
                                    h.primarySource(), h.primaryHealthy(), h.fallbackSource(), h.fallbackHealthy()));
    }

    // ── failure log ───────────────────────────────────────────────────────────

    /** Read on {@code boundedElastic}: the file-backed sink does blocking I/O. */
    public Mono<List<FailureRecord>> getFailureLog() {
        return Mono.fromCallable(failureLog::readAll)
            .subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<Void> clearFailureLog() {
        return Mono.fromRunnable(() -> {
                failureLog.clear();
                log.info("FAILURE_LOG_CLEARED");
            })
            .subscribeOn(Schedulers.boundedElastic())
            .then();
    }

    // ── private ───────────────────────────────────────────────────────────────

    private Duration validationTtl() {
        return quoteTtl.multipliedBy(2);
    }

    private static Mono<Boolean> probe(MarketDataProvider provider, String symbol) {
        return provider.fetchQuote(symbol)
            .map(quote -> Boolean.TRUE)
            .defaultIfEmpty(Boolean.FALSE)
            .onErrorResume(e -> {
                log.warn("HEALTH_PROBE_FAILED provider={} symbol={} error={}", provider.id(), symbol, e.getMessage());
                return Mono.just(Boolean.FALSE);
            });
    }

    private static boolean isBlank(String symbol) {
        return symbol == null || symbol.isBlank();
    }

    private static String normalize(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
