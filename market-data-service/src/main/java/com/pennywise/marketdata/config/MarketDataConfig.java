package com.pennywise.marketdata.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pennywise.common.cache.CacheConfig;
import com.pennywise.common.cache.CacheStore;
import com.pennywise.common.model.Quote;
import com.pennywise.common.retry.CappedLogSink;
import com.pennywise.common.retry.JsonFileLogSink;
import com.pennywise.common.retry.LogSink;
import com.pennywise.common.retry.RetryExecutor;
import com.pennywise.common.retry.RetryPolicy;
import com.pennywise.common.retry.Sleeper;
import com.pennywise.marketdata.batch.BatchCoordinator;
import com.pennywise.marketdata.provider.AlphaVantageProvider;
import com.pennywise.marketdata.provider.OplabProvider;
import com.pennywise.marketdata.router.ProviderRouter;
import com.pennywise.marketdata.service.MarketDataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the framework-free building blocks from common-lib into the service.
 * Cache stores are closed on shutdown, which stops their sweep timers.
 */
@Configuration
public class MarketDataConfig {

    private static final Logger log = LoggerFactory.getLogger(MarketDataConfig.class);

    // ── cache ─────────────────────────────────────────────────────────────────
    @Value("${market-data.cache.max-size:1000}")
    private int cacheMaxSize;

    @Value("${market-data.cache.ttl:5m}")
    private Duration quoteTtl;

    @Value("${market-data.cache.cleanup-interval:1m}")
    private Duration cleanupInterval;

    @Value("${market-data.cache.stats-enabled:true}")
    private boolean statsEnabled;

    @Value("${market-data.cache.single-flight:false}")
    private boolean singleFlight;

    // ── retry ─────────────────────────────────────────────────────────────────
    @Value("${market-data.retry.max-attempts:3}")
    private int maxAttempts;

    @Value("${market-data.retry.base-delay:1s}")
    private Duration baseDelay;

    // ── batch ─────────────────────────────────────────────────────────────────
    @Value("${market-data.batch.size:10}")
    private int batchSize;

    @Value("${market-data.batch.delay:100ms}")
    private Duration batchDelay;

    // ── failure log ───────────────────────────────────────────────────────────
    @Value("${market-data.error-log.type:memory}")
    private String errorLogType;

    @Value("${market-data.error-log.directory:./logs}")
    private String errorLogDirectory;

    @Value("${market-data.error-log.capacity:50}")
    private int errorLogCapacity;

    // ── health ────────────────────────────────────────────────────────────────
    @Value("${market-data.health.primary-probe:PETR4}")
    private String primaryProbe;

    @Value("${market-data.health.fallback-probe:AAPL}")
    private String fallbackProbe;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.REACTOR;
    }

    @Bean
    public CacheConfig cacheConfig() {
        return new CacheConfig(cacheMaxSize, quoteTtl, cleanupInterval, statsEnabled, singleFlight);
    }

    @Bean(destroyMethod = "close")
    public CacheStore<Quote> quoteCache(CacheConfig cacheConfig, Clock clock, ObjectMapper objectMapper) {
        return new CacheStore<>("quote", cacheConfig, clock, objectMapper);
    }

    @Bean(destroyMethod = "close")
    public CacheStore<Boolean> validationCache(CacheConfig cacheConfig, Clock clock, ObjectMapper objectMapper) {
        return new CacheStore<>("validation", cacheConfig.withDefaultTtl(quoteTtl.multipliedBy(2)), clock, objectMapper);
    }

    @Bean
    public RetryPolicy retryPolicy() {
        return RetryPolicy.of(maxAttempts, baseDelay);
    }

    @Bean
    public LogSink failureLogSink(ObjectMapper objectMapper) {
        if ("file".equalsIgnoreCase(errorLogType)) {
            Path directory = Path.of(errorLogDirectory);
            log.info("Failure log persisted to file. directory={} capacity={}", directory, errorLogCapacity);
            return new JsonFileLogSink(directory, errorLogCapacity, objectMapper);
        }
        return new CappedLogSink(errorLogCapacity);
    }

    @Bean
    public RetryExecutor retryExecutor(LogSink failureLogSink, Sleeper sleeper, Clock clock) {
        return new RetryExecutor(failureLogSink, sleeper, clock);
    }

    @Bean
    public ProviderRouter providerRouter(OplabProvider oplabProvider, AlphaVantageProvider alphaVantageProvider,
                                         RetryExecutor retryExecutor, RetryPolicy retryPolicy) {
        return new ProviderRouter(oplabProvider, alphaVantageProvider, retryExecutor, retryPolicy);
    }

    @Bean
    public BatchCoordinator batchCoordinator(CacheStore<Quote> quoteCache, ProviderRouter providerRouter,
                                             Sleeper sleeper) {
        return new BatchCoordinator(quoteCache, providerRouter, sleeper, batchSize, batchDelay, quoteTtl);
    }

    @Bean
    public MarketDataService marketDataService(ProviderRouter providerRouter, BatchCoordinator batchCoordinator,
                                               CacheStore<Quote> quoteCache, CacheStore<Boolean> validationCache,
                                               LogSink failureLogSink) {
        return new MarketDataService(providerRouter, batchCoordinator, quoteCache, validationCache,
                                     failureLogSink, quoteTtl, primaryProbe, fallbackProbe);
    }
}
