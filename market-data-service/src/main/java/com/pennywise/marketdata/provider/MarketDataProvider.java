package com.pennywise.marketdata.provider;

import com.pennywise.common.model.Quote;
import reactor.core.publisher.Mono;

/**
 * Strategy interface for one upstream quote source.
 *
 * <p>Implementations make exactly one HTTP call per subscription and signal failures
 * with the {@code MarketDataException} taxonomy; retries and fallback live above them
 * in the router.
 */
public interface MarketDataProvider {

    /** Stable id reported as the quote source, e.g. {@code oplab}. */
    String id();

    /**
     * @param symbol ticker in the provider's own notation (e.g. {@code PETR4.SA} for Alpha Vantage)
     */
    Mono<Quote> fetchQuote(String symbol);

    /** Whether the provider knows the ticker at all. */
    Mono<Boolean> symbolExists(String symbol);
}
