package com.pennywise.marketdata.model;

import com.pennywise.common.model.ProviderResult;
import com.pennywise.common.model.Quote;

/**
 * Facade answer for a single quote. {@code cached} is true only when the value came
 * straight from the quote cache without touching a provider.
 */
public record QuoteResponse(
    boolean success,
    Quote data,
    String error,
    String source,
    boolean cached,
    long responseTimeMs
) {

    public static QuoteResponse fromCache(Quote quote) {
        return new QuoteResponse(true, quote, null, quote.source(), true, 0L);
    }

    public static QuoteResponse fromResult(ProviderResult<Quote> result) {
        return new QuoteResponse(result.success(), result.data(), result.error(), result.source(),
                                 false, result.responseTimeMs());
    }

    public static QuoteResponse failure(String error) {
        return new QuoteResponse(false, null, error, null, false, 0L);
    }
}
