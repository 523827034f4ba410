package com.pennywise.marketdata.model;

import com.pennywise.common.model.Quote;

import java.util.List;

/** {@code success} is true when at least one of the requested quotes was resolved. */
public record MultiQuoteResponse(
    boolean success,
    List<Quote> data,
    String error
) {

    public static final String NO_QUOTES = "No quotes found";

    public static MultiQuoteResponse of(List<Quote> quotes) {
        return quotes.isEmpty()
            ? new MultiQuoteResponse(false, List.of(), NO_QUOTES)
            : new MultiQuoteResponse(true, List.copyOf(quotes), null);
    }
}
