package com.pennywise.common.model;

import java.math.BigDecimal;

/**
 * Canonical quote shape every provider response is normalised into before caching
 * or display. {@code changePercent} is a percentage (1.5 means 1.5 %), not a fraction.
 *
 * <p>OHLC consistency is not checked here; providers are trusted for it.
 */
public record Quote(
    String symbol,
    BigDecimal price,
    BigDecimal change,
    BigDecimal changePercent,
    long volume,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal previousClose,
    String timestamp,      // ISO-8601
    String source
) {

    /** Same quote reported under the caller's ticker (e.g. {@code PETR4} for a {@code PETR4.SA} lookup). */
    public Quote withSymbol(String newSymbol) {
        return new Quote(newSymbol, price, change, changePercent, volume, open, high, low,
                         previousClose, timestamp, source);
    }
}
