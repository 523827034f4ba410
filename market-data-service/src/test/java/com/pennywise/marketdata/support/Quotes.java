package com.pennywise.marketdata.support;

import com.pennywise.common.model.Quote;

import java.math.BigDecimal;

/** Quote fixtures. */
public final class Quotes {

    private Quotes() {}

    public static Quote quote(String symbol, String source) {
        BigDecimal price = new BigDecimal("10.00");
        return new Quote(symbol, price, BigDecimal.ZERO, BigDecimal.ZERO, 1000L,
                         price, price, price, price, "2024-03-01T12:00:00Z", source);
    }
}
