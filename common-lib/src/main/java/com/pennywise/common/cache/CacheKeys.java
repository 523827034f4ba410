package com.pennywise.common.cache;

import java.util.Locale;

/** Namespaced cache keys shared by the market-data components. */
public final class CacheKeys {

    public static final String QUOTE_PREFIX = "quote:";
    public static final String VALIDATION_PREFIX = "validation:";

    private CacheKeys() {}

    public static String quote(String symbol) {
        return QUOTE_PREFIX + normalize(symbol);
    }

    public static String validation(String symbol) {
        return VALIDATION_PREFIX + normalize(symbol);
    }

    /** Strips the {@code quote:} namespace; returns the key unchanged when it has none. */
    public static String symbolOfQuoteKey(String key) {
        return key.startsWith(QUOTE_PREFIX) ? key.substring(QUOTE_PREFIX.length()) : key;
    }

    private static String normalize(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
