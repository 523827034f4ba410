package com.pennywise.common.exception;

/**
 * Root of the market-data error taxonomy. Carries the id of the provider (or
 * component) that raised it and whether the retry executor may try again.
 */
public abstract class MarketDataException extends RuntimeException {
    private final String source;

    protected MarketDataException(String source, String message) {
        super("[" + source + "] " + message);
        this.source = source;
    }

    protected MarketDataException(String source, String message, Throwable cause) {
        super("[" + source + "] " + message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }

    public abstract boolean isRetryable();
}
