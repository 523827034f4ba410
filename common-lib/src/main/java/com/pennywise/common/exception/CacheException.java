package com.pennywise.common.exception;

/**
 * Unexpected failure while reading or estimating the cache. Always logged and
 * swallowed by the store; callers never see it.
 */
public class CacheException extends MarketDataException {

    public CacheException(String message, Throwable cause) {
        super("cache", message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
