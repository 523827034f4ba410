package com.pennywise.common.exception;

/**
 * Well-formed response whose payload is not a usable quote (missing price, empty
 * body, provider "invalid symbol" message). Never retried; the router moves on to
 * the next provider instead.
 */
public class ValidationException extends MarketDataException {

    public ValidationException(String source, String message) {
        super(source, message);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
