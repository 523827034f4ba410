package com.pennywise.common.exception;

/** Transport-level failure: timeout, refused connection, reset. */
public class NetworkException extends MarketDataException {

    public NetworkException(String source, String message) {
        super(source, message);
    }

    public NetworkException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
