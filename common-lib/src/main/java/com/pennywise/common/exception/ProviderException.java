package com.pennywise.common.exception;

/** Non-2xx, non-429 response from a provider. */
public class ProviderException extends MarketDataException {
    private final int httpStatus;

    public ProviderException(String source, int httpStatus, String message) {
        super(source, "HTTP " + httpStatus + ": " + message);
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
