package com.pennywise.common.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * HTTP 429 or a provider-specific "too many calls" marker. When the provider
 * suggested a wait ({@code Retry-After}), the retry executor waits at least that long.
 */
public class RateLimitException extends MarketDataException {
    private final Duration retryAfter;

    public RateLimitException(String source, String message, Duration retryAfter) {
        super(source, message);
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
