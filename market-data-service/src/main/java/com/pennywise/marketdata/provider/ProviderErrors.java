package com.pennywise.marketdata.provider;

import com.pennywise.common.exception.MarketDataException;
import com.pennywise.common.exception.NetworkException;
import com.pennywise.common.exception.ProviderException;
import com.pennywise.common.exception.RateLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Maps WebClient outcomes onto the market-data error taxonomy.
 *
 * <p>429 becomes {@link RateLimitException} (honouring a numeric {@code Retry-After}),
 * any other non-2xx a {@link ProviderException}, and anything that is not already a
 * {@link MarketDataException} (connect refused, read timeout, reset) a
 * {@link NetworkException}.
 */
final class ProviderErrors {

    static final int TOO_MANY_REQUESTS = 429;
    private static final int MAX_BODY_IN_MESSAGE = 200;

    private ProviderErrors() {}

    /** For {@code retrieve().onStatus(...)}. */
    static Mono<? extends Throwable> fromResponse(String source, ClientResponse response) {
        int status = response.statusCode().value();
        String retryAfter = response.headers().asHttpHeaders().getFirst(HttpHeaders.RETRY_AFTER);
        return response.bodyToMono(String.class)
            .defaultIfEmpty("")
            .map(body -> fromStatus(source, status, retryAfter, body));
    }

    static MarketDataException fromStatus(String source, int status, String retryAfter, String body) {
        if (status == TOO_MANY_REQUESTS) {
            return new RateLimitException(source, "rate limited by provider", parseRetryAfter(retryAfter));
        }
        return new ProviderException(source, status, abbreviate(body));
    }

    static Throwable toTaxonomy(String source, Throwable error) {
        if (error instanceof MarketDataException) {
            return error;
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new NetworkException(source, message, error);
    }

    /** Seconds form only; HTTP-date values are ignored. */
    static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(header.trim());
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String abbreviate(String body) {
        if (body == null || body.isBlank()) {
            return "empty response body";
        }
        return body.length() <= MAX_BODY_IN_MESSAGE ? body : body.substring(0, MAX_BODY_IN_MESSAGE) + "...";
    }
}
