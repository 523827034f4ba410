package com.pennywise.marketdata.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pennywise.common.exception.RateLimitException;
import com.pennywise.common.exception.ValidationException;
import com.pennywise.common.model.Quote;
import com.pennywise.marketdata.model.AlphaVantageGlobalQuoteResponse;
import com.pennywise.marketdata.model.AlphaVantageSearchResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * Alpha Vantage {@code GLOBAL_QUOTE} / {@code SYMBOL_SEARCH}. Serves US tickers and acts
 * as the fallback for B3 tickers (queried with the {@code .SA} suffix).
 *
 * <p>Throttling and unknown symbols come back as HTTP 200 with a {@code Note},
 * {@code Information} or {@code Error Message} body; those are turned into
 * {@link RateLimitException} and {@link ValidationException} here.
 */
public class AlphaVantageProvider implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(AlphaVantageProvider.class);

    public static final String ID = "alpha_vantage";

    private static final List<String> THROTTLE_MARKERS = List.of("call frequency", "rate limit", "requests per");

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final Clock clock;

    public AlphaVantageProvider(WebClient alphaVantageWebClient, ObjectMapper objectMapper, String apiKey, Clock clock) {
        this.webClient    = alphaVantageWebClient;
        this.objectMapper = objectMapper;
        this.apiKey       = apiKey;
        this.clock        = clock;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Mono<Quote> fetchQuote(String symbol) {
        return Mono.defer(() -> {
            log.info("Fetching market data. provider=AlphaVantage symbol={}", symbol);
            return query("GLOBAL_QUOTE", "symbol", symbol)
                .map(json -> toQuote(symbol, read(symbol, json, AlphaVantageGlobalQuoteResponse.class)))
                .onErrorMap(e -> ProviderErrors.toTaxonomy(ID, e))
                .doOnNext(q -> log.info("Market data fetched. provider=AlphaVantage symbol={} price={}", q.symbol(), q.price()))
                .doOnError(e -> log.warn("Alpha Vantage fetch failed. symbol={} error={}", symbol, e.getMessage()));
        });
    }

    @Override
    public Mono<Boolean> symbolExists(String symbol) {
        return query("SYMBOL_SEARCH", "keywords", symbol)
            .map(json -> {
                AlphaVantageSearchResponse response = read(symbol, json, AlphaVantageSearchResponse.class);
                rejectThrottled(response.note(), response.information());
                return response.bestMatches() != null && !response.bestMatches().isEmpty();
            })
            .onErrorMap(e -> ProviderErrors.toTaxonomy(ID, e));
    }

    // ── private ───────────────────────────────────────────────────────────────

    private Mono<String> query(String function, String param, String value) {
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/query")
                .queryParam("function", function)
                .queryParam(param, value)
                .queryParam("apikey", apiKey)
                .build())
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> ProviderErrors.fromResponse(ID, response))
            .bodyToMono(String.class)
            .switchIfEmpty(Mono.error(() -> new ValidationException(ID, "empty response body for " + value)));
    }

    private Quote toQuote(String symbol, AlphaVantageGlobalQuoteResponse response) {
        rejectThrottled(response.note(), response.information());
        if (response.information() != null && !response.information().isBlank()) {
            throw new ValidationException(ID, response.information());
        }
        if (response.errorMessage() != null && !response.errorMessage().isBlank()) {
            throw new ValidationException(ID, "invalid symbol " + symbol + ": " + response.errorMessage());
        }
        return QuoteNormalizer.fromAlphaVantage(symbol, response.globalQuote(), clock.instant());
    }

    private static void rejectThrottled(String note, String information) {
        if (note != null && !note.isBlank()) {
            throw new RateLimitException(ID, note, null);
        }
        if (information != null && isThrottle(information)) {
            throw new RateLimitException(ID, information, null);
        }
    }

    private static boolean isThrottle(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        return THROTTLE_MARKERS.stream().anyMatch(lower::contains);
    }

    private <T> T read(String symbol, String json, Class<T> type) {
        try {
            T value = objectMapper.readValue(json, type);
            if (value == null) {
                throw new ValidationException(ID, "empty response body for " + symbol);
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new ValidationException(ID, "unreadable response for " + symbol + ": " + e.getOriginalMessage());
        }
    }
}
