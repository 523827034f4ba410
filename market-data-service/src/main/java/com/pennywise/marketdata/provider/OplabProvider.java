package com.pennywise.marketdata.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pennywise.common.exception.ProviderException;
import com.pennywise.common.exception.ValidationException;
import com.pennywise.common.model.Quote;
import com.pennywise.marketdata.model.OplabStockResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * OpLab stock endpoint, the primary source for B3 tickers. Authenticates with the
 * {@code Access-Token} header on every request.
 */
public class OplabProvider implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(OplabProvider.class);

    public static final String ID = "oplab";
    static final String ACCESS_TOKEN_HEADER = "Access-Token";
    static final String STOCK_PATH = "/market/stocks/{symbol}";

    private static final int NOT_FOUND = 404;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String accessToken;
    private final Clock clock;

    public OplabProvider(WebClient oplabWebClient, ObjectMapper objectMapper, String accessToken, Clock clock) {
        this.webClient    = oplabWebClient;
        this.objectMapper = objectMapper;
        this.accessToken  = accessToken;
        this.clock        = clock;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Mono<Quote> fetchQuote(String symbol) {
        return Mono.defer(() -> {
            log.info("Fetching market data. provider=OpLab symbol={}", symbol);
            return webClient.get()
                .uri(STOCK_PATH, symbol)
                .header(ACCESS_TOKEN_HEADER, accessToken)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> ProviderErrors.fromResponse(ID, response))
                .bodyToMono(String.class)
                .switchIfEmpty(Mono.error(() -> new ValidationException(ID, "empty response body for " + symbol)))
                .map(json -> QuoteNormalizer.fromOplab(symbol, parse(symbol, json), clock.instant()))
                .onErrorMap(e -> ProviderErrors.toTaxonomy(ID, e))
                .doOnNext(q -> log.info("Market data fetched. provider=OpLab symbol={} price={}", q.symbol(), q.price()))
                .doOnError(e -> log.warn("OpLab fetch failed. symbol={} error={}", symbol, e.getMessage()));
        });
    }

    /** 2xx means the ticker exists; 404 means it does not; anything else is an error. */
    @Override
    public Mono<Boolean> symbolExists(String symbol) {
        return webClient.get()
            .uri(STOCK_PATH, symbol)
            .header(ACCESS_TOKEN_HEADER, accessToken)
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> ProviderErrors.fromResponse(ID, response))
            .toBodilessEntity()
            .map(entity -> Boolean.TRUE)
            .onErrorMap(e -> ProviderErrors.toTaxonomy(ID, e))
            .onErrorResume(ProviderException.class, e -> e.getHttpStatus() == NOT_FOUND
                ? Mono.just(Boolean.FALSE)
                : Mono.error(e));
    }

    private OplabStockResponse parse(String symbol, String json) {
        try {
            return objectMapper.readValue(json, OplabStockResponse.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException(ID, "unreadable response for " + symbol + ": " + e.getOriginalMessage());
        }
    }
}
