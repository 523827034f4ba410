package com.pennywise.marketdata.client;

import com.pennywise.common.classifier.SymbolClassifier;
import com.pennywise.common.classifier.SymbolDetector;
import com.pennywise.common.model.CacheStats;
import com.pennywise.common.model.Classification;
import com.pennywise.common.model.DetectedSymbol;
import com.pennywise.common.model.FailureRecord;
import com.pennywise.marketdata.model.HealthStatus;
import com.pennywise.marketdata.model.MultiQuoteResponse;
import com.pennywise.marketdata.model.QuoteResponse;
import com.pennywise.marketdata.service.MarketDataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/market-data")
public class MarketDataController {

    private static final Logger log = LoggerFactory.getLogger(MarketDataController.class);

    private final MarketDataService service;

    public MarketDataController(MarketDataService service) {
        this.service = service;
    }

    @GetMapping("/quote/{symbol}")
    public Mono<ResponseEntity<QuoteResponse>> getQuote(@PathVariable String symbol) {
        return service.getQuote(symbol)
            .map(response -> response.success()
                ? ResponseEntity.ok(response)
                : ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(response))
            .onErrorResume(e -> {
                log.error("Quote request failed. symbol={}", symbol, e);
                return Mono.just(ResponseEntity.internalServerError().build());
            });
    }

    @GetMapping("/quotes")
    public Mono<ResponseEntity<MultiQuoteResponse>> getQuotes(@RequestParam List<String> symbols) {
        return service.getMultipleQuotes(symbols)
            .map(response -> response.success()
                ? ResponseEntity.ok(response)
                : ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(response))
            .onErrorResume(e -> {
                log.error("Batch quote request failed. symbols={}", symbols, e);
                return Mono.just(ResponseEntity.internalServerError().build());
            });
    }

    @GetMapping("/validate/{symbol}")
    public Mono<Map<String, Object>> validate(@PathVariable String symbol) {
        return service.validateSymbol(symbol)
            .map(valid -> Map.<String, Object>of("symbol", symbol.trim().toUpperCase(Locale.ROOT), "valid", valid));
    }

    @GetMapping("/classify/{symbol}")
    public Classification classify(@PathVariable String symbol) {
        return SymbolClassifier.classify(symbol);
    }

    @PostMapping("/detect")
    public List<DetectedSymbol> detect(@RequestBody String text) {
        return SymbolDetector.detect(text);
    }

    @GetMapping("/cache/stats")
    public CacheStats cacheStats() {
        return service.getCacheStats();
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache() {
        service.clearCache();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<HealthStatus>> health() {
        return service.healthCheck()
            .map(status -> status.anyHealthy()
                ? ResponseEntity.ok(status)
                : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(status));
    }

    @GetMapping("/errors")
    public Mono<List<FailureRecord>> errors() {
        return service.getFailureLog();
    }

    @DeleteMapping("/errors")
    public Mono<ResponseEntity<Void>> clearErrors() {
        return service.clearFailureLog()
            .then(Mono.fromSupplier(() -> ResponseEntity.noContent().<Void>build()));
    }
}
