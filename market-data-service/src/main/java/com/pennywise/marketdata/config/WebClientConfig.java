package com.pennywise.marketdata.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pennywise.marketdata.provider.AlphaVantageProvider;
import com.pennywise.marketdata.provider.OplabProvider;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * One WebClient per provider, sharing connect/read timeouts and a request logging
 * filter that masks API keys.
 */
@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    // ── OpLab (primary, B3) ───────────────────────────────────────────────────
    @Value("${oplab.base-url:https://api.oplab.com.br/v3}")
    private String oplabBaseUrl;

    @Value("${oplab.access-token:}")
    private String oplabAccessToken;

    // ── Alpha Vantage (secondary, global) ─────────────────────────────────────
    @Value("${alpha-vantage.base-url:https://www.alphavantage.co}")
    private String alphaVantageBaseUrl;

    @Value("${alpha-vantage.api-key:demo}")
    private String alphaVantageApiKey;

    // ── shared HTTP settings ──────────────────────────────────────────────────
    @Value("${market-data.http.connect-timeout-ms:10000}")
    private int connectTimeoutMs;

    @Value("${market-data.http.read-timeout-seconds:15}")
    private int readTimeoutSeconds;

    @Bean
    public WebClient oplabWebClient(WebClient.Builder builder) {
        return build(builder.clone(), oplabBaseUrl);
    }

    @Bean
    public WebClient alphaVantageWebClient(WebClient.Builder builder) {
        return build(builder.clone(), alphaVantageBaseUrl);
    }

    @Bean
    public OplabProvider oplabProvider(WebClient oplabWebClient, ObjectMapper objectMapper, Clock clock) {
        if (oplabAccessToken.isBlank()) {
            log.warn("OpLab access token not configured; B3 quotes will fall back to Alpha Vantage");
        }
        return new OplabProvider(oplabWebClient, objectMapper, oplabAccessToken, clock);
    }

    @Bean
    public AlphaVantageProvider alphaVantageProvider(WebClient alphaVantageWebClient, ObjectMapper objectMapper,
                                                     Clock clock) {
        return new AlphaVantageProvider(alphaVantageWebClient, objectMapper, alphaVantageApiKey, clock);
    }

    private WebClient build(WebClient.Builder builder, String baseUrl) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofSeconds(readTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(readTimeoutSeconds, TimeUnit.SECONDS))
            );

        return builder
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    static ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), sanitize(clientRequest.url().toString()));
            return Mono.just(clientRequest);
        });
    }

    static String sanitize(String uri) {
        return uri.replaceAll("apikey=[^&]+", "apikey=***");
    }
}
