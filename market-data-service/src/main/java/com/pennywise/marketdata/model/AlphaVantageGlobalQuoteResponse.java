package com.pennywise.marketdata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code function=GLOBAL_QUOTE}. Alpha Vantage answers HTTP 200 even when
 * throttled or when the symbol is unknown; those cases arrive as {@code Note},
 * {@code Information} or {@code Error Message} instead of a populated quote.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AlphaVantageGlobalQuoteResponse(
    @JsonProperty("Global Quote") GlobalQuote globalQuote,
    @JsonProperty("Note") String note,
    @JsonProperty("Information") String information,
    @JsonProperty("Error Message") String errorMessage
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GlobalQuote(
        @JsonProperty("01. symbol") String symbol,
        @JsonProperty("02. open") String open,
        @JsonProperty("03. high") String high,
        @JsonProperty("04. low") String low,
        @JsonProperty("05. price") String price,
        @JsonProperty("06. volume") String volume,
        @JsonProperty("07. latest trading day") String latestTradingDay,
        @JsonProperty("08. previous close") String previousClose,
        @JsonProperty("09. change") String change,
        @JsonProperty("10. change percent") String changePercent
    ) {}
}
