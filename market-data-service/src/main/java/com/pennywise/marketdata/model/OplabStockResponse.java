package com.pennywise.marketdata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/** Body of {@code GET /market/stocks/{symbol}} on OpLab. Only the fields the normalizer reads. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OplabStockResponse(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("name") String name,
    @JsonProperty("market") Market market
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Market(
        @JsonProperty("open") BigDecimal open,
        @JsonProperty("high") BigDecimal high,
        @JsonProperty("low") BigDecimal low,
        @JsonProperty("close") BigDecimal close,
        @JsonProperty("vol") BigDecimal volume,
        @JsonProperty("previous_close") BigDecimal previousClose,
        @JsonProperty("variation") BigDecimal variation      // percent
    ) {}
}
