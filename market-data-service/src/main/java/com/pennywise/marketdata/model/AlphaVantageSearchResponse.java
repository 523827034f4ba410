package com.pennywise.marketdata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AlphaVantageSearchResponse(
    @JsonProperty("bestMatches") List<Match> bestMatches,
    @JsonProperty("Note") String note,
    @JsonProperty("Information") String information
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Match(
        @JsonProperty("1. symbol") String symbol,
        @JsonProperty("2. name") String name,
        @JsonProperty("4. region") String region
    ) {}
}
