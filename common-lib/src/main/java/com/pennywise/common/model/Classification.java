package com.pennywise.common.model;

/**
 * Result of classifying a ticker string. Immutable and recomputed per call.
 *
 * @param symbol     normalised (trimmed, upper-case) ticker
 * @param region     detected market region
 * @param exchange   best-guess listing exchange
 * @param currency   quote currency of the region (BRL or USD)
 * @param confidence heuristic score in [0, 1]
 */
public record Classification(
    String symbol,
    MarketRegion region,
    Exchange exchange,
    String currency,
    double confidence
) {}
