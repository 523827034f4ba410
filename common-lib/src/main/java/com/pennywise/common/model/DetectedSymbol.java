package com.pennywise.common.model;

/**
 * A ticker candidate found in free text, with the surrounding snippet it was found in.
 */
public record DetectedSymbol(
    String symbol,
    String context,
    double confidence
) {}
