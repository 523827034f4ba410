package com.pennywise.common.model;

/**
 * Market a ticker most likely trades in. Drives provider routing inside the
 * market-data service: {@link #BR} symbols go to the B3-oriented provider first,
 * everything else to the global provider.
 */
public enum MarketRegion {
    BR,
    US,
    UNKNOWN
}
