package com.pennywise.marketdata.model;

import com.pennywise.common.model.CacheStats;

public record HealthStatus(
    boolean primaryHealthy,
    boolean fallbackHealthy,
    String primarySource,
    String fallbackSource,
    CacheStats cacheStats
) {

    public boolean anyHealthy() {
        return primaryHealthy || fallbackHealthy;
    }
}
