package com.pennywise.marketdata.router;

import com.pennywise.marketdata.provider.MarketDataProvider;

/**
 * One step of a routing plan: which provider to ask and under which ticker.
 */
public record ProviderRoute(MarketDataProvider provider, String providerSymbol) {

    public String source() {
        return provider.id();
    }
}
