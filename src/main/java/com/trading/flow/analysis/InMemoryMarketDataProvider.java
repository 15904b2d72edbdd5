package com.trading.flow.analysis;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A {@link MarketDataProvider} serving preloaded data, for demos and tests.
 */
public final class InMemoryMarketDataProvider implements MarketDataProvider {
    private final Map<String, MarketData> data = new ConcurrentHashMap<>();

    public InMemoryMarketDataProvider put(String symbol, MarketData marketData) {
        data.put(symbol, marketData);
        return this;
    }

    @Override
    public MarketData fetch(String symbol) {
        MarketData d = data.get(symbol);
        if (d == null)
            throw new IllegalArgumentException("No market data for symbol " + symbol);
        return d;
    }
}
