package com.trading.flow.analysis;

import java.io.IOException;

/**
 * Source of prices, financial statements and news for a symbol.
 */
public interface MarketDataProvider {

    /**
     * @throws IOException if the source cannot be reached.
     * @throws IllegalArgumentException if the symbol is unknown.
     */
    MarketData fetch(String symbol) throws IOException;
}
