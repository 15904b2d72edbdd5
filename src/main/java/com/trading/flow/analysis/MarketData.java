package com.trading.flow.analysis;

/** Everything the data collector fetches for one symbol. */
public record MarketData(PriceHistory history, Financials financials, NewsFeed news) {
}
