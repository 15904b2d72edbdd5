package com.trading.flow.analysis;

import java.util.List;

/** News articles about one symbol, in provider order. */
public record NewsFeed(List<NewsItem> items) {

    public NewsFeed {
        items = List.copyOf(items);
    }

    public static NewsFeed empty() {
        return new NewsFeed(List.of());
    }

    public int size() {
        return items.size();
    }
}
