package com.trading.flow.analysis;

import com.trading.flow.state.StateKey;
import com.trading.flow.state.StateSchema;

/**
 * State fields of the stock analysis workflow.
 */
public final class AnalysisFields {
    public static final StateKey<String> STOCK_SYMBOL = StateKey.of("stock_symbol", String.class);
    public static final StateKey<PriceHistory> HISTORICAL_DATA = StateKey.of("historical_data", PriceHistory.class);
    public static final StateKey<Financials> FINANCIALS = StateKey.of("financials", Financials.class);
    public static final StateKey<NewsFeed> NEWS = StateKey.of("news", NewsFeed.class);
    public static final StateKey<String> FINANCIAL_ANALYSIS = StateKey.of("financial_analysis", String.class);
    public static final StateKey<String> NEWS_ANALYSIS = StateKey.of("news_analysis", String.class);
    public static final StateKey<String> TECHNICAL_ANALYSIS = StateKey.of("technical_analysis", String.class);
    public static final StateKey<String> REPORT = StateKey.of("report", String.class);

    private static final StateSchema SCHEMA = StateSchema.strict(STOCK_SYMBOL, HISTORICAL_DATA, FINANCIALS, NEWS,
            FINANCIAL_ANALYSIS, NEWS_ANALYSIS, TECHNICAL_ANALYSIS, REPORT);

    private AnalysisFields() {
    }

    /** Strict schema over every field above. */
    public static StateSchema schema() {
        return SCHEMA;
    }
}
