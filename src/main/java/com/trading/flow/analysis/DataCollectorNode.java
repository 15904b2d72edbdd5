package com.trading.flow.analysis;

import static com.trading.flow.analysis.AnalysisFields.*;

import com.trading.flow.api.Node;
import com.trading.flow.state.StateDelta;
import com.trading.flow.state.StateSnapshot;

import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Entry node: fetches prices, financial statements and news for
 * {@code stock_symbol}.
 */
@Log4j2
public final class DataCollectorNode implements Node {
    private final String name;
    private final MarketDataProvider provider;

    public DataCollectorNode(MarketDataProvider provider) {
        this(AnalystRole.DATA_COLLECTOR.nodeName(), provider);
    }

    public DataCollectorNode(String name, MarketDataProvider provider) {
        this.name = name;
        this.provider = provider;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Set<String> outputs() {
        return Set.of(HISTORICAL_DATA.name(), FINANCIALS.name(), NEWS.name());
    }

    @Override
    public StateDelta execute(StateSnapshot snapshot) throws Exception {
        String symbol = snapshot.get(STOCK_SYMBOL);
        log.info("Collecting data for {}", symbol);
        MarketData data = provider.fetch(symbol);
        return StateDelta.builder()
                .put(HISTORICAL_DATA, data.history() != null ? data.history() : PriceHistory.empty())
                .put(FINANCIALS, data.financials() != null ? data.financials() : Financials.empty())
                .put(NEWS, data.news() != null ? data.news() : NewsFeed.empty())
                .build();
    }
}
