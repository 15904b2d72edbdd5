package com.trading.flow.analysis;

import static com.trading.flow.analysis.AnalysisFields.*;

import com.trading.flow.state.StateSnapshot;

import java.util.List;
import java.util.stream.Collectors;

import lombok.extern.log4j.Log4j2;

/**
 * Chart-pattern analysis of the full price history.
 */
@Log4j2
public final class TechnicalAnalystNode extends ChatAnalystNode {

    public TechnicalAnalystNode(ChatModel model) {
        this(AnalystRole.TECHNICAL_ANALYST.nodeName(), model);
    }

    public TechnicalAnalystNode(String name, ChatModel model) {
        super(name, AnalystRole.TECHNICAL_ANALYST, model, TECHNICAL_ANALYSIS);
    }

    @Override
    protected String prompt(StateSnapshot snapshot) {
        PriceHistory history = snapshot.getOrDefault(HISTORICAL_DATA, PriceHistory.empty());
        log.info("Performing technical analysis on {} price records", history.size());
        return "Based on the following historical price data (date and closing price) for the stock, "
                + "please perform a detailed technical analysis. Consider the following points:\n"
                + "1. Identify short-term trends and patterns.\n"
                + "2. Evaluate moving averages (e.g., 10-day, 30-day, 50-day, 100-day, 200-day) and their crossovers.\n"
                + "3. Highlight potential support and resistance levels.\n"
                + "4. Comment on any other technical indicators (e.g., RSI, MACD) if relevant.\n\n"
                + "Data sample: " + sample(history.points());
    }

    static String sample(List<PricePoint> points) {
        return points.stream()
                .map(p -> "{date: " + p.date() + ", close: " + p.close() + "}")
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
