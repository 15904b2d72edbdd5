package com.trading.flow.analysis;

import static com.trading.flow.analysis.AnalysisFields.*;

import com.trading.flow.state.StateSnapshot;

import lombok.extern.log4j.Log4j2;

/**
 * Fan-in node: combines the three analyses and the recent price history into
 * the final investment report.
 */
@Log4j2
public final class ReportGeneratorNode extends ChatAnalystNode {
    public static final int DEFAULT_PRICE_RECORDS = 90;

    private final int priceRecords;

    public ReportGeneratorNode(ChatModel model) {
        this(AnalystRole.REPORT_GENERATOR.nodeName(), model, DEFAULT_PRICE_RECORDS);
    }

    public ReportGeneratorNode(String name, ChatModel model, int priceRecords) {
        super(name, AnalystRole.REPORT_GENERATOR, model, REPORT);
        if (priceRecords <= 0)
            throw new IllegalArgumentException("priceRecords must be positive, got " + priceRecords);
        this.priceRecords = priceRecords;
    }

    @Override
    protected String prompt(StateSnapshot snapshot) {
        String symbol = snapshot.get(STOCK_SYMBOL);
        PriceHistory history = snapshot.getOrDefault(HISTORICAL_DATA, PriceHistory.empty());
        log.info("Generating report for {}", symbol);
        String prompt = "Stock: " + symbol + "\n\n"
                + "Financial Analysis Summary:\n" + snapshot.get(FINANCIAL_ANALYSIS) + "\n\n"
                + "News Analysis Summary:\n" + snapshot.get(NEWS_ANALYSIS) + "\n\n"
                + "Technical Analysis Summary:\n" + snapshot.get(TECHNICAL_ANALYSIS) + "\n\n"
                + "Historical Price Data Snapshot (Last " + priceRecords + " records):\n"
                + history.last(priceRecords) + "\n\n"
                + "Based on the above information, generate a comprehensive investment report that includes:\n"
                + "1. An overview of the company's financial health and performance trends.\n"
                + "2. Key takeaways from recent news and market sentiment.\n"
                + "3. A technical analysis of price trends, highlighting any support/resistance levels or patterns.\n"
                + "4. A thorough risk assessment addressing both market-wide and company-specific risks.\n"
                + "5. A clear investment recommendation supported by your analysis.\n\n"
                + "Ensure the report is structured, concise, and provides actionable insights.\n";
        log.debug("Report prompt:\n{}", prompt);
        return prompt;
    }
}
