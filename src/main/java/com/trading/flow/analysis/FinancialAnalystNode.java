package com.trading.flow.analysis;

import static com.trading.flow.analysis.AnalysisFields.*;

import com.trading.flow.state.StateSnapshot;

import lombok.extern.log4j.Log4j2;

/** Fundamental analysis of the collected financial statements. */
@Log4j2
public final class FinancialAnalystNode extends ChatAnalystNode {

    public FinancialAnalystNode(ChatModel model) {
        this(AnalystRole.FINANCIAL_ANALYST.nodeName(), model);
    }

    public FinancialAnalystNode(String name, ChatModel model) {
        super(name, AnalystRole.FINANCIAL_ANALYST, model, FINANCIAL_ANALYSIS);
    }

    @Override
    protected String prompt(StateSnapshot snapshot) {
        String symbol = snapshot.get(STOCK_SYMBOL);
        log.info("Analyzing financials of {}", symbol);
        return "Please provide a detailed analysis of the following financial data for " + symbol + ". "
                + "Include an evaluation of profitability, liquidity, and solvency, and highlight any significant "
                + "trends or red flags. Data: " + snapshot.get(FINANCIALS);
    }
}
