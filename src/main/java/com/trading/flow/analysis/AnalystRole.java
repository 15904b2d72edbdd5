package com.trading.flow.analysis;

/** System prompts of the analysis nodes, keyed by node name. */
public enum AnalystRole {
    DATA_COLLECTOR("data_collector", "Expert in collecting financial data and historical prices"),
    FINANCIAL_ANALYST("financial_analyst", "CFA-certified financial analyst expert in fundamental analysis"),
    NEWS_ANALYST("news_analyst", "Financial news analyst expert in market sentiment and NLP"),
    TECHNICAL_ANALYST("technical_analyst",
            "You are an expert technical analyst specialized in chart patterns, moving averages, and technical indicators."),
    REPORT_GENERATOR("report_generator", "Senior investment analyst and report writer");

    private final String nodeName;
    private final String systemPrompt;

    AnalystRole(String nodeName, String systemPrompt) {
        this.nodeName = nodeName;
        this.systemPrompt = systemPrompt;
    }

    public String nodeName() {
        return nodeName;
    }

    public String systemPrompt() {
        return systemPrompt;
    }
}
