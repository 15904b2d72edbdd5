package com.trading.flow.analysis;

import static com.trading.flow.analysis.AnalysisFields.*;

import com.trading.flow.dsl.GraphBuilder;
import com.trading.flow.engine.WorkflowGraph;
import com.trading.flow.io.NodeCatalog;
import com.trading.flow.io.WorkflowCompiler;
import com.trading.flow.io.WorkflowDefinitionParser;

import java.time.Clock;
import java.util.Map;

/**
 * Wiring of the stock analysis workflow:
 *
 * <pre>
 *                 +-- financial_analyst --+
 * data_collector -+-- news_analyst -------+-- report_generator -- END
 *                 +-- technical_analyst --+
 * </pre>
 *
 * The graph can be built in code ({@link #build}) or compiled from the
 * {@value #DEFINITION_RESOURCE} definition against {@link #catalog}.
 */
public final class StockAnalysisWorkflow {
    public static final String NAME = "stock_analysis";
    public static final String DEFINITION_RESOURCE = "workflows/stock_analysis.json";

    private StockAnalysisWorkflow() {
    }

    public static WorkflowGraph build(MarketDataProvider provider, ChatModel model) {
        return build(provider, model, Clock.systemUTC());
    }

    public static WorkflowGraph build(MarketDataProvider provider, ChatModel model, Clock clock) {
        String collector = AnalystRole.DATA_COLLECTOR.nodeName();
        String financial = AnalystRole.FINANCIAL_ANALYST.nodeName();
        String news = AnalystRole.NEWS_ANALYST.nodeName();
        String technical = AnalystRole.TECHNICAL_ANALYST.nodeName();

        return GraphBuilder.create(NAME)
                .register(new DataCollectorNode(provider))
                .register(new FinancialAnalystNode(model), collector)
                .register(new NewsAnalystNode(news, model, clock, NewsAnalystNode.DEFAULT_WINDOW_DAYS,
                        NewsAnalystNode.DEFAULT_MAX_ARTICLES), collector)
                .register(new TechnicalAnalystNode(model), collector)
                .register(new ReportGeneratorNode(model), financial, news, technical)
                .addEdgeToEnd(AnalystRole.REPORT_GENERATOR.nodeName())
                .setEntry(collector)
                .enforceFieldOwnership(true)
                .build();
    }

    /**
     * Node types for JSON definitions. Recognised properties:
     * {@code news_analyst.windowDays}, {@code news_analyst.maxArticles},
     * {@code report_generator.priceRecords}.
     */
    public static NodeCatalog catalog(MarketDataProvider provider, ChatModel model, Clock clock) {
        return new NodeCatalog()
                .register("data_collector", (name, p) -> new DataCollectorNode(name, provider))
                .register("financial_analyst", (name, p) -> new FinancialAnalystNode(name, model))
                .register("news_analyst", (name, p) -> new NewsAnalystNode(name, model, clock,
                        NodeCatalog.getInt(p, "windowDays", NewsAnalystNode.DEFAULT_WINDOW_DAYS),
                        NodeCatalog.getInt(p, "maxArticles", NewsAnalystNode.DEFAULT_MAX_ARTICLES)))
                .register("technical_analyst", (name, p) -> new TechnicalAnalystNode(name, model))
                .register("report_generator", (name, p) -> new ReportGeneratorNode(name, model,
                        NodeCatalog.getInt(p, "priceRecords", ReportGeneratorNode.DEFAULT_PRICE_RECORDS)));
    }

    /** Compiles the bundled JSON definition. */
    public static WorkflowCompiler.CompiledWorkflow fromDefinition(MarketDataProvider provider, ChatModel model,
            Clock clock) {
        return new WorkflowCompiler(catalog(provider, model, clock))
                .compile(WorkflowDefinitionParser.parseResource(DEFINITION_RESOURCE));
    }

    /** Fields a caller must seed. */
    public static Map<String, Object> seed(String symbol) {
        if (symbol == null || symbol.isBlank())
            throw new IllegalArgumentException("Stock symbol must not be blank");
        return Map.of(STOCK_SYMBOL.name(), symbol);
    }
}
