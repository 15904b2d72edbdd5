package com.trading.flow.analysis;

import com.trading.flow.config.EngineConfig;
import com.trading.flow.engine.WorkflowEngine;
import com.trading.flow.engine.WorkflowGraph;
import com.trading.flow.engine.WorkflowResult;
import com.trading.flow.util.LoggingWorkflowListener;

import lombok.extern.log4j.Log4j2;

/**
 * Runs the stock analysis workflow for one symbol at a time.
 *
 * Usage:
 *
 * <pre>
 * try (var analyzer = new StockAnalyzer(provider, model)) {
 *     String report = analyzer.analyze("AAPL");
 * }
 * </pre>
 */
@Log4j2
public final class StockAnalyzer implements AutoCloseable {
    private final WorkflowGraph graph;
    private final WorkflowEngine engine;

    public StockAnalyzer(MarketDataProvider provider, ChatModel model) {
        this(StockAnalysisWorkflow.build(provider, model), EngineConfig.defaults());
    }

    public StockAnalyzer(WorkflowGraph graph, EngineConfig config) {
        this.graph = graph;
        this.engine = new WorkflowEngine(config);
        this.engine.setListener(new LoggingWorkflowListener());
    }

    /**
     * @return the generated investment report.
     * @throws com.trading.flow.error.WorkflowException if any analysis step failed.
     */
    public String analyze(String symbol) {
        return run(symbol).get(AnalysisFields.REPORT);
    }

    /** Full result of one analysis, all intermediate fields included. */
    public WorkflowResult run(String symbol) {
        WorkflowResult result = engine.run(graph, StockAnalysisWorkflow.seed(symbol), AnalysisFields.schema());
        log.info("Analysis of {} finished in {} ms", symbol, String.format("%.1f", result.elapsedMillis()));
        return result;
    }

    public WorkflowGraph graph() {
        return graph;
    }

    @Override
    public void close() {
        engine.close();
    }
}
