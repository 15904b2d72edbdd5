package com.trading.flow.analysis;

import com.trading.flow.config.EngineConfig;
import com.trading.flow.engine.WorkflowEngine;
import com.trading.flow.engine.WorkflowGraph;
import com.trading.flow.engine.WorkflowResult;
import com.trading.flow.error.WorkflowException;
import com.trading.flow.io.JsonStateSerializer;
import com.trading.flow.io.WorkflowCompiler;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

public class StockAnalysisWorkflowTest {

    private static final Instant NOW = Instant.parse("2025-03-20T12:00:00Z");
    private static final LocalDate FIRST_DAY = LocalDate.of(2024, 11, 1);

    private InMemoryMarketDataProvider provider;
    private CannedChatModel model;
    private Clock clock;

    @Before
    public void setUp() {
        List<PricePoint> points = new ArrayList<>();
        for (int i = 0; i < 120; i++)
            points.add(new PricePoint(FIRST_DAY.plusDays(i), 100.0 + i));
        MarketData data = new MarketData(
                new PriceHistory(points),
                new Financials(Map.of("Net Income", Map.of("2024-09-30", 9.37e10))),
                new NewsFeed(List.of(new NewsItem("Record quarter", "2025-03-18T09:00:00Z", "Beats estimates"))));
        provider = new InMemoryMarketDataProvider().put("AAPL", data);
        model = new CannedChatModel();
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    @Test
    public void testGraphShape() {
        WorkflowGraph g = StockAnalysisWorkflow.build(provider, model, clock);

        assertEquals("data_collector", g.entry());
        assertEquals(Set.of("financial_analyst", "news_analyst", "technical_analyst"), g.successors("data_collector"));
        assertEquals(Set.of("financial_analyst", "news_analyst", "technical_analyst"),
                g.predecessors("report_generator"));
        assertEquals(Set.of("report_generator"), g.terminalPredecessors());
        assertTrue(g.enforcesFieldOwnership());
        assertEquals(5, g.topology().nodeCount());
    }

    @Test
    public void testAnalyzeProducesReport() {
        String report;
        try (StockAnalyzer analyzer = new StockAnalyzer(StockAnalysisWorkflow.build(provider, model, clock),
                EngineConfig.defaults())) {
            report = analyzer.analyze("AAPL");
        }

        assertEquals(4, model.exchanges().size());
        assertTrue(report.startsWith("[" + AnalystRole.REPORT_GENERATOR.systemPrompt() + "]"));

        String reportPrompt = model.promptFor(AnalystRole.REPORT_GENERATOR);
        assertTrue(reportPrompt.startsWith("Stock: AAPL"));
        assertTrue(reportPrompt.contains("Financial Analysis Summary:\n[" + AnalystRole.FINANCIAL_ANALYST.systemPrompt()));
        assertTrue(reportPrompt.contains("News Analysis Summary:\n[" + AnalystRole.NEWS_ANALYST.systemPrompt()));
        // Last 90 of 120 records: index 30 onwards
        assertTrue(reportPrompt.contains("(" + FIRST_DAY.plusDays(30) + ", 130.0)"));
        assertFalse(reportPrompt.contains("(" + FIRST_DAY.plusDays(29) + ", 129.0)"));

        String technicalPrompt = model.promptFor(AnalystRole.TECHNICAL_ANALYST);
        assertTrue(technicalPrompt.contains("{date: " + FIRST_DAY + ", close: 100.0}"));

        String financialPrompt = model.promptFor(AnalystRole.FINANCIAL_ANALYST);
        assertTrue(financialPrompt.contains("Net Income"));

        assertTrue(model.promptFor(AnalystRole.NEWS_ANALYST).contains("Record quarter"));
    }

    @Test
    public void testResultHoldsEveryField() {
        try (StockAnalyzer analyzer = new StockAnalyzer(provider, model)) {
            WorkflowResult result = analyzer.run("AAPL");
            assertEquals(Set.of("stock_symbol", "historical_data", "financials", "news", "financial_analysis",
                    "news_analysis", "technical_analysis", "report"), result.finalState().fieldNames());
            assertEquals(120, result.get(AnalysisFields.HISTORICAL_DATA).size());

            String json = new JsonStateSerializer().toJson(result);
            assertTrue(json.contains("\"stock_symbol\" : \"AAPL\""));
            assertTrue(json.contains("\"report_generator\" : \"COMPLETED\""));
        }
    }

    @Test
    public void testJsonDefinitionBehavesLikeBuilder() {
        WorkflowCompiler.CompiledWorkflow compiled = StockAnalysisWorkflow.fromDefinition(provider, model, clock);
        WorkflowGraph g = compiled.graph();

        assertEquals(StockAnalysisWorkflow.NAME, g.name());
        assertEquals("data_collector", g.entry());
        assertEquals(Set.of("report_generator"), g.terminalPredecessors());
        assertEquals(Set.of("financial_analyst", "news_analyst", "technical_analyst"),
                g.predecessors("report_generator"));
        assertTrue(g.enforcesFieldOwnership());
        assertEquals(3, compiled.config().getMaxConcurrency());

        try (WorkflowEngine engine = new WorkflowEngine(compiled.config())) {
            WorkflowResult result = engine.run(g, StockAnalysisWorkflow.seed("AAPL"), AnalysisFields.schema());
            assertTrue(result.get(AnalysisFields.REPORT).startsWith("[" + AnalystRole.REPORT_GENERATOR.systemPrompt()));
        }
    }

    @Test
    public void testUnknownSymbolFailsAtCollector() {
        try (StockAnalyzer analyzer = new StockAnalyzer(provider, model)) {
            analyzer.analyze("NOPE");
            fail("Expected WorkflowException");
        } catch (WorkflowException e) {
            assertEquals("data_collector", e.failedNode());
            assertTrue(e.getCause() instanceof IllegalArgumentException);
            assertEquals(Map.of("stock_symbol", "NOPE"), e.partialState().asMap());
        }
        assertTrue(model.exchanges().isEmpty());
    }

    @Test
    public void testModelOutageFailsRunWithoutReport() {
        ChatModel flaky = (system, user) -> {
            if (system.equals(AnalystRole.FINANCIAL_ANALYST.systemPrompt()))
                throw new IOException("model unavailable");
            return "ok";
        };
        try (StockAnalyzer analyzer = new StockAnalyzer(provider, flaky)) {
            analyzer.analyze("AAPL");
            fail("Expected WorkflowException");
        } catch (WorkflowException e) {
            assertEquals("financial_analyst", e.failedNode());
            assertTrue(e.getCause() instanceof IOException);
            assertTrue(e.partialState().contains("historical_data"));
            assertFalse(e.partialState().contains("report"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBlankSymbolRejected() {
        StockAnalysisWorkflow.seed(" ");
    }
}
