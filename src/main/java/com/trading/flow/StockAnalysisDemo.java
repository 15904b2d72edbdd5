package com.trading.flow;

import com.trading.flow.analysis.AnalysisFields;
import com.trading.flow.analysis.CannedChatModel;
import com.trading.flow.analysis.Financials;
import com.trading.flow.analysis.InMemoryMarketDataProvider;
import com.trading.flow.analysis.MarketData;
import com.trading.flow.analysis.NewsFeed;
import com.trading.flow.analysis.NewsItem;
import com.trading.flow.analysis.PriceHistory;
import com.trading.flow.analysis.PricePoint;
import com.trading.flow.analysis.StockAnalysisWorkflow;
import com.trading.flow.engine.WorkflowEngine;
import com.trading.flow.engine.WorkflowResult;
import com.trading.flow.io.JsonStateSerializer;
import com.trading.flow.io.WorkflowCompiler;
import com.trading.flow.util.CompositeWorkflowListener;
import com.trading.flow.util.GraphExplain;
import com.trading.flow.util.LatencyTrackingListener;
import com.trading.flow.util.LoggingWorkflowListener;
import com.trading.flow.util.NodeProfileListener;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import lombok.extern.log4j.Log4j2;

/**
 * Runs the stock analysis workflow from its JSON definition against
 * synthetic market data and a canned chat model.
 */
@Log4j2
public class StockAnalysisDemo {

    public static void main(String[] args) {
        String symbol = args.length > 0 ? args[0] : "AAPL";
        log.info("Starting Stock Analysis Demo for {}...", symbol);

        // 1. Synthetic inputs
        Clock clock = Clock.systemUTC();
        var provider = new InMemoryMarketDataProvider().put(symbol, syntheticData(clock));
        var model = new CannedChatModel();

        // 2. Compile the workflow
        WorkflowCompiler.CompiledWorkflow compiled = StockAnalysisWorkflow.fromDefinition(provider, model, clock);
        log.info("Topology:\n{}", new GraphExplain(compiled.graph()).dumpTopology());

        // 3. Run with listeners attached
        var latency = new LatencyTrackingListener();
        var profile = new NodeProfileListener();
        try (WorkflowEngine engine = new WorkflowEngine(compiled.config())) {
            engine.setListener(new CompositeWorkflowListener(new LoggingWorkflowListener(), latency, profile));
            WorkflowResult result = engine.run(compiled.graph(), StockAnalysisWorkflow.seed(symbol),
                    AnalysisFields.schema());

            log.info("\n{}", GraphExplain.explainRun(result));
            log.info("Node profile:\n{}", profile.dump());
            log.info("Run latency:\n{}", latency.dump());
            log.debug("Final state:\n{}", new JsonStateSerializer().toJson(result.finalState()));
            log.info("FINAL INVESTMENT REPORT:\n{}", result.get(AnalysisFields.REPORT));
        }
    }

    private static MarketData syntheticData(Clock clock) {
        Random rnd = new Random(42);
        LocalDate today = LocalDate.now(clock);
        List<PricePoint> points = new ArrayList<>();
        double px = 180.0;
        for (int i = 250; i > 0; i--) {
            px *= 1 + rnd.nextGaussian() * 0.01;
            points.add(new PricePoint(today.minusDays(i), Math.round(px * 100) / 100.0));
        }
        Financials financials = new Financials(Map.of(
                "Total Revenue", Map.of("2024-09-30", 3.91e11, "2023-09-30", 3.83e11),
                "Net Income", Map.of("2024-09-30", 9.37e10, "2023-09-30", 9.70e10)));
        List<NewsItem> news = new ArrayList<>();
        for (int d = 0; d < 30; d += 3) {
            String ts = today.minusDays(d).atTime(14, 30).atOffset(ZoneOffset.UTC).toString();
            news.add(new NewsItem("Headline " + d + " days ago", ts, "Summary of story " + d));
        }
        news.add(new NewsItem("Undated wire story", "yesterday", ""));
        return new MarketData(new PriceHistory(points), financials, new NewsFeed(news));
    }
}
