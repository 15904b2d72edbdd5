package com.trading.flow.util;

import com.trading.flow.dsl.GraphBuilder;
import com.trading.flow.engine.WorkflowEngine;
import com.trading.flow.engine.WorkflowGraph;
import com.trading.flow.engine.WorkflowResult;
import com.trading.flow.node.FunctionNode;
import com.trading.flow.state.StateDelta;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class GraphExplainTest {

    private static WorkflowGraph graph() {
        return GraphBuilder.create("explained")
                .register(FunctionNode.of("load-data", s -> StateDelta.of("x", 1)).produces("x"))
                .register("score", s -> StateDelta.of("y", 2), "load-data")
                .addEdgeToEnd("score")
                .setEntry("load-data")
                .build();
    }

    @Test
    public void testMermaidIncludesEndAndSanitizesNames() {
        String mermaid = new GraphExplain(graph()).toMermaid();

        assertTrue(mermaid.startsWith("graph TD;\n"));
        assertTrue(mermaid.contains("  load_data[\"load-data\"];\n"));
        assertTrue(mermaid.contains("  __end__([\"END\"]);\n"));
        assertTrue(mermaid.contains("  load_data --> score;\n"));
        assertTrue(mermaid.contains("  score --> __end__;\n"));
    }

    @Test
    public void testExplainNode() {
        String text = new GraphExplain(graph()).explainNode("load-data");

        assertTrue(text.contains("Node: load-data"));
        assertTrue(text.contains("Topo index: 0"));
        assertTrue(text.contains("Is entry: true"));
        assertTrue(text.contains("Produces: [x]"));
        assertTrue(text.contains("Successors: score"));
    }

    @Test
    public void testDumpTopology() {
        String text = new GraphExplain(graph()).dumpTopology();
        assertTrue(text.contains("[0] load-data (ENTRY) -> score"));
        assertTrue(text.contains("[1] score -> __end__"));
    }

    @Test
    public void testExplainRun() {
        try (WorkflowEngine engine = new WorkflowEngine()) {
            WorkflowResult result = engine.run(graph(), Map.of());
            String text = GraphExplain.explainRun(result);
            assertTrue(text.contains("of explained: 2 nodes"));
            assertTrue(text.contains("score: COMPLETED"));
        }
    }
}
