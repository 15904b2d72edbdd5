package com.trading.flow.io;

import com.trading.flow.engine.WorkflowEngine;
import com.trading.flow.engine.WorkflowGraph;
import com.trading.flow.engine.WorkflowResult;
import com.trading.flow.error.CycleException;
import com.trading.flow.error.FieldOwnershipConflictException;
import com.trading.flow.node.FunctionNode;
import com.trading.flow.state.StateDelta;
import org.junit.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

public class WorkflowCompilerTest {

    private static int intOf(Object v) {
        return ((Number) v).intValue();
    }

    static NodeCatalog arithmetic() {
        return new NodeCatalog()
                .register("const", (name, p) -> FunctionNode.of(name,
                        s -> StateDelta.of(NodeCatalog.getString(p, "output", name), NodeCatalog.getInt(p, "value", 0))))
                .register("add", (name, p) -> FunctionNode.of(name,
                        s -> StateDelta.of(NodeCatalog.getString(p, "output", name),
                                intOf(s.get(NodeCatalog.getString(p, "input", "x"))) + NodeCatalog.getInt(p, "amount", 1))))
                .register("mul", (name, p) -> FunctionNode.of(name,
                        s -> StateDelta.of(NodeCatalog.getString(p, "output", name),
                                intOf(s.get(NodeCatalog.getString(p, "input", "x")))
                                        * NodeCatalog.getInt(p, "factor", 1))))
                .register("sum", (name, p) -> FunctionNode.of(name, s -> {
                    int total = 0;
                    for (String in : NodeCatalog.getString(p, "inputs", "").split(","))
                        total += intOf(s.get(in.trim()));
                    return StateDelta.of(NodeCatalog.getString(p, "output", name), total);
                }));
    }

    @Test
    public void testCompiledDiamondMatchesBuilderSemantics() {
        WorkflowDefinition def = WorkflowDefinitionParser.parseResource("workflows/diamond.json");
        WorkflowCompiler.CompiledWorkflow compiled = new WorkflowCompiler(arithmetic()).compile(def);

        WorkflowGraph g = compiled.graph();
        assertEquals("diamond", g.name());
        assertEquals("A", g.entry());
        assertEquals(Set.of("D"), g.terminalPredecessors());
        assertEquals(Set.of("B", "C"), g.predecessors("D"));
        assertEquals(Set.of("sum"), g.node("D").outputs());

        assertEquals(2, compiled.config().getMaxConcurrency());
        assertEquals(Duration.ofMillis(5000), compiled.config().getRunTimeout());

        try (WorkflowEngine engine = new WorkflowEngine(compiled.config())) {
            WorkflowResult result = engine.run(g, Map.of());
            assertEquals(Map.of("x", 1, "y", 2, "z", 2, "sum", 4), result.finalState().asMap());
        }
    }

    @Test
    public void testDependsOnCycleIsReportedByValidation() {
        WorkflowDefinition def = WorkflowDefinitionParser.parseResource("workflows/cyclic.json");
        WorkflowGraph g = new WorkflowCompiler(arithmetic()).compile(def).graph();
        try {
            g.topology();
            fail("Expected CycleException");
        } catch (CycleException e) {
            assertEquals(Set.of("B", "C"), Set.copyOf(e.involvedNodes()));
        }
    }

    @Test
    public void testOwnershipOptionIsApplied() {
        String json = "{\"workflow\": {\"name\": \"owned\", \"entry\": \"A\","
                + " \"options\": {\"enforceFieldOwnership\": true},"
                + " \"nodes\": ["
                + "  {\"name\": \"A\", \"type\": \"const\", \"produces\": [\"x\"]},"
                + "  {\"name\": \"B\", \"type\": \"const\", \"dependsOn\": [\"A\"], \"produces\": [\"x\"]}],"
                + " \"edges\": [{\"from\": \"B\", \"to\": \"END\"}]}}";
        WorkflowGraph g = new WorkflowCompiler(arithmetic()).compile(WorkflowDefinitionParser.parse(json)).graph();
        assertTrue(g.enforcesFieldOwnership());
        try {
            g.topology();
            fail("Expected FieldOwnershipConflictException");
        } catch (FieldOwnershipConflictException e) {
            assertEquals("x", e.field());
        }
    }

    @Test
    public void testDefaultsWithoutOptions() {
        String json = "{\"workflow\": {\"name\": \"tiny\", \"entry\": \"A\","
                + " \"nodes\": [{\"name\": \"A\", \"type\": \"CONST\"}],"
                + " \"edges\": [{\"from\": \"A\", \"to\": \"END\"}]}}";
        WorkflowCompiler.CompiledWorkflow compiled = new WorkflowCompiler(arithmetic())
                .compile(WorkflowDefinitionParser.parse(json));
        assertEquals(0, compiled.config().getMaxConcurrency());
        assertFalse(compiled.config().hasTimeout());
        assertFalse(compiled.graph().enforcesFieldOwnership());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownNodeType() {
        String json = "{\"workflow\": {\"name\": \"bad\", \"entry\": \"A\","
                + " \"nodes\": [{\"name\": \"A\", \"type\": \"teleport\"}]}}";
        new WorkflowCompiler(arithmetic()).compile(WorkflowDefinitionParser.parse(json));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUndefinedDependency() {
        String json = "{\"workflow\": {\"name\": \"bad\", \"entry\": \"A\","
                + " \"nodes\": [{\"name\": \"A\", \"type\": \"const\", \"dependsOn\": [\"ghost\"]}]}}";
        new WorkflowCompiler(arithmetic()).compile(WorkflowDefinitionParser.parse(json));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingWorkflowKey() {
        WorkflowDefinitionParser.parse("{\"graph\": {}}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedJson() {
        WorkflowDefinitionParser.parse("{\"workflow\": ");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingResource() {
        WorkflowDefinitionParser.parseResource("workflows/does_not_exist.json");
    }
}
