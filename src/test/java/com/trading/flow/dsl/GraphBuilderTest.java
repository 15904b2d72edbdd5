package com.trading.flow.dsl;

import com.trading.flow.engine.WorkflowGraph;
import com.trading.flow.error.DuplicateNodeException;
import com.trading.flow.error.UnknownNodeException;
import com.trading.flow.node.FunctionNode;
import com.trading.flow.state.StateDelta;
import com.trading.flow.state.StateSnapshot;
import com.trading.flow.api.NodeFunction;
import org.junit.Test;

import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class GraphBuilderTest {

    private static final NodeFunction NOOP = s -> StateDelta.empty();

    @Test
    public void testRegisterRecordsDependencies() {
        WorkflowGraph g = GraphBuilder.create("g")
                .register("A", NOOP)
                .register("B", NOOP, "A")
                .register("C", NOOP, Set.of("A", "B"))
                .addEdgeToEnd("C")
                .setEntry("A")
                .build();

        assertEquals("g", g.name());
        assertEquals("A", g.entry());
        assertEquals(List.of("A", "B", "C"), List.copyOf(g.nodeNames()));
        assertEquals(Set.of("B", "C"), g.successors("A"));
        assertEquals(Set.of("A", "B"), g.predecessors("C"));
        assertEquals(Set.of("C"), g.terminalPredecessors());
        assertTrue(g.edges().contains(new WorkflowGraph.Edge("C", WorkflowGraph.END)));
    }

    @Test
    public void testDuplicateRegistrationRejectedAndRegistryUnchanged() throws Exception {
        GraphBuilder b = GraphBuilder.create("g").register("A", NOOP);
        try {
            b.register("A", s -> StateDelta.of("x", 1));
            fail("Expected DuplicateNodeException");
        } catch (DuplicateNodeException e) {
            assertEquals("A", e.nodeName());
        }
        WorkflowGraph g = b.addEdgeToEnd("A").setEntry("A").build();
        assertEquals(1, g.nodeCount());
        // The first registration survives
        assertTrue(g.node("A").execute(StateSnapshot.empty()).isEmpty());
    }

    @Test(expected = UnknownNodeException.class)
    public void testDependencyMustBeRegistered() {
        GraphBuilder.create("g").register("B", NOOP, "A");
    }

    @Test(expected = UnknownNodeException.class)
    public void testEdgeToUnknownNode() {
        GraphBuilder.create("g").register("A", NOOP).addEdge("A", "B");
    }

    @Test(expected = UnknownNodeException.class)
    public void testEntryMustBeRegistered() {
        GraphBuilder.create("g").setEntry("A");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEndNameIsReserved() {
        GraphBuilder.create("g").register(GraphBuilder.END, NOOP);
    }

    @Test
    public void testRepeatedEdgeCollapses() {
        WorkflowGraph g = GraphBuilder.create("g")
                .register("A", NOOP)
                .register("B", NOOP, "A")
                .addEdge("A", "B")
                .addEdge("B", GraphBuilder.END)
                .addEdgeToEnd("B")
                .setEntry("A")
                .build();
        assertEquals(2, g.edges().size());
        assertEquals(1, g.topology().parentCount(g.topology().topoIndex("B")));
    }

    @Test(expected = IllegalStateException.class)
    public void testBuilderUnusableAfterBuild() {
        GraphBuilder b = GraphBuilder.create("g").register("A", NOOP);
        b.build();
        b.register("B", NOOP);
    }

    @Test
    public void testProducesIsKept() {
        WorkflowGraph g = GraphBuilder.create("g")
                .register(FunctionNode.of("A", NOOP).produces("x", "y"))
                .addEdgeToEnd("A")
                .setEntry("A")
                .build();
        assertEquals(Set.of("x", "y"), g.node("A").outputs());
    }
}
