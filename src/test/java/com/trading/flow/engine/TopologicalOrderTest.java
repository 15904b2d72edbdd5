package com.trading.flow.engine;

import com.trading.flow.api.Node;
import com.trading.flow.error.CycleException;
import com.trading.flow.node.FunctionNode;
import com.trading.flow.state.StateDelta;
import org.junit.Test;

import java.util.Set;

import static org.junit.Assert.*;

public class TopologicalOrderTest {

    // Helper to create a node that writes nothing
    private Node createNode(String name) {
        return FunctionNode.of(name, s -> StateDelta.empty());
    }

    @Test
    public void testEmptyGraph() {
        TopologicalOrder order = TopologicalOrder.builder().build();
        assertEquals(0, order.nodeCount());
    }

    @Test
    public void testSingleNode() {
        TopologicalOrder order = TopologicalOrder.builder()
                .addNode(createNode("A"))
                .build();

        assertEquals(1, order.nodeCount());
        assertEquals("A", order.node(0).name());
        assertEquals(0, order.topoIndex("A"));
        assertEquals(0, order.childCount(0));
        assertEquals(0, order.parentCount(0));
        assertTrue(order.ancestors(0).isEmpty());
    }

    @Test
    public void testLinearGraph() {
        // A -> B -> C
        TopologicalOrder order = TopologicalOrder.builder()
                .addNode(createNode("C")).addNode(createNode("B")).addNode(createNode("A"))
                .addEdge("A", "B")
                .addEdge("B", "C")
                .build();

        assertEquals(3, order.nodeCount());

        // Registration order does not matter, edges do
        assertEquals("A", order.node(0).name());
        assertEquals("B", order.node(1).name());
        assertEquals("C", order.node(2).name());

        // Check CSR Edge structures
        assertEquals(1, order.childCount(0));
        assertEquals(1, order.childCount(1));
        assertEquals(0, order.childCount(2));
        assertEquals(1, order.child(0, 0));
        assertEquals(2, order.child(1, 0));

        assertEquals(0, order.parentCount(0));
        assertEquals(1, order.parentCount(1));
        assertEquals(1, order.parentCount(2));

        assertEquals(Set.of("A", "B"), order.ancestors(2));
    }

    @Test
    public void testDiamondGraph() {
        // A
        // / \
        // B C
        // \ /
        // D
        TopologicalOrder order = TopologicalOrder.builder()
                .addNode(createNode("A")).addNode(createNode("B")).addNode(createNode("C")).addNode(createNode("D"))
                .addEdge("A", "B")
                .addEdge("A", "C")
                .addEdge("B", "D")
                .addEdge("C", "D")
                .build();

        assertEquals(4, order.nodeCount());
        assertEquals(0, order.topoIndex("A"));

        int idxB = order.topoIndex("B");
        int idxC = order.topoIndex("C");
        int idxD = order.topoIndex("D");

        // D must be strictly after B and C
        assertTrue(idxD > idxB);
        assertTrue(idxD > idxC);

        assertEquals(2, order.childCount(0));
        assertEquals(1, order.childCount(idxB));
        assertEquals(idxD, order.child(idxB, 0));
        assertEquals(idxD, order.childAt(order.childrenStart(idxC)));

        assertEquals(2, order.parentCount(idxD));

        // Siblings are not each other's ancestors
        assertEquals(Set.of("A"), order.ancestors(idxB));
        assertEquals(Set.of("A"), order.ancestors(idxC));
        assertEquals(Set.of("A", "B", "C"), order.ancestors(idxD));
    }

    @Test
    public void testCycleDetection() {
        // A -> B -> C -> B, plus D hanging off the cycle
        try {
            TopologicalOrder.builder()
                    .addNode(createNode("A")).addNode(createNode("B")).addNode(createNode("C"))
                    .addNode(createNode("D"))
                    .addEdge("A", "B")
                    .addEdge("B", "C")
                    .addEdge("C", "B")
                    .addEdge("C", "D")
                    .build();
            fail("Expected CycleException");
        } catch (CycleException e) {
            assertEquals(Set.of("B", "C"), Set.copyOf(e.involvedNodes()));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testSelfLoopDetection() {
        TopologicalOrder.builder()
                .addNode(createNode("A"))
                .addEdge("A", "A")
                .build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateNodeException() {
        TopologicalOrder.builder()
                .addNode(createNode("A"))
                .addNode(createNode("A"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownEdgeSourceException() {
        TopologicalOrder.builder()
                .addNode(createNode("B"))
                .addEdge("A", "B");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownEdgeTargetException() {
        TopologicalOrder.builder()
                .addNode(createNode("A"))
                .addEdge("A", "B");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidTopoIndexLookup() {
        TopologicalOrder order = TopologicalOrder.builder().addNode(createNode("A")).build();
        order.topoIndex("UNKNOWN");
    }
}
