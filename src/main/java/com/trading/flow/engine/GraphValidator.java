package com.trading.flow.engine;

import com.trading.flow.api.Node;
import com.trading.flow.error.CycleException;
import com.trading.flow.error.FieldOwnershipConflictException;
import com.trading.flow.error.InvalidEntryException;
import com.trading.flow.error.UnreachableNodeException;
import com.trading.flow.error.UnreachableTerminalException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import lombok.extern.log4j.Log4j2;

/**
 * Structural checks run once per graph before its first execution.
 *
 * Checks, in order:
 * <ol>
 * <li>the entry node is set and registered;</li>
 * <li>the graph is acyclic (Kahn's algorithm, see {@link TopologicalOrder});</li>
 * <li>the entry node has no dependencies;</li>
 * <li>every node has a path to END (reverse reachability from END);</li>
 * <li>every node is reachable from the entry;</li>
 * <li>if the graph enforces field ownership, declared outputs are pairwise
 * disjoint.</li>
 * </ol>
 *
 * Validation is a pure read of the graph: running it twice on the same graph
 * gives the same result.
 */
@Log4j2
public final class GraphValidator {

    private GraphValidator() {
    }

    /**
     * @return the compiled topology of a valid graph.
     * @throws com.trading.flow.error.GraphValidationException on the first failed check.
     */
    public static TopologicalOrder validate(WorkflowGraph graph) {
        checkEntry(graph);
        TopologicalOrder topology = compile(graph);
        checkEntryIsRoot(graph);
        checkTerminalReachable(graph);
        checkReachableFromEntry(graph);
        if (graph.enforcesFieldOwnership())
            checkFieldOwnership(graph);
        log.debug("Graph '{}' validated: {} nodes, order {}", graph.name(), topology.nodeCount(), topology.names());
        return topology;
    }

    private static void checkEntry(WorkflowGraph graph) {
        String entry = graph.entry();
        if (entry == null)
            throw new InvalidEntryException("Graph '" + graph.name() + "' has no entry node");
        if (!graph.contains(entry))
            throw new InvalidEntryException("Entry node '" + entry + "' is not registered");
    }

    /** Runs after cycle detection, so an edge back into the entry is reported as a cycle. */
    private static void checkEntryIsRoot(WorkflowGraph graph) {
        String entry = graph.entry();
        if (!graph.predecessors(entry).isEmpty())
            throw new InvalidEntryException("Entry node '" + entry + "' must not have dependencies, found "
                    + graph.predecessors(entry));
    }

    /** @throws CycleException if the node edges admit no total order. */
    private static TopologicalOrder compile(WorkflowGraph graph) {
        TopologicalOrder.Builder topo = TopologicalOrder.builder();
        for (Node node : graph.nodes())
            topo.addNode(node);
        for (String from : graph.nodeNames())
            for (String to : graph.successors(from))
                if (!WorkflowGraph.END.equals(to))
                    topo.addEdge(from, to);
        return topo.build();
    }

    private static void checkTerminalReachable(WorkflowGraph graph) {
        Set<String> reaches = walk(WorkflowGraph.END, graph::predecessors);
        for (String name : graph.nodeNames())
            if (!reaches.contains(name))
                throw new UnreachableTerminalException(name);
    }

    private static void checkReachableFromEntry(WorkflowGraph graph) {
        Set<String> reached = walk(graph.entry(), graph::successors);
        for (String name : graph.nodeNames())
            if (!reached.contains(name))
                throw new UnreachableNodeException(name, graph.entry());
    }

    private static Set<String> walk(String start, Function<String, Set<String>> next) {
        Set<String> seen = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(start);
        seen.add(start);
        while (!stack.isEmpty()) {
            for (String n : next.apply(stack.pop()))
                if (seen.add(n))
                    stack.push(n);
        }
        return seen;
    }

    private static void checkFieldOwnership(WorkflowGraph graph) {
        Map<String, List<String>> producers = new LinkedHashMap<>();
        for (Node node : graph.nodes())
            for (String field : node.outputs())
                producers.computeIfAbsent(field, k -> new ArrayList<>()).add(node.name());
        for (var e : producers.entrySet())
            if (e.getValue().size() > 1)
                throw new FieldOwnershipConflictException(e.getKey(), e.getValue());
    }
}
