package com.trading.flow.util;

import com.trading.flow.api.Node;
import com.trading.flow.api.NodeStatus;
import com.trading.flow.engine.TopologicalOrder;
import com.trading.flow.engine.WorkflowGraph;
import com.trading.flow.engine.WorkflowResult;

import java.util.Map;
import java.util.Set;

/**
 * Diagnostic utility for inspecting graph topology and run outcomes.
 *
 * <p>
 * Generates human-readable string representations of the graph structure,
 * of a single node and of a finished run.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions, logging errors, or
 * "toString()" style diagnostics. Validates the graph on construction.
 */
public final class GraphExplain {
    private final WorkflowGraph graph;
    private final TopologicalOrder topology;

    /**
     * @throws com.trading.flow.error.GraphValidationException if the graph is malformed.
     */
    public GraphExplain(WorkflowGraph graph) {
        this.graph = graph;
        this.topology = graph.topology();
    }

    /**
     * Dumps the details of a single node.
     */
    public String explainNode(String nodeName) {
        int idx = topology.topoIndex(nodeName);
        Node node = topology.node(idx);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(nodeName).append('\n')
                .append("  Topo index: ").append(idx).append('\n')
                .append("  Type: ").append(node.getClass().getSimpleName()).append('\n')
                .append("  Is entry: ").append(nodeName.equals(graph.entry())).append('\n')
                .append("  Depends on: ").append(graph.predecessors(nodeName)).append('\n')
                .append("  Ancestors: ").append(topology.ancestors(idx).size()).append('\n');
        Set<String> outputs = node.outputs();
        if (!outputs.isEmpty())
            sb.append("  Produces: ").append(outputs).append('\n');
        sb.append("  Successors: ").append(String.join(", ", graph.successors(nodeName)));
        return sb.append('\n').toString();
    }

    /**
     * Dumps the entire topology in dot-like text format.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph ").append(graph.name()).append(" (").append(topology.nodeCount()).append(" nodes):\n");
        for (int i = 0; i < topology.nodeCount(); i++) {
            String name = topology.node(i).name();
            sb.append("  [").append(i).append("] ").append(name);
            if (name.equals(graph.entry()))
                sb.append(" (ENTRY)");
            Set<String> next = graph.successors(name);
            if (!next.isEmpty())
                sb.append(" -> ").append(String.join(", ", next));
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram, nodes in topological order and the
     * terminal marker rendered as a stadium shape.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("graph TD;\n");
        for (String name : topology.names()) {
            sb.append("  ").append(sanitize(name)).append("[\"").append(name).append("\"];\n");
        }
        sb.append("  ").append(sanitize(WorkflowGraph.END)).append("([\"END\"]);\n");

        for (String name : topology.names()) {
            for (String to : graph.successors(name))
                sb.append("  ").append(sanitize(name)).append(" --> ").append(sanitize(to)).append(";\n");
        }
        return sb.toString();
    }

    /**
     * Summarises a finished run: elapsed time and the status of each node.
     */
    public static String explainRun(WorkflowResult result) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("Run ").append(result.runId()).append(" of ").append(result.graphName())
                .append(": ").append(result.completedNodes()).append(" nodes in ")
                .append(String.format("%.3f ms", result.elapsedMillis())).append('\n');
        for (Map.Entry<String, NodeStatus> e : result.nodeStatuses().entrySet())
            sb.append("  ").append(e.getKey()).append(": ").append(e.getValue()).append('\n');
        sb.append("  Fields: ").append(result.finalState().fieldNames()).append('\n');
        return sb.toString();
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
