package com.trading.flow.engine;

import com.trading.flow.api.Node;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An immutable workflow graph: nodes, dependency edges, the entry node and
 * the edges into the terminal marker {@link #END}.
 *
 * Instances are produced by {@link com.trading.flow.dsl.GraphBuilder} and
 * never change afterwards, so one graph can be shared by any number of
 * concurrent runs without locking.
 *
 * The validated topology is computed on first use and cached. A graph that
 * fails validation throws the same exception every time it is asked.
 */
public final class WorkflowGraph {

    /** Name of the terminal marker. It is never registered or invoked. */
    public static final String END = "__end__";

    private final String name;
    private final String entry;
    private final Map<String, Node> nodes;
    private final Map<String, Set<String>> successors;
    private final Map<String, Set<String>> predecessors;
    private final boolean enforceFieldOwnership;

    private volatile TopologicalOrder topology;

    /**
     * @param nodes        nodes in registration order.
     * @param successors   outgoing edges per node; may contain {@link #END}.
     * @param entry        entry node name, or null if never set.
     */
    public WorkflowGraph(String name, String entry, Map<String, Node> nodes, Map<String, Set<String>> successors,
            boolean enforceFieldOwnership) {
        this.name = name;
        this.entry = entry;
        this.enforceFieldOwnership = enforceFieldOwnership;

        Map<String, Node> nodeCopy = new LinkedHashMap<>(nodes);
        Map<String, Set<String>> succ = new LinkedHashMap<>();
        Map<String, Set<String>> pred = new LinkedHashMap<>();
        for (String n : nodeCopy.keySet()) {
            succ.put(n, new LinkedHashSet<>());
            pred.put(n, new LinkedHashSet<>());
        }
        pred.put(END, new LinkedHashSet<>());
        for (var e : successors.entrySet()) {
            for (String to : e.getValue()) {
                succ.get(e.getKey()).add(to);
                pred.get(to).add(e.getKey());
            }
        }
        this.nodes = Collections.unmodifiableMap(nodeCopy);
        this.successors = freeze(succ);
        this.predecessors = freeze(pred);
    }

    private static Map<String, Set<String>> freeze(Map<String, Set<String>> edges) {
        Map<String, Set<String>> frozen = new LinkedHashMap<>();
        edges.forEach((k, v) -> frozen.put(k, Collections.unmodifiableSet(v)));
        return Collections.unmodifiableMap(frozen);
    }

    public String name() {
        return name;
    }

    /** The entry node name, or null if the builder never set one. */
    public String entry() {
        return entry;
    }

    public boolean enforcesFieldOwnership() {
        return enforceFieldOwnership;
    }

    public Node node(String nodeName) {
        return nodes.get(nodeName);
    }

    public boolean contains(String nodeName) {
        return nodes.containsKey(nodeName);
    }

    /** Node names in registration order. */
    public Collection<String> nodeNames() {
        return nodes.keySet();
    }

    public Collection<Node> nodes() {
        return nodes.values();
    }

    public int nodeCount() {
        return nodes.size();
    }

    /** Direct dependents of a node, possibly including {@link #END}. */
    public Set<String> successors(String nodeName) {
        Set<String> s = successors.get(nodeName);
        return s == null ? Set.of() : s;
    }

    /** Direct dependencies of a node. Pass {@link #END} for the terminal predecessors. */
    public Set<String> predecessors(String nodeName) {
        Set<String> p = predecessors.get(nodeName);
        return p == null ? Set.of() : p;
    }

    public Set<String> terminalPredecessors() {
        return predecessors(END);
    }

    /** All edges as (from, to) pairs, END edges included. */
    public List<Edge> edges() {
        return successors.entrySet().stream()
                .flatMap(e -> e.getValue().stream().map(to -> new Edge(e.getKey(), to)))
                .toList();
    }

    /**
     * Validates the graph on first call and returns the cached topology after.
     *
     * @throws com.trading.flow.error.GraphValidationException if the graph is malformed.
     */
    public TopologicalOrder topology() {
        TopologicalOrder t = topology;
        if (t == null) {
            synchronized (this) {
                t = topology;
                if (t == null) {
                    t = GraphValidator.validate(this);
                    topology = t;
                }
            }
        }
        return t;
    }

    @Override
    public String toString() {
        return "WorkflowGraph[" + name + ", nodes=" + nodes.keySet() + ", entry=" + entry + "]";
    }

    /** A dependency edge; {@code to} depends on {@code from}. */
    public record Edge(String from, String to) {
    }
}
