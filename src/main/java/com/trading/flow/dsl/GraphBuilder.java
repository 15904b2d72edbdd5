package com.trading.flow.dsl;

import com.trading.flow.api.Node;
import com.trading.flow.api.NodeFunction;
import com.trading.flow.engine.WorkflowGraph;
import com.trading.flow.error.DuplicateNodeException;
import com.trading.flow.error.UnknownNodeException;
import com.trading.flow.node.FunctionNode;

import java.util.*;

/**
 * Graph Builder -- the node registry of a workflow.
 *
 * This class provides a fluent API for defining the structure of a workflow:
 * which nodes exist, what each depends on, where execution starts and which
 * nodes lead to END.
 *
 * Usage Pattern:
 * 1. Create a builder: GraphBuilder g = GraphBuilder.create("my_flow");
 * 2. Register nodes: g.register("A", s -> StateDelta.of("x", 1));
 * 3. Declare dependencies: g.register("B", fn, "A") or g.addEdge("A", "B");
 * 4. Mark the entry and the terminal edges: g.setEntry("A").addEdge("B", END);
 * 5. Build: WorkflowGraph graph = g.build();
 *
 * The builder only records metadata; it is not thread-safe and every mutation
 * must happen before {@link #build()}. Structural validation (cycles, paths to
 * END) happens later, once, when the graph is first executed or explicitly
 * validated.
 */
public final class GraphBuilder {

    /** Terminal marker; use as the target of {@link #addEdge(String, String)}. */
    public static final String END = WorkflowGraph.END;

    private final String graphName;

    private final Map<String, Node> nodesByName = new LinkedHashMap<>();
    private final Map<String, Set<String>> successors = new LinkedHashMap<>();
    private String entry;
    private boolean enforceFieldOwnership;

    // Flag to prevent modification after building
    private boolean built;

    private GraphBuilder(String graphName) {
        this.graphName = graphName;
    }

    public static GraphBuilder create(String graphName) {
        return new GraphBuilder(graphName);
    }

    // ── Registration ─────────────────────────────────────────────

    /**
     * Registers a node backed by a function.
     *
     * @param name      unique node name.
     * @param fn        node body.
     * @param dependsOn names of already registered nodes this node depends on.
     * @throws DuplicateNodeException if the name is taken.
     * @throws UnknownNodeException   if a dependency is not registered.
     */
    public GraphBuilder register(String name, NodeFunction fn, Set<String> dependsOn) {
        return register(FunctionNode.of(name, fn), dependsOn);
    }

    public GraphBuilder register(String name, NodeFunction fn, String... dependsOn) {
        return register(FunctionNode.of(name, fn), new LinkedHashSet<>(Arrays.asList(dependsOn)));
    }

    public GraphBuilder register(Node node, String... dependsOn) {
        return register(node, new LinkedHashSet<>(Arrays.asList(dependsOn)));
    }

    /**
     * Registers a node object, keeping any output fields it declares.
     */
    public GraphBuilder register(Node node, Set<String> dependsOn) {
        checkNotBuilt();
        String name = node.name();
        if (END.equals(name))
            throw new IllegalArgumentException("'" + END + "' is reserved for the terminal marker");
        if (nodesByName.containsKey(name))
            throw new DuplicateNodeException(name);
        for (String dep : dependsOn)
            requireRegistered(dep);

        nodesByName.put(name, node);
        successors.put(name, new LinkedHashSet<>());
        for (String dep : dependsOn)
            successors.get(dep).add(name);
        return this;
    }

    // ── Edges ────────────────────────────────────────────────────

    /**
     * Declares that {@code to} depends on {@code from}. {@code to} may be
     * {@link #END}. Repeating an edge has no effect.
     *
     * @throws UnknownNodeException if an endpoint is not registered.
     */
    public GraphBuilder addEdge(String from, String to) {
        checkNotBuilt();
        requireRegistered(from);
        if (!END.equals(to))
            requireRegistered(to);
        successors.get(from).add(to);
        return this;
    }

    /** Shorthand for {@code addEdge(from, END)}. */
    public GraphBuilder addEdgeToEnd(String from) {
        return addEdge(from, END);
    }

    /**
     * @throws UnknownNodeException if the node is not registered.
     */
    public GraphBuilder setEntry(String name) {
        checkNotBuilt();
        requireRegistered(name);
        this.entry = name;
        return this;
    }

    /**
     * When enabled, validation rejects graphs where two nodes declare the same
     * output field, and the executor fails a node whose delta writes a field it
     * did not declare.
     */
    public GraphBuilder enforceFieldOwnership(boolean enforce) {
        checkNotBuilt();
        this.enforceFieldOwnership = enforce;
        return this;
    }

    // ── Build ────────────────────────────────────────────────────

    /**
     * Freezes the registry into an immutable graph. The builder cannot be used
     * afterwards.
     */
    public WorkflowGraph build() {
        checkNotBuilt();
        built = true;
        return new WorkflowGraph(graphName, entry, nodesByName, successors, enforceFieldOwnership);
    }

    public boolean isRegistered(String name) {
        return nodesByName.containsKey(name);
    }

    public String name() {
        return graphName;
    }

    private void requireRegistered(String name) {
        if (!nodesByName.containsKey(name))
            throw new UnknownNodeException(name);
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Graph '" + graphName + "' already built");
    }
}
