package com.trading.flow;

import com.trading.flow.config.EngineConfig;
import com.trading.flow.dsl.GraphBuilder;
import com.trading.flow.engine.WorkflowEngine;

/**
 * FlowGraph: a small concurrent DAG workflow engine.
 *
 * <h2>Model</h2>
 * <ul>
 * <li><b>Nodes</b> are named units of work: a function from a state snapshot
 * to a state delta.</li>
 * <li><b>Edges</b> are dependencies; a node runs only after all of its
 * dependencies have merged their deltas.</li>
 * <li><b>State</b> is a map of named fields, built up incrementally as nodes
 * complete. Deltas only add or overwrite fields.</li>
 * <li><b>END</b> is the terminal marker. Every node must lead to it.</li>
 * </ul>
 *
 * <h3>Key Features</h3>
 * <ul>
 * <li><b>Concurrent:</b> independent branches run in parallel; fan-in nodes
 * wait for every dependency.</li>
 * <li><b>Consistent:</b> a node sees the initial state plus exactly what its
 * ancestors produced, never a half-applied delta.</li>
 * <li><b>Fail-stop:</b> the first failure stops new launches and returns the
 * state merged so far.</li>
 * </ul>
 */
public final class FlowGraph {

    private FlowGraph() {
        // Prevent instantiation of utility class
    }

    /**
     * Entry point: create a new graph builder.
     *
     * @param graphName A descriptive name for the workflow.
     * @return A new {@link GraphBuilder} instance.
     */
    public static GraphBuilder builder(String graphName) {
        return GraphBuilder.create(graphName);
    }

    /** Creates an engine with default settings. */
    public static WorkflowEngine engine() {
        return new WorkflowEngine();
    }

    public static WorkflowEngine engine(EngineConfig config) {
        return new WorkflowEngine(config);
    }
}
