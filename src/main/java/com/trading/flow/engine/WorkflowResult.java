package com.trading.flow.engine;

import com.trading.flow.api.NodeStatus;
import com.trading.flow.state.StateKey;
import com.trading.flow.state.StateSnapshot;

import java.util.Map;

/**
 * Outcome of a successful run.
 *
 * @param runId          run identifier, unique per engine.
 * @param graphName      name of the executed graph.
 * @param finalState     state after every node merged its delta.
 * @param nodeStatuses   status of each node, in topological order.
 * @param completedNodes number of nodes that ran.
 * @param elapsedNanos   wall time from submission to completion.
 */
public record WorkflowResult(long runId, String graphName, StateSnapshot finalState,
        Map<String, NodeStatus> nodeStatuses, int completedNodes, long elapsedNanos) {

    public <T> T get(StateKey<T> key) {
        return finalState.get(key);
    }

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }
}
