package com.trading.flow.error;

import com.trading.flow.api.NodeStatus;
import com.trading.flow.state.StateSnapshot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A workflow run stopped before reaching END.
 *
 * Carries the state as merged up to the point the run stopped, so callers can
 * inspect partial progress. The node failure, if any, is the cause.
 */
public class WorkflowException extends RuntimeException {
    private final long runId;
    private final String failedNode;
    private final StateSnapshot partialState;
    private final Map<String, NodeStatus> nodeStatuses;

    public WorkflowException(long runId, String failedNode, Throwable cause, StateSnapshot partialState,
            Map<String, NodeStatus> nodeStatuses) {
        this("Workflow run " + runId + " failed at node '" + failedNode + "'", runId, failedNode, cause,
                partialState, nodeStatuses);
    }

    protected WorkflowException(String message, long runId, String failedNode, Throwable cause,
            StateSnapshot partialState, Map<String, NodeStatus> nodeStatuses) {
        super(message, cause);
        this.runId = runId;
        this.failedNode = failedNode;
        this.partialState = partialState;
        this.nodeStatuses = Collections.unmodifiableMap(new LinkedHashMap<>(nodeStatuses));
    }

    public long runId() {
        return runId;
    }

    /** Name of the first node that failed; null when the run was cancelled. */
    public String failedNode() {
        return failedNode;
    }

    public StateSnapshot partialState() {
        return partialState;
    }

    /** Status of each node, in topological order. */
    public Map<String, NodeStatus> nodeStatuses() {
        return nodeStatuses;
    }
}
