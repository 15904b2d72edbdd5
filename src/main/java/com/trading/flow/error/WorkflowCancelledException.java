package com.trading.flow.error;

import com.trading.flow.api.NodeStatus;
import com.trading.flow.state.StateSnapshot;

import java.util.Map;

/** The run was cancelled by the caller, by a timeout, or by interruption. */
public class WorkflowCancelledException extends WorkflowException {
    public WorkflowCancelledException(long runId, String reason, StateSnapshot partialState,
            Map<String, NodeStatus> nodeStatuses) {
        super("Workflow run " + runId + " cancelled: " + reason, runId, null, null, partialState, nodeStatuses);
    }
}
