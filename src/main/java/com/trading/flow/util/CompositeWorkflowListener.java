package com.trading.flow.util;

import com.trading.flow.api.RunStatus;
import com.trading.flow.api.WorkflowListener;

import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans callbacks out to several {@link WorkflowListener}s, in registration order.
 */
public class CompositeWorkflowListener implements WorkflowListener {
    private final CopyOnWriteArrayList<WorkflowListener> listeners = new CopyOnWriteArrayList<>();

    public CompositeWorkflowListener(WorkflowListener... initial) {
        for (WorkflowListener l : initial)
            add(l);
    }

    public CompositeWorkflowListener add(WorkflowListener listener) {
        listeners.add(listener);
        return this;
    }

    public int size() {
        return listeners.size();
    }

    @Override
    public void onRunStart(long runId, String graphName) {
        for (WorkflowListener l : listeners)
            l.onRunStart(runId, graphName);
    }

    @Override
    public void onNodeStarted(long runId, String nodeName) {
        for (WorkflowListener l : listeners)
            l.onNodeStarted(runId, nodeName);
    }

    @Override
    public void onNodeCompleted(long runId, String nodeName, long durationNanos, Set<String> fieldsWritten) {
        for (WorkflowListener l : listeners)
            l.onNodeCompleted(runId, nodeName, durationNanos, fieldsWritten);
    }

    @Override
    public void onNodeFailed(long runId, String nodeName, Throwable error) {
        for (WorkflowListener l : listeners)
            l.onNodeFailed(runId, nodeName, error);
    }

    @Override
    public void onRunEnd(long runId, RunStatus status, int completedNodes) {
        for (WorkflowListener l : listeners)
            l.onRunEnd(runId, status, completedNodes);
    }
}
