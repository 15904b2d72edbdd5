package com.trading.flow.api;

import java.util.Set;

/**
 * Observability hooks for workflow runs.
 *
 * All callbacks of one run are delivered on that run's scheduler thread, in
 * the order the scheduler observes the events. Different runs may call the
 * same listener concurrently, so shared listeners must be thread-safe.
 *
 * Callbacks sit on the scheduling path: keep them cheap. A listener that
 * throws is logged and otherwise ignored.
 */
public interface WorkflowListener {

    /**
     * Called once before the entry node is launched.
     *
     * @param runId     identifier of the run, unique per engine.
     * @param graphName name of the graph being executed.
     */
    default void onRunStart(long runId, String graphName) {
    }

    /** Called when a node is handed to a worker. */
    default void onNodeStarted(long runId, String nodeName) {
    }

    /**
     * Called after a node's delta has been merged.
     *
     * @param durationNanos wall time of the node body.
     * @param fieldsWritten names of the fields the delta wrote.
     */
    default void onNodeCompleted(long runId, String nodeName, long durationNanos, Set<String> fieldsWritten) {
    }

    /** Called when a node throws, or breaks the node contract. */
    default void onNodeFailed(long runId, String nodeName, Throwable error) {
    }

    /**
     * Called once when the run finishes, whatever the outcome.
     *
     * @param completedNodes number of nodes that completed successfully.
     */
    default void onRunEnd(long runId, RunStatus status, int completedNodes) {
    }
}
