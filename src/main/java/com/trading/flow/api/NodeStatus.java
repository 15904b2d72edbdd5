package com.trading.flow.api;

/**
 * Lifecycle of a node within one run.
 *
 * PENDING → READY → RUNNING → {COMPLETED, FAILED}. The entry node starts
 * READY; nodes that never become eligible (because an ancestor failed or the
 * run was cancelled) stay PENDING or READY.
 */
public enum NodeStatus {
    PENDING,
    READY,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
