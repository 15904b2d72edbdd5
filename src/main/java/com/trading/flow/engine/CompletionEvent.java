package com.trading.flow.engine;

import com.trading.flow.state.StateDelta;

/**
 * A mutable holder for scheduler events, used within a run's completion ring.
 *
 * <p>
 * <b>Flyweight Pattern:</b> instances are pre-allocated when the ring buffer
 * is created and reused for every event. Workers fill one in when a node
 * finishes; the run's consumer thread reads it and clears it.
 */
final class CompletionEvent {

    enum Type {
        START,
        COMPLETED,
        FAILED,
        CANCEL
    }

    private Type type;
    private int nodeIndex = -1;
    private StateDelta delta;
    private Throwable error;
    private long durationNanos;
    private String reason;

    void setStart() {
        this.type = Type.START;
    }

    void setCompleted(int nodeIndex, StateDelta delta, long durationNanos) {
        this.type = Type.COMPLETED;
        this.nodeIndex = nodeIndex;
        this.delta = delta;
        this.durationNanos = durationNanos;
    }

    void setFailed(int nodeIndex, Throwable error, long durationNanos) {
        this.type = Type.FAILED;
        this.nodeIndex = nodeIndex;
        this.error = error;
        this.durationNanos = durationNanos;
    }

    void setCancel(String reason) {
        this.type = Type.CANCEL;
        this.reason = reason;
    }

    Type type() {
        return type;
    }

    int nodeIndex() {
        return nodeIndex;
    }

    StateDelta delta() {
        return delta;
    }

    Throwable error() {
        return error;
    }

    long durationNanos() {
        return durationNanos;
    }

    String reason() {
        return reason;
    }

    // Drop references so the ring does not keep deltas and errors alive.
    void clear() {
        type = null;
        nodeIndex = -1;
        delta = null;
        error = null;
        durationNanos = 0;
        reason = null;
    }
}
