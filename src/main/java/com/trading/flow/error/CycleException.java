package com.trading.flow.error;

import java.util.List;

/** The graph contains at least one dependency cycle. */
public class CycleException extends GraphValidationException {
    private final List<String> involvedNodes;

    public CycleException(List<String> involvedNodes) {
        super("Cycle detected between nodes: " + involvedNodes);
        this.involvedNodes = List.copyOf(involvedNodes);
    }

    /** Nodes that lie on (or between) cycles, in registration order. */
    public List<String> involvedNodes() {
        return involvedNodes;
    }
}
