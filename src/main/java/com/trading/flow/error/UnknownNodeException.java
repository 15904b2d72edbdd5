package com.trading.flow.error;

/** Thrown when an edge, dependency or entry refers to an unregistered node. */
public class UnknownNodeException extends IllegalArgumentException {
    private final String nodeName;

    public UnknownNodeException(String nodeName) {
        super("Unknown node: " + nodeName);
        this.nodeName = nodeName;
    }

    public String nodeName() {
        return nodeName;
    }
}
