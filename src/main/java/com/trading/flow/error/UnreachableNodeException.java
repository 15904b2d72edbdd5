package com.trading.flow.error;

/** A node cannot be reached from the entry node and would never run. */
public class UnreachableNodeException extends GraphValidationException {
    private final String nodeName;

    public UnreachableNodeException(String nodeName, String entry) {
        super("Node '" + nodeName + "' is not reachable from entry '" + entry + "'");
        this.nodeName = nodeName;
    }

    public String nodeName() {
        return nodeName;
    }
}
