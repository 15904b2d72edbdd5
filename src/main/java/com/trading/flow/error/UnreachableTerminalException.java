package com.trading.flow.error;

/** A node has no path to the terminal marker. */
public class UnreachableTerminalException extends GraphValidationException {
    private final String nodeName;

    public UnreachableTerminalException(String nodeName) {
        super("Node '" + nodeName + "' has no path to END");
        this.nodeName = nodeName;
    }

    public String nodeName() {
        return nodeName;
    }
}
