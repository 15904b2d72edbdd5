package com.trading.flow.error;

/** Thrown when a node name is registered twice in the same graph. */
public class DuplicateNodeException extends IllegalArgumentException {
    private final String nodeName;

    public DuplicateNodeException(String nodeName) {
        super("Duplicate node name: " + nodeName);
        this.nodeName = nodeName;
    }

    public String nodeName() {
        return nodeName;
    }
}
