package com.trading.flow.error;

import java.util.Set;

/** A node wrote fields outside the outputs it declared, while ownership is enforced. */
public class UndeclaredFieldException extends IllegalStateException {
    private final String nodeName;
    private final Set<String> fields;

    public UndeclaredFieldException(String nodeName, Set<String> fields, Set<String> declared) {
        super("Node '" + nodeName + "' wrote undeclared fields " + fields + "; declared " + declared);
        this.nodeName = nodeName;
        this.fields = Set.copyOf(fields);
    }

    public String nodeName() {
        return nodeName;
    }

    public Set<String> fields() {
        return fields;
    }
}
