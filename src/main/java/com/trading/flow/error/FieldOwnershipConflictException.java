package com.trading.flow.error;

import java.util.List;

/** Two or more nodes declare the same output field. */
public class FieldOwnershipConflictException extends GraphValidationException {
    private final String field;
    private final List<String> producers;

    public FieldOwnershipConflictException(String field, List<String> producers) {
        super("Field '" + field + "' is declared as output by several nodes: " + producers);
        this.field = field;
        this.producers = List.copyOf(producers);
    }

    public String field() {
        return field;
    }

    public List<String> producers() {
        return producers;
    }
}
