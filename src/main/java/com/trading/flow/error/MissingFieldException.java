package com.trading.flow.error;

/** A node asked a snapshot for a field it does not contain. */
public class MissingFieldException extends IllegalStateException {
    private final String field;

    public MissingFieldException(String field) {
        super("State has no field '" + field + "'");
        this.field = field;
    }

    public String field() {
        return field;
    }
}
