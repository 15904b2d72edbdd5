package com.trading.flow.error;

/** A state field holds (or is about to receive) a value of the wrong type. */
public class FieldTypeException extends IllegalStateException {
    private final String field;

    public FieldTypeException(String field, Class<?> expected, Object actual) {
        super("Field '" + field + "' expects " + expected.getSimpleName() + " but got "
                + (actual == null ? "null" : actual.getClass().getSimpleName()));
        this.field = field;
    }

    public FieldTypeException(String field, String message) {
        super("Field '" + field + "': " + message);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
