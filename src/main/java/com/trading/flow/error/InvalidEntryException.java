package com.trading.flow.error;

/** The graph has no entry node, or the entry node has declared dependencies. */
public class InvalidEntryException extends GraphValidationException {
    public InvalidEntryException(String message) {
        super(message);
    }
}
