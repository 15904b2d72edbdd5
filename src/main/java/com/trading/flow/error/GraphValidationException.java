package com.trading.flow.error;

/**
 * Base type for structural problems found by the graph validator.
 *
 * Validation errors are raised before any node runs and are never retried.
 */
public class GraphValidationException extends IllegalStateException {
    public GraphValidationException(String message) {
        super(message);
    }
}
