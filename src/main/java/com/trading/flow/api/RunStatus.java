package com.trading.flow.api;

/** Outcome of a whole workflow run. */
public enum RunStatus {
    SUCCEEDED,
    FAILED,
    CANCELLED
}
