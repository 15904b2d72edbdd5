package com.trading.flow.api;

import com.trading.flow.state.StateDelta;
import com.trading.flow.state.StateSnapshot;

/**
 * Lambda-friendly node body: snapshot in, delta out.
 */
@FunctionalInterface
public interface NodeFunction {
    StateDelta apply(StateSnapshot snapshot) throws Exception;
}
