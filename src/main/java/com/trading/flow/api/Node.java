package com.trading.flow.api;

import com.trading.flow.state.StateDelta;
import com.trading.flow.state.StateSnapshot;

import java.util.Set;

/**
 * A named unit of work in a workflow graph.
 *
 * This interface is the boundary between the engine and domain code. The
 * engine knows nothing about what a node does: it hands the node a snapshot
 * of the state as of the moment all its dependencies completed, and merges
 * the returned delta back into the shared state.
 *
 * Contract:
 * <ul>
 * <li>Must not mutate the snapshot, and never sees the state store itself.</li>
 * <li>Returns a delta holding only the fields this node is the sole producer
 * of. Returning null is treated as a failure.</li>
 * <li>May block (network calls and the like). The engine does not interrupt
 * a running node.</li>
 * <li>Throwing fails the whole run. Failures the node can recover from
 * (skipping one malformed record, falling back to cached data) are handled
 * inside the node and never reach the engine.</li>
 * </ul>
 */
public interface Node {

    /**
     * Returns the unique name of this node within its graph.
     */
    String name();

    /**
     * Fields this node declares it writes. Empty means undeclared; such nodes
     * are skipped by field ownership checks.
     */
    default Set<String> outputs() {
        return Set.of();
    }

    /**
     * Runs the node.
     *
     * @param snapshot the state visible to this node; initial fields plus
     *                 everything merged by its transitive dependencies.
     * @return the fields to merge into the shared state.
     * @throws Exception any application-level failure.
     */
    StateDelta execute(StateSnapshot snapshot) throws Exception;
}
