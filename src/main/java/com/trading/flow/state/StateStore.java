package com.trading.flow.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Holds the evolving state of one workflow run.
 *
 * Concurrency model: copy-on-write. The current fields and the merge journal
 * live in an immutable {@link Version} published through a volatile field.
 * {@link #merge} calls are serialized on the store monitor and each publishes
 * a new version in a single write, so a reader sees either all of a delta or
 * none of it. {@link #snapshot()} is a volatile read and never blocks.
 *
 * The journal records which node produced each delta. It backs
 * {@link #snapshotOf(Set)}, which rebuilds the state a node would see if only
 * its own ancestors had run.
 */
public final class StateStore {

    /** One applied delta. A null producer marks a merge made by the caller. */
    public record MergeRecord(String producer, StateDelta delta) {
    }

    private record Version(Map<String, Object> fields, List<MergeRecord> journal) {
    }

    private final StateSchema schema;
    private final Map<String, Object> seed;
    private volatile Version current;

    public StateStore(Map<String, ?> initialState) {
        this(initialState, StateSchema.open());
    }

    /**
     * @throws NullPointerException if a seed field holds a null value.
     * @throws com.trading.flow.error.FieldTypeException if a seed field violates {@code schema}.
     */
    public StateStore(Map<String, ?> initialState, StateSchema schema) {
        this.schema = schema;
        initialState.forEach((field, value) -> Objects.requireNonNull(value,
                () -> "Null value for seed field '" + field + "'"));
        schema.checkAll(initialState);
        this.seed = Map.copyOf(initialState);
        this.current = new Version(seed, List.of());
    }

    /** Point-in-time copy of every field merged so far. */
    public StateSnapshot snapshot() {
        return StateSnapshot.wrap(current.fields());
    }

    /**
     * The seed fields plus the deltas merged by the given producers (and by
     * caller merges), replayed in merge order.
     *
     * @param producers names of the nodes whose output should be visible.
     */
    public StateSnapshot snapshotOf(Set<String> producers) {
        Version v = current;
        if (v.journal().isEmpty())
            return StateSnapshot.wrap(v.fields());
        Map<String, Object> fields = new HashMap<>(seed);
        for (MergeRecord r : v.journal()) {
            if (r.producer() == null || producers.contains(r.producer()))
                fields.putAll(r.delta().fields());
        }
        return StateSnapshot.wrap(Collections.unmodifiableMap(fields));
    }

    /** Applies a caller-supplied delta, visible to every later snapshot. */
    public void merge(StateDelta delta) {
        merge(null, delta);
    }

    /**
     * Atomically applies all fields of {@code delta}; last writer wins per field.
     *
     * @param producer name of the node that produced the delta, or null.
     * @throws com.trading.flow.error.FieldTypeException if the delta violates
     *         the store's schema; nothing is applied in that case.
     */
    public synchronized void merge(String producer, StateDelta delta) {
        schema.checkAll(delta.fields());
        if (delta.isEmpty() && producer == null)
            return;
        Version v = current;
        Map<String, Object> fields = new HashMap<>(v.fields());
        fields.putAll(delta.fields());
        List<MergeRecord> journal = new ArrayList<>(v.journal().size() + 1);
        journal.addAll(v.journal());
        journal.add(new MergeRecord(producer, delta));
        current = new Version(Collections.unmodifiableMap(fields), Collections.unmodifiableList(journal));
    }

    /** Deltas applied so far, in merge order. */
    public List<MergeRecord> journal() {
        return current.journal();
    }

    public StateSchema schema() {
        return schema;
    }
}
