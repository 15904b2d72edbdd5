package com.trading.flow.state;

import com.trading.flow.error.FieldTypeException;
import com.trading.flow.error.MissingFieldException;

import java.util.Map;
import java.util.Set;

/**
 * An immutable, point-in-time view of the workflow state.
 *
 * Nodes receive a snapshot when they are launched. It never changes
 * afterwards, whatever other nodes merge in the meantime.
 */
public final class StateSnapshot {
    private static final StateSnapshot EMPTY = new StateSnapshot(Map.of());

    private final Map<String, Object> fields;

    private StateSnapshot(Map<String, Object> fields) {
        this.fields = fields;
    }

    public static StateSnapshot empty() {
        return EMPTY;
    }

    /** Copies the given map; null keys or values are rejected. */
    public static StateSnapshot of(Map<String, ?> fields) {
        return fields.isEmpty() ? EMPTY : new StateSnapshot(Map.copyOf(fields));
    }

    /** Wraps a map that is already immutable. */
    static StateSnapshot wrap(Map<String, Object> immutableFields) {
        return new StateSnapshot(immutableFields);
    }

    /**
     * Typed lookup.
     *
     * @throws MissingFieldException if the field is absent.
     * @throws FieldTypeException    if the value is not of the key's type.
     */
    public <T> T get(StateKey<T> key) {
        Object value = fields.get(key.name());
        if (value == null)
            throw new MissingFieldException(key.name());
        if (!key.accepts(value))
            throw new FieldTypeException(key.name(), key.type(), value);
        return key.cast(value);
    }

    public <T> T getOrDefault(StateKey<T> key, T defaultValue) {
        return contains(key.name()) ? get(key) : defaultValue;
    }

    /** Untyped lookup; null if absent. */
    public Object get(String field) {
        return fields.get(field);
    }

    public boolean contains(String field) {
        return fields.containsKey(field);
    }

    public boolean contains(StateKey<?> key) {
        return fields.containsKey(key.name());
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public Map<String, Object> asMap() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StateSnapshot other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "StateSnapshot" + new java.util.TreeMap<>(fields);
    }
}
