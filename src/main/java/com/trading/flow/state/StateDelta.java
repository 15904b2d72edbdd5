package com.trading.flow.state;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The fields a single node execution contributes to the shared state.
 *
 * A delta only adds or overwrites fields. There is no way to express a
 * deletion, and null values are rejected.
 */
public final class StateDelta {
    private static final StateDelta EMPTY = new StateDelta(Map.of());

    private final Map<String, Object> fields;

    private StateDelta(Map<String, Object> fields) {
        this.fields = fields;
    }

    public static StateDelta empty() {
        return EMPTY;
    }

    public static StateDelta of(String field, Object value) {
        return new StateDelta(Map.of(field, value));
    }

    public static <T> StateDelta of(StateKey<T> key, T value) {
        return of(key.name(), value);
    }

    public static StateDelta of(Map<String, ?> fields) {
        return fields.isEmpty() ? EMPTY : new StateDelta(Map.copyOf(fields));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Object> fields() {
        return fields;
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public int size() {
        return fields.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StateDelta other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "StateDelta" + fields.keySet();
    }

    public static final class Builder {
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public <T> Builder put(StateKey<T> key, T value) {
            return put(key.name(), value);
        }

        public Builder put(String field, Object value) {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(value, () -> "Null value for field '" + field + "'");
            fields.put(field, value);
            return this;
        }

        public StateDelta build() {
            return StateDelta.of(fields);
        }
    }
}
