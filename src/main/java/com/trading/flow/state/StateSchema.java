package com.trading.flow.state;

import com.trading.flow.error.FieldTypeException;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Describes the fields a workflow state may hold and their types.
 *
 * A lenient schema type-checks the fields it knows and lets unknown fields
 * through. A strict schema also rejects unknown fields.
 */
public final class StateSchema {
    private static final StateSchema OPEN = new StateSchema(Map.of(), false);

    private final Map<String, StateKey<?>> keys;
    private final boolean strict;

    private StateSchema(Map<String, StateKey<?>> keys, boolean strict) {
        this.keys = keys;
        this.strict = strict;
    }

    /** A schema that accepts any field with any value. */
    public static StateSchema open() {
        return OPEN;
    }

    public static StateSchema lenient(StateKey<?>... keys) {
        return new StateSchema(index(Arrays.asList(keys)), false);
    }

    public static StateSchema strict(StateKey<?>... keys) {
        return new StateSchema(index(Arrays.asList(keys)), true);
    }

    private static Map<String, StateKey<?>> index(Collection<StateKey<?>> keys) {
        Map<String, StateKey<?>> byName = new LinkedHashMap<>();
        for (StateKey<?> key : keys) {
            StateKey<?> previous = byName.put(key.name(), key);
            if (previous != null && !previous.type().equals(key.type()))
                throw new IllegalArgumentException("Field '" + key.name() + "' declared with two types: "
                        + previous.type().getSimpleName() + " and " + key.type().getSimpleName());
        }
        return Map.copyOf(byName);
    }

    public boolean isStrict() {
        return strict;
    }

    public Collection<StateKey<?>> keys() {
        return keys.values();
    }

    /**
     * Checks one field/value pair.
     *
     * @throws FieldTypeException if the value does not match the declared type,
     *                            or the field is unknown to a strict schema.
     */
    public void check(String field, Object value) {
        StateKey<?> key = keys.get(field);
        if (key == null) {
            if (strict)
                throw new FieldTypeException(field, "not declared in the state schema");
            return;
        }
        if (!key.accepts(value))
            throw new FieldTypeException(field, key.type(), value);
    }

    public void checkAll(Map<String, ?> fields) {
        for (Map.Entry<String, ?> e : fields.entrySet())
            check(e.getKey(), e.getValue());
    }
}
