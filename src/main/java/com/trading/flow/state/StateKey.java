package com.trading.flow.state;

import java.util.Objects;

/**
 * A named, typed field of the shared workflow state.
 *
 * Keys give nodes type-checked access to snapshot values and let a
 * {@link StateSchema} reject mistyped writes at merge time, instead of the
 * mismatch surfacing later in some downstream node.
 *
 * @param name field name, unique within a schema
 * @param type the type every value of this field must be an instance of
 * @param <T>  value type
 */
public record StateKey<T>(String name, Class<T> type) {

    public StateKey {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (name.isBlank())
            throw new IllegalArgumentException("State key name must not be blank");
    }

    public static <T> StateKey<T> of(String name, Class<T> type) {
        return new StateKey<>(name, type);
    }

    /** Casts a raw value to this key's type; the caller has checked {@link #accepts}. */
    public T cast(Object value) {
        return type.cast(value);
    }

    public boolean accepts(Object value) {
        return type.isInstance(value);
    }

    @Override
    public String toString() {
        return name + ":" + type.getSimpleName();
    }
}
