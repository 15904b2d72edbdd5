package com.trading.flow.node;

import com.trading.flow.api.Node;
import com.trading.flow.api.NodeFunction;
import com.trading.flow.state.StateDelta;
import com.trading.flow.state.StateKey;
import com.trading.flow.state.StateSnapshot;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A node backed by a {@link NodeFunction} lambda.
 *
 * Usage: {@code FunctionNode.of("B", s -> StateDelta.of("y", (int) s.get("x") + 1)).produces("y")}
 */
public final class FunctionNode implements Node {
    private final String name;
    private final NodeFunction fn;
    private final Set<String> outputs;

    private FunctionNode(String name, NodeFunction fn, Set<String> outputs) {
        this.name = Objects.requireNonNull(name, "name");
        this.fn = Objects.requireNonNull(fn, "fn");
        this.outputs = Set.copyOf(outputs);
    }

    public static FunctionNode of(String name, NodeFunction fn) {
        return new FunctionNode(name, fn, Set.of());
    }

    /** Returns a copy of this node declaring the given output fields. */
    public FunctionNode produces(String... fields) {
        Set<String> declared = new LinkedHashSet<>(outputs);
        declared.addAll(Arrays.asList(fields));
        return new FunctionNode(name, fn, declared);
    }

    public FunctionNode produces(StateKey<?>... keys) {
        return produces(Arrays.stream(keys).map(StateKey::name).toArray(String[]::new));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Set<String> outputs() {
        return outputs;
    }

    @Override
    public StateDelta execute(StateSnapshot snapshot) throws Exception {
        return fn.apply(snapshot);
    }

    @Override
    public String toString() {
        return "FunctionNode[" + name + "]";
    }
}
