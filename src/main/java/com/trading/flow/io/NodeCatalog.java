package com.trading.flow.io;

import com.trading.flow.api.Node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Registry mapping node type names to their instantiation factories.
 *
 * Type names are matched case-insensitively.
 */
public final class NodeCatalog {

    /** Factory for creating node instances from workflow definitions. */
    @FunctionalInterface
    public interface NodeFactory {
        Node create(String name, Map<String, Object> properties);
    }

    private final Map<String, NodeFactory> factories = new LinkedHashMap<>();

    public NodeCatalog register(String type, NodeFactory factory) {
        factories.put(normalize(type), factory);
        return this;
    }

    /**
     * @throws IllegalArgumentException if no factory is registered for the type.
     */
    public NodeFactory factory(String type) {
        NodeFactory f = type == null ? null : factories.get(normalize(type));
        if (f == null)
            throw new IllegalArgumentException("Unknown node type: " + type + ", known: " + factories.keySet());
        return f;
    }

    public boolean contains(String type) {
        return type != null && factories.containsKey(normalize(type));
    }

    public Set<String> types() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    private static String normalize(String type) {
        return type.trim().toLowerCase();
    }

    // ── Property helpers ─────────────────────────────────────────

    public static int getInt(Map<String, Object> props, String key, int def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        return v instanceof Number n ? n.intValue() : Integer.parseInt(v.toString());
    }

    public static double getDouble(Map<String, Object> props, String key, double def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        return v instanceof Number n ? n.doubleValue() : Double.parseDouble(v.toString());
    }

    public static String getString(Map<String, Object> props, String key, String def) {
        Object v = props.get(key);
        return v == null ? def : v.toString();
    }
}
