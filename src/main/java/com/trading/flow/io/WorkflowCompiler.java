package com.trading.flow.io;

import com.trading.flow.api.Node;
import com.trading.flow.config.EngineConfig;
import com.trading.flow.dsl.GraphBuilder;
import com.trading.flow.engine.WorkflowGraph;
import com.trading.flow.node.FunctionNode;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles a JSON {@link WorkflowDefinition} into an executable graph.
 *
 * Nodes are created through a {@link NodeCatalog} and registered with a
 * {@link GraphBuilder} once all of their {@code dependsOn} entries exist, so
 * definitions may list nodes in any order. Structural checks are left to the
 * graph's validator.
 */
@Log4j2
public final class WorkflowCompiler {
    private final NodeCatalog catalog;

    public WorkflowCompiler(NodeCatalog catalog) {
        this.catalog = catalog;
    }

    /** Result of compilation: the graph plus the engine settings it asked for. */
    public record CompiledWorkflow(WorkflowGraph graph, EngineConfig config) {
    }

    /**
     * @throws IllegalArgumentException for unknown node types, dangling
     *         references or missing names.
     */
    public CompiledWorkflow compile(WorkflowDefinition def) {
        WorkflowDefinition.WorkflowInfo info = def.getWorkflow();
        if (info == null || info.getName() == null)
            throw new IllegalArgumentException("Workflow definition needs a name");

        GraphBuilder g = GraphBuilder.create(info.getName());
        WorkflowDefinition.Options options = info.getOptions();
        if (options != null)
            g.enforceFieldOwnership(options.isEnforceFieldOwnership());

        List<WorkflowDefinition.NodeDef> nodeDefs = info.getNodes() != null ? info.getNodes() : List.of();
        Set<String> declared = nodeDefs.stream().map(WorkflowDefinition.NodeDef::getName)
                .collect(Collectors.toSet());
        for (WorkflowDefinition.NodeDef nd : nodeDefs) {
            if (nd.getName() == null)
                throw new IllegalArgumentException("Node definition without a name");
            for (String dep : deps(nd))
                if (!declared.contains(dep))
                    throw new IllegalArgumentException("Node '" + nd.getName() + "' depends on undefined node '"
                            + dep + "'");
        }

        // Register nodes once their dependencies are registered.
        Deque<WorkflowDefinition.NodeDef> pending = new ArrayDeque<>(nodeDefs);
        int prevPendingSize = -1;
        while (!pending.isEmpty()) {
            if (pending.size() == prevPendingSize) {
                String unresolved = pending.stream()
                        .map(WorkflowDefinition.NodeDef::getName)
                        .collect(Collectors.joining(", "));
                // dependsOn cycle: register the rest through edges so validation names it.
                log.debug("dependsOn does not resolve for {}; deferring to edges", unresolved);
                for (WorkflowDefinition.NodeDef nd : pending)
                    g.register(create(nd), Set.of());
                for (WorkflowDefinition.NodeDef nd : pending)
                    for (String dep : deps(nd))
                        g.addEdge(dep, nd.getName());
                break;
            }
            prevPendingSize = pending.size();

            Iterator<WorkflowDefinition.NodeDef> iter = pending.iterator();
            while (iter.hasNext()) {
                WorkflowDefinition.NodeDef nd = iter.next();
                boolean ready = true;
                for (String dep : deps(nd)) {
                    if (!g.isRegistered(dep)) {
                        ready = false;
                        break;
                    }
                }
                if (!ready)
                    continue;
                g.register(create(nd), new LinkedHashSet<>(deps(nd)));
                iter.remove();
            }
        }

        if (info.getEdges() != null) {
            for (WorkflowDefinition.EdgeDef e : info.getEdges())
                g.addEdge(e.getFrom(), terminal(e.getTo()));
        }
        if (info.getEntry() != null)
            g.setEntry(info.getEntry());

        WorkflowGraph graph = g.build();
        EngineConfig config = toConfig(options);
        log.info("Compiled workflow '{}' with {} nodes", graph.name(), graph.nodeCount());
        return new CompiledWorkflow(graph, config);
    }

    private Node create(WorkflowDefinition.NodeDef nd) {
        Map<String, Object> props = nd.getProperties() != null ? nd.getProperties() : Collections.emptyMap();
        Node node = catalog.factory(nd.getType()).create(nd.getName(), props);
        if (!node.name().equals(nd.getName()))
            throw new IllegalArgumentException("Factory for type " + nd.getType() + " returned node '"
                    + node.name() + "', expected '" + nd.getName() + "'");
        if (nd.getProduces() == null || nd.getProduces().isEmpty())
            return node;
        String[] produces = nd.getProduces().toArray(String[]::new);
        if (node instanceof FunctionNode fn)
            return fn.produces(produces);
        return FunctionNode.of(node.name(), node::execute).produces(node.outputs().toArray(String[]::new))
                .produces(produces);
    }

    private static List<String> deps(WorkflowDefinition.NodeDef nd) {
        return nd.getDependsOn() != null ? nd.getDependsOn() : List.of();
    }

    private static String terminal(String to) {
        return "END".equals(to) ? WorkflowGraph.END : to;
    }

    static EngineConfig toConfig(WorkflowDefinition.Options options) {
        EngineConfig.EngineConfigBuilder b = EngineConfig.defaults().toBuilder();
        if (options != null) {
            if (options.getMaxConcurrency() != null)
                b.maxConcurrency(options.getMaxConcurrency());
            if (options.getTimeoutMillis() != null)
                b.runTimeout(Duration.ofMillis(options.getTimeoutMillis()));
        }
        return b.build().validate();
    }
}
