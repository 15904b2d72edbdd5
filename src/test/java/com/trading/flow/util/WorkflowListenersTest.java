package com.trading.flow.util;

import com.trading.flow.dsl.GraphBuilder;
import com.trading.flow.engine.WorkflowEngine;
import com.trading.flow.engine.WorkflowGraph;
import com.trading.flow.error.WorkflowException;
import com.trading.flow.state.StateDelta;
import org.apache.logging.log4j.LogManager;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class WorkflowListenersTest {

    private static WorkflowGraph graph(boolean failB) {
        return GraphBuilder.create("profiled")
                .register("A", s -> StateDelta.of("a", 1))
                .register("B", s -> {
                    if (failB)
                        throw new IllegalStateException("B failed");
                    return StateDelta.of("b", 2);
                }, "A")
                .addEdgeToEnd("B")
                .setEntry("A")
                .build();
    }

    @Test
    public void testProfileAndLatencyAcrossRuns() {
        NodeProfileListener profile = new NodeProfileListener();
        LatencyTrackingListener latency = new LatencyTrackingListener();
        CompositeWorkflowListener composite = new CompositeWorkflowListener(new LoggingWorkflowListener(), profile)
                .add(latency);
        assertEquals(3, composite.size());

        try (WorkflowEngine engine = new WorkflowEngine()) {
            engine.setListener(composite);
            engine.run(graph(false), Map.of());
            engine.run(graph(false), Map.of());
            try {
                engine.run(graph(true), Map.of());
                fail("Expected WorkflowException");
            } catch (WorkflowException expected) {
                assertEquals("B", expected.failedNode());
            }
        }

        assertEquals(3, profile.stats("A").count());
        assertEquals(2, profile.stats("B").count());
        assertEquals(1, profile.stats("B").failures());
        assertEquals(2, profile.slowestFirst().size());
        assertTrue(profile.dump().contains("A"));

        assertEquals(3, latency.totalRuns());
        assertEquals(1, latency.failedRuns());
        assertEquals(1, latency.lastNodesCompleted());
        assertTrue(latency.maxLatencyNanos() >= latency.minLatencyNanos());
        assertTrue(latency.dump().contains("Runs"));
    }

    @Test
    public void testErrorRateLimiterThrottlesPerKey() {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(WorkflowListenersTest.class), 60_000);
        RuntimeException err = new RuntimeException("expected in test");

        assertTrue(limiter.log("node-a", "first", err));
        assertFalse(limiter.log("node-a", "second", err));
        assertTrue(limiter.log("node-b", "other key", err));
    }
}
