package com.trading.flow.util;

import com.trading.flow.api.WorkflowListener;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Aggregates duration statistics per node to identify bottlenecks. */
public class NodeProfileListener implements WorkflowListener {

    public static class NodeStats {
        public final String name;
        private long count;
        private long failures;
        private long totalDurationNanos;
        private long minDurationNanos = Long.MAX_VALUE;
        private long maxDurationNanos = Long.MIN_VALUE;
        private long lastDurationNanos;

        public NodeStats(String name) {
            this.name = name;
        }

        synchronized void update(long duration) {
            count++;
            totalDurationNanos += duration;
            lastDurationNanos = duration;
            if (duration < minDurationNanos)
                minDurationNanos = duration;
            if (duration > maxDurationNanos)
                maxDurationNanos = duration;
        }

        synchronized void fail() {
            failures++;
        }

        public synchronized long count() {
            return count;
        }

        public synchronized long failures() {
            return failures;
        }

        public synchronized long lastDurationNanos() {
            return lastDurationNanos;
        }

        public synchronized double avgMillis() {
            return count == 0 ? 0 : totalDurationNanos / (double) count / 1_000_000.0;
        }

        public synchronized double maxMillis() {
            return count == 0 ? 0 : maxDurationNanos / 1_000_000.0;
        }

        public synchronized double minMillis() {
            return count == 0 ? 0 : minDurationNanos / 1_000_000.0;
        }
    }

    private final ConcurrentHashMap<String, NodeStats> stats = new ConcurrentHashMap<>();

    public NodeStats stats(String nodeName) {
        return stats.get(nodeName);
    }

    /** Stats sorted by average duration, slowest first. */
    public List<NodeStats> slowestFirst() {
        List<NodeStats> all = new ArrayList<>(stats.values());
        all.sort(Comparator.comparingDouble(NodeStats::avgMillis).reversed());
        return all;
    }

    @Override
    public void onNodeCompleted(long runId, String nodeName, long durationNanos, Set<String> fieldsWritten) {
        stats.computeIfAbsent(nodeName, NodeStats::new).update(durationNanos);
    }

    @Override
    public void onNodeFailed(long runId, String nodeName, Throwable error) {
        stats.computeIfAbsent(nodeName, NodeStats::new).fail();
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-24s | %8s | %8s | %10s | %10s | %10s%n", "Node", "Count", "Failed", "Avg (ms)",
                "Min (ms)", "Max (ms)"));
        sb.append("----------------------------------------------------------------------------------------\n");
        for (NodeStats s : slowestFirst())
            sb.append(String.format("%-24s | %8d | %8d | %10.3f | %10.3f | %10.3f%n", s.name, s.count(),
                    s.failures(), s.avgMillis(), s.minMillis(), s.maxMillis()));
        return sb.toString();
    }

    public void reset() {
        stats.clear();
    }
}
