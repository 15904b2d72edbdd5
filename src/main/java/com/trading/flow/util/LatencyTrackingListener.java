package com.trading.flow.util;

import com.trading.flow.api.RunStatus;
import com.trading.flow.api.WorkflowListener;

import java.util.concurrent.ConcurrentHashMap;

/**
 * A listener that tracks end-to-end run latency.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Latency:</b> Min, Max, Average wall time per run.</li>
 * <li><b>Throughput:</b> Total runs, split by outcome.</li>
 * <li><b>Workload:</b> Nodes completed by the last run.</li>
 * </ul>
 *
 * <p>
 * Safe to share between concurrent runs.
 */
public final class LatencyTrackingListener implements WorkflowListener {
    private final ConcurrentHashMap<Long, Long> runStartNanos = new ConcurrentHashMap<>();

    private long lastLatencyNanos;
    private long totalRuns, failedRuns, cancelledRuns, totalLatencyNanos;
    private long minLatencyNanos = Long.MAX_VALUE, maxLatencyNanos = Long.MIN_VALUE;
    private int lastNodesCompleted;

    @Override
    public void onRunStart(long runId, String graphName) {
        runStartNanos.put(runId, System.nanoTime());
    }

    @Override
    public void onRunEnd(long runId, RunStatus status, int completedNodes) {
        Long start = runStartNanos.remove(runId);
        if (start == null)
            return;
        record(System.nanoTime() - start, status, completedNodes);
    }

    private synchronized void record(long latency, RunStatus status, int completedNodes) {
        lastLatencyNanos = latency;
        lastNodesCompleted = completedNodes;
        totalRuns++;
        if (status == RunStatus.FAILED)
            failedRuns++;
        else if (status == RunStatus.CANCELLED)
            cancelledRuns++;
        totalLatencyNanos += latency;
        if (latency < minLatencyNanos)
            minLatencyNanos = latency;
        if (latency > maxLatencyNanos)
            maxLatencyNanos = latency;
    }

    public synchronized long lastLatencyNanos() {
        return lastLatencyNanos;
    }

    public synchronized int lastNodesCompleted() {
        return lastNodesCompleted;
    }

    public synchronized long totalRuns() {
        return totalRuns;
    }

    public synchronized long failedRuns() {
        return failedRuns;
    }

    public synchronized long cancelledRuns() {
        return cancelledRuns;
    }

    public synchronized double avgLatencyMillis() {
        return totalRuns > 0 ? (double) totalLatencyNanos / totalRuns / 1_000_000.0 : 0;
    }

    public synchronized long minLatencyNanos() {
        return minLatencyNanos == Long.MAX_VALUE ? 0 : minLatencyNanos;
    }

    public synchronized long maxLatencyNanos() {
        return maxLatencyNanos == Long.MIN_VALUE ? 0 : maxLatencyNanos;
    }

    public synchronized void reset() {
        totalRuns = 0;
        failedRuns = 0;
        cancelledRuns = 0;
        totalLatencyNanos = 0;
        minLatencyNanos = Long.MAX_VALUE;
        maxLatencyNanos = Long.MIN_VALUE;
    }

    public synchronized String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-12s | %8s | %8s | %10s | %10s | %10s%n", "Metric", "Runs", "Failed",
                "Avg (ms)", "Min (ms)", "Max (ms)"));
        sb.append("--------------------------------------------------------------------------\n");
        sb.append(String.format("%-12s | %8d | %8d | %10.2f | %10.2f | %10.2f%n",
                "Runs",
                totalRuns,
                failedRuns,
                avgLatencyMillis(),
                minLatencyNanos() / 1_000_000.0,
                maxLatencyNanos() / 1_000_000.0));
        return sb.toString();
    }
}
