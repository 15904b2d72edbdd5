package com.trading.flow.util;

import com.trading.flow.api.RunStatus;
import com.trading.flow.api.WorkflowListener;

import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Logs run progress through Log4j2.
 *
 * Run boundaries at INFO, node progress at DEBUG, failures at ERROR with at
 * most one line per node per second.
 */
@Log4j2
public final class LoggingWorkflowListener implements WorkflowListener {
    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);

    @Override
    public void onRunStart(long runId, String graphName) {
        log.info("[run {}] starting '{}'", runId, graphName);
    }

    @Override
    public void onNodeStarted(long runId, String nodeName) {
        log.debug("[run {}] {} started", runId, nodeName);
    }

    @Override
    public void onNodeCompleted(long runId, String nodeName, long durationNanos, Set<String> fieldsWritten) {
        log.debug("[run {}] {} completed in {} us, wrote {}", runId, nodeName, durationNanos / 1000, fieldsWritten);
    }

    @Override
    public void onNodeFailed(long runId, String nodeName, Throwable error) {
        errLimiter.log(nodeName, String.format("[run %d] Workflow failure at node '%s': %s", runId, nodeName,
                error.getMessage()), error);
    }

    @Override
    public void onRunEnd(long runId, RunStatus status, int completedNodes) {
        if (status == RunStatus.SUCCEEDED)
            log.info("[run {}] succeeded, {} nodes completed", runId, completedNodes);
        else
            log.warn("[run {}] {} after {} nodes completed", runId, status, completedNodes);
    }
}
