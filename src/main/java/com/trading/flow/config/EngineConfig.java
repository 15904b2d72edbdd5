package com.trading.flow.config;

import java.time.Duration;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Tuning knobs of a {@link com.trading.flow.engine.WorkflowEngine}.
 *
 * None of these affect correctness: a run produces the same final state
 * with any concurrency cap or ring size.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public final class EngineConfig {

    /** Max nodes in flight per run; 0 means unbounded. */
    @Builder.Default
    private final int maxConcurrency = 0;

    /** {@code run} cancels a run exceeding this; zero means wait forever. */
    @Builder.Default
    private final Duration runTimeout = Duration.ZERO;

    /** Slots of the per-run completion ring. Must be a power of two. */
    @Builder.Default
    private final int ringBufferSize = 1024;

    /** Size of the engine-owned worker pool; 0 means one thread per running node. */
    @Builder.Default
    private final int workerThreads = 0;

    @Builder.Default
    private final String threadNamePrefix = "flow-worker";

    public static EngineConfig defaults() {
        return builder().build();
    }

    public boolean hasTimeout() {
        return runTimeout != null && !runTimeout.isZero() && !runTimeout.isNegative();
    }

    /** @throws IllegalArgumentException on an unusable combination. */
    public EngineConfig validate() {
        if (maxConcurrency < 0)
            throw new IllegalArgumentException("maxConcurrency must be >= 0, got " + maxConcurrency);
        if (workerThreads < 0)
            throw new IllegalArgumentException("workerThreads must be >= 0, got " + workerThreads);
        if (ringBufferSize < 1 || Integer.bitCount(ringBufferSize) != 1)
            throw new IllegalArgumentException("ringBufferSize must be a power of 2, got " + ringBufferSize);
        return this;
    }
}
