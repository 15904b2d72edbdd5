package com.trading.flow.engine;

import com.trading.flow.api.WorkflowListener;
import com.trading.flow.config.EngineConfig;
import com.trading.flow.state.StateSchema;
import com.trading.flow.state.StateStore;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The scheduler/executor: drives validated {@link WorkflowGraph}s to
 * completion.
 *
 * The engine itself holds no per-run state. Each call to {@link #submit}
 * creates a fresh {@link StateStore} and a {@link WorkflowRun} that owns the
 * scheduling of that run; the graph is only read. Any number of runs, of the
 * same graph or of different graphs, may execute concurrently on one engine.
 *
 * Node bodies execute on a worker pool, either supplied by the caller or
 * created from {@link EngineConfig}. An engine-owned pool is shut down by
 * {@link #close()}.
 *
 * Typical use:
 *
 * <pre>
 * try (var engine = new WorkflowEngine()) {
 *     WorkflowResult result = engine.run(graph, Map.of("stock_symbol", "AAPL"));
 * }
 * </pre>
 */
public final class WorkflowEngine implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(WorkflowEngine.class);

    private final EngineConfig config;
    private final ExecutorService workers;
    private final boolean ownsWorkers;
    private final AtomicLong runIds = new AtomicLong();

    private volatile WorkflowListener listener;

    public WorkflowEngine() {
        this(EngineConfig.defaults());
    }

    public WorkflowEngine(EngineConfig config) {
        this(config.validate(), newWorkerPool(config), true);
    }

    /** Uses a caller-managed pool; {@link #close()} leaves it running. */
    public WorkflowEngine(EngineConfig config, ExecutorService workers) {
        this(config.validate(), workers, false);
    }

    private WorkflowEngine(EngineConfig config, ExecutorService workers, boolean ownsWorkers) {
        this.config = config;
        this.workers = workers;
        this.ownsWorkers = ownsWorkers;
    }

    private static ExecutorService newWorkerPool(EngineConfig config) {
        ThreadFactory factory = new WorkerThreadFactory(config.getThreadNamePrefix());
        return config.getWorkerThreads() > 0
                ? Executors.newFixedThreadPool(config.getWorkerThreads(), factory)
                : Executors.newCachedThreadPool(factory);
    }

    public void setListener(WorkflowListener listener) {
        this.listener = listener;
    }

    public EngineConfig config() {
        return config;
    }

    /**
     * Runs a graph to completion and returns its final state.
     *
     * Validates the graph first (once per graph); validation errors are thrown
     * before any node runs. If {@link EngineConfig#getRunTimeout()} is set, a
     * run exceeding it is cancelled.
     *
     * @param initialState seed fields visible to every node; null values are rejected.
     * @throws NullPointerException                            if a seed field is null.
     * @throws com.trading.flow.error.GraphValidationException if the graph is malformed.
     * @throws com.trading.flow.error.WorkflowException        if a node failed or the run was cancelled.
     */
    public WorkflowResult run(WorkflowGraph graph, Map<String, ?> initialState) {
        return run(graph, initialState, StateSchema.open());
    }

    public WorkflowResult run(WorkflowGraph graph, Map<String, ?> initialState, StateSchema schema) {
        WorkflowRun run = submit(graph, initialState, schema);
        if (config.hasTimeout())
            return run.await(config.getRunTimeout().toNanos(), TimeUnit.NANOSECONDS);
        return run.await();
    }

    /** Starts a run without waiting for it. */
    public WorkflowRun submit(WorkflowGraph graph, Map<String, ?> initialState) {
        return submit(graph, initialState, StateSchema.open());
    }

    /**
     * Starts a run whose state is checked against {@code schema}.
     *
     * @throws com.trading.flow.error.FieldTypeException if the initial state
     *         violates the schema.
     */
    public WorkflowRun submit(WorkflowGraph graph, Map<String, ?> initialState, StateSchema schema) {
        graph.topology();
        StateStore store = new StateStore(initialState, schema);
        long runId = runIds.incrementAndGet();
        log.debug("Submitting run {} of graph '{}' with seed fields {}", runId, graph.name(), initialState.keySet());
        return new WorkflowRun(runId, graph, store, listener, workers, config).start();
    }

    /**
     * Shuts down an engine-owned worker pool. Running nodes are left to finish.
     */
    @Override
    public void close() {
        if (ownsWorkers) {
            workers.shutdown();
            log.debug("Worker pool shut down");
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        WorkerThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
