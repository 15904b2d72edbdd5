package com.trading.flow.engine;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventTranslator;
import com.lmax.disruptor.EventTranslatorOneArg;
import com.lmax.disruptor.EventTranslatorThreeArg;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.trading.flow.api.Node;
import com.trading.flow.api.NodeStatus;
import com.trading.flow.api.RunStatus;
import com.trading.flow.api.WorkflowListener;
import com.trading.flow.config.EngineConfig;
import com.trading.flow.error.FieldTypeException;
import com.trading.flow.error.UndeclaredFieldException;
import com.trading.flow.error.WorkflowCancelledException;
import com.trading.flow.error.WorkflowException;
import com.trading.flow.state.StateDelta;
import com.trading.flow.state.StateSnapshot;
import com.trading.flow.state.StateStore;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * One execution of a {@link WorkflowGraph}, and the handle the caller waits on.
 *
 * <h3>Threading</h3>
 * Node bodies run on the engine's worker pool. Everything else (in-degree
 * countdown, node statuses, the ready set, merges) is owned by a single
 * consumer thread reading this run's LMAX Disruptor ring:
 * <ol>
 * <li>A worker finishes a node and publishes a COMPLETED or FAILED event.</li>
 * <li>The consumer merges the delta into the {@link StateStore} and counts
 * down the in-degree of the node's children. Children reaching zero become
 * READY.</li>
 * <li>At the end of each batch the consumer launches every READY node (up to
 * the concurrency cap), each with a snapshot scoped to its ancestors.</li>
 * <li>When nothing is ready or in flight the run completes.</li>
 * </ol>
 * Because one thread makes every scheduling decision, no scheduling state
 * needs a lock. The store is still internally synchronized.
 *
 * <h3>Failure</h3>
 * The first node failure stops all launches. In-flight nodes finish and their
 * deltas are merged, then the run fails with a {@link WorkflowException}
 * holding the partial state.
 *
 * <h3>Cancellation</h3>
 * {@link #cancel(String)} completes the run at once with a
 * {@link WorkflowCancelledException}. In-flight nodes are abandoned: the
 * consumer keeps draining their events and discards them.
 */
public final class WorkflowRun {
    private static final Logger log = LogManager.getLogger(WorkflowRun.class);

    private static final EventTranslator<CompletionEvent> START = (e, seq) -> e.setStart();
    private static final EventTranslatorThreeArg<CompletionEvent, Integer, StateDelta, Long> COMPLETED =
            (e, seq, ti, delta, nanos) -> e.setCompleted(ti, delta, nanos);
    private static final EventTranslatorThreeArg<CompletionEvent, Integer, Throwable, Long> FAILED =
            (e, seq, ti, error, nanos) -> e.setFailed(ti, error, nanos);
    private static final EventTranslatorOneArg<CompletionEvent, String> CANCEL =
            (e, seq, reason) -> e.setCancel(reason);

    private final long runId;
    private final WorkflowGraph graph;
    private final TopologicalOrder topology;
    private final StateStore store;
    private final WorkflowListener listener;
    private final Executor workers;
    private final int maxConcurrency;
    private final long startNanos = System.nanoTime();

    private final Disruptor<CompletionEvent> disruptor;
    private final RingBuffer<CompletionEvent> ringBuffer;
    private final CompletableFuture<WorkflowResult> future = new CompletableFuture<>();
    private final AtomicBoolean halted = new AtomicBoolean();

    // Consumer-thread state. Never touched by workers.
    private final int[] remaining;
    private final NodeStatus[] statuses;
    private final ArrayDeque<Integer> ready = new ArrayDeque<>();
    private int inFlight;
    private int completed;
    private Throwable failure;
    private String failedNode;
    private boolean cancelled;

    WorkflowRun(long runId, WorkflowGraph graph, StateStore store, WorkflowListener listener, Executor workers,
            EngineConfig config) {
        this.runId = runId;
        this.graph = graph;
        this.topology = graph.topology();
        this.store = store;
        this.listener = listener;
        this.workers = workers;
        this.maxConcurrency = config.getMaxConcurrency();

        int n = topology.nodeCount();
        this.remaining = new int[n];
        this.statuses = new NodeStatus[n];
        Arrays.fill(statuses, NodeStatus.PENDING);
        for (int ti = 0; ti < n; ti++)
            remaining[ti] = topology.parentCount(ti);

        this.disruptor = new Disruptor<>(
                CompletionEvent::new,
                config.getRingBufferSize(),
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        this.disruptor.handleEventsWith((event, sequence, endOfBatch) -> onEvent(event, endOfBatch));
        this.disruptor.setDefaultExceptionHandler(new RunExceptionHandler());
        this.ringBuffer = disruptor.getRingBuffer();
    }

    WorkflowRun start() {
        disruptor.start();
        ringBuffer.publishEvent(START);
        return this;
    }

    public long runId() {
        return runId;
    }

    public WorkflowGraph graph() {
        return graph;
    }

    public boolean isDone() {
        return future.isDone();
    }

    /** Completes with the result, or exceptionally with a {@link WorkflowException}. */
    public CompletableFuture<WorkflowResult> future() {
        return future;
    }

    /**
     * Blocks until the run finishes. Interrupting the caller cancels the run.
     *
     * @throws WorkflowException if a node failed or the run was cancelled.
     */
    public WorkflowResult await() {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel("caller interrupted");
            return join();
        } catch (ExecutionException e) {
            throw rethrow(e.getCause());
        }
    }

    /**
     * Blocks until the run finishes or the timeout elapses; on timeout the run
     * is cancelled.
     *
     * @throws WorkflowCancelledException on timeout.
     * @throws WorkflowException          if a node failed.
     */
    public WorkflowResult await(long timeout, TimeUnit unit) {
        try {
            return future.get(timeout, unit);
        } catch (TimeoutException e) {
            cancel("timed out after " + unit.toMillis(timeout) + " ms");
            return join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel("caller interrupted");
            return join();
        } catch (ExecutionException e) {
            throw rethrow(e.getCause());
        }
    }

    /** Stops launching nodes and completes the run with the state merged so far. */
    public void cancel() {
        cancel("cancelled by caller");
    }

    public void cancel(String reason) {
        if (!future.isDone() && !halted.get())
            ringBuffer.publishEvent(CANCEL, reason);
    }

    private WorkflowResult join() {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw rethrow(e.getCause());
        }
    }

    private static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof RuntimeException re)
            return re;
        return new IllegalStateException("Workflow run ended abnormally", cause);
    }

    // ── Consumer thread ──────────────────────────────────────────

    private void onEvent(CompletionEvent event, boolean endOfBatch) {
        try {
            switch (event.type()) {
                case START -> onStart();
                case COMPLETED -> onCompleted(event.nodeIndex(), event.delta(), event.durationNanos());
                case FAILED -> onFailed(event.nodeIndex(), event.error());
                case CANCEL -> onCancel(event.reason());
            }
        } finally {
            event.clear();
        }
        // Merge a whole burst of completions before launching anything new.
        if (endOfBatch)
            dispatch();
    }

    private void onStart() {
        notifyListener(l -> l.onRunStart(runId, graph.name()));
        int entry = topology.topoIndex(graph.entry());
        statuses[entry] = NodeStatus.READY;
        ready.add(entry);
        log.debug("Run {} of '{}' started, {} nodes", runId, graph.name(), topology.nodeCount());
    }

    private void onCompleted(int ti, StateDelta delta, long durationNanos) {
        inFlight--;
        String name = topology.node(ti).name();
        if (cancelled) {
            log.debug("Run {}: discarding result of '{}' after cancellation", runId, name);
            return;
        }
        try {
            store.merge(name, delta);
        } catch (FieldTypeException e) {
            statuses[ti] = NodeStatus.FAILED;
            recordFailure(name, e);
            return;
        }
        statuses[ti] = NodeStatus.COMPLETED;
        completed++;
        notifyListener(l -> l.onNodeCompleted(runId, name, durationNanos, delta.fieldNames()));

        final int start = topology.childrenStart(ti);
        final int end = topology.childrenEnd(ti);
        for (int ci = start; ci < end; ci++) {
            int child = topology.childAt(ci);
            if (--remaining[child] == 0) {
                statuses[child] = NodeStatus.READY;
                ready.add(child);
            }
        }
    }

    private void onFailed(int ti, Throwable error) {
        inFlight--;
        statuses[ti] = NodeStatus.FAILED;
        String name = topology.node(ti).name();
        if (cancelled) {
            log.debug("Run {}: node '{}' failed after cancellation", runId, name, error);
            return;
        }
        recordFailure(name, error);
    }

    private void recordFailure(String name, Throwable error) {
        notifyListener(l -> l.onNodeFailed(runId, name, error));
        if (failure == null) {
            failure = error;
            failedNode = name;
        } else if (failure != error) {
            failure.addSuppressed(error);
        }
    }

    private void onCancel(String reason) {
        if (cancelled || future.isDone())
            return;
        cancelled = true;
        ready.clear();
        log.debug("Run {} cancelled ({}), abandoning {} in-flight nodes", runId, reason, inFlight);
        var cancellation = new WorkflowCancelledException(runId, reason, store.snapshot(), statusMap());
        notifyListener(l -> l.onRunEnd(runId, RunStatus.CANCELLED, completed));
        future.completeExceptionally(cancellation);
    }

    private void dispatch() {
        if (cancelled) {
            if (inFlight == 0)
                halt();
            return;
        }
        if (failure == null) {
            while (!ready.isEmpty() && (maxConcurrency == 0 || inFlight < maxConcurrency))
                launch(ready.poll());
        }
        if (inFlight == 0 && (failure != null || ready.isEmpty()))
            finish();
    }

    private void launch(int ti) {
        Node node = topology.node(ti);
        StateSnapshot snapshot = store.snapshotOf(topology.ancestors(ti));
        statuses[ti] = NodeStatus.RUNNING;
        inFlight++;
        notifyListener(l -> l.onNodeStarted(runId, node.name()));
        try {
            workers.execute(() -> execute(ti, node, snapshot));
        } catch (RejectedExecutionException e) {
            onFailed(ti, e);
        }
    }

    private void finish() {
        if (future.isDone())
            return;
        if (failure != null) {
            log.debug("Run {} of '{}' failed at '{}'", runId, graph.name(), failedNode);
            var error = new WorkflowException(runId, failedNode, failure, store.snapshot(), statusMap());
            notifyListener(l -> l.onRunEnd(runId, RunStatus.FAILED, completed));
            future.completeExceptionally(error);
        } else {
            var result = new WorkflowResult(runId, graph.name(), store.snapshot(), statusMap(), completed,
                    System.nanoTime() - startNanos);
            log.debug("Run {} of '{}' completed {} nodes in {} ms", runId, graph.name(), completed,
                    result.elapsedMillis());
            notifyListener(l -> l.onRunEnd(runId, RunStatus.SUCCEEDED, completed));
            future.complete(result);
        }
        halt();
    }

    private void halt() {
        if (halted.compareAndSet(false, true))
            disruptor.halt();
    }

    private Map<String, NodeStatus> statusMap() {
        Map<String, NodeStatus> m = new LinkedHashMap<>();
        for (int ti = 0; ti < statuses.length; ti++)
            m.put(topology.node(ti).name(), statuses[ti]);
        return Collections.unmodifiableMap(m);
    }

    private void notifyListener(Consumer<WorkflowListener> call) {
        if (listener == null)
            return;
        try {
            call.accept(listener);
        } catch (RuntimeException e) {
            log.warn("Run {}: listener {} threw", runId, listener.getClass().getSimpleName(), e);
        }
    }

    // ── Worker thread ────────────────────────────────────────────

    private void execute(int ti, Node node, StateSnapshot snapshot) {
        long start = System.nanoTime();
        try {
            StateDelta delta = node.execute(snapshot);
            if (delta == null)
                throw new IllegalStateException("Node '" + node.name() + "' returned a null delta");
            checkOwnership(node, delta);
            ringBuffer.publishEvent(COMPLETED, ti, delta, System.nanoTime() - start);
        } catch (Throwable t) {
            ringBuffer.publishEvent(FAILED, ti, t, System.nanoTime() - start);
        }
    }

    private void checkOwnership(Node node, StateDelta delta) {
        if (!graph.enforcesFieldOwnership() || node.outputs().isEmpty())
            return;
        Set<String> undeclared = new TreeSet<>(delta.fieldNames());
        undeclared.removeAll(node.outputs());
        if (!undeclared.isEmpty())
            throw new UndeclaredFieldException(node.name(), undeclared, new TreeSet<>(node.outputs()));
    }

    /** Fails the run instead of killing the consumer thread on an engine bug. */
    private final class RunExceptionHandler implements ExceptionHandler<CompletionEvent> {
        @Override
        public void handleEventException(Throwable ex, long sequence, CompletionEvent event) {
            log.error("Run {}: scheduler error at sequence {}", runId, sequence, ex);
            if (future.completeExceptionally(new WorkflowException(runId, failedNode, ex, store.snapshot(),
                    statusMap())))
                notifyListener(l -> l.onRunEnd(runId, RunStatus.FAILED, completed));
            halt();
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Run {}: scheduler failed to start", runId, ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Run {}: scheduler failed to shut down", runId, ex);
        }
    }
}
