package com.example.flowcompiler.session;

import com.example.flowcompiler.compiler.CompiledWorkflow;
import com.example.flowcompiler.compiler.WorkflowCompiler;
import com.example.flowcompiler.graph.BranchTag;
import com.example.flowcompiler.graph.GraphEdge;
import com.example.flowcompiler.graph.GraphNode;
import com.example.flowcompiler.graph.GraphSnapshot;
import com.example.flowcompiler.graph.NodePayload;
import com.example.flowcompiler.graph.Position;
import com.example.flowcompiler.graph.WorkflowGraph;

import lombok.extern.slf4j.Slf4j;

import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Holds one editable graph and republishes its compiled form after each burst of edits.
 * <p>
 * Every successful mutation cancels the pending compile and schedules a new one after the debounce
 * window (cancel-and-replace). When the window elapses the graph as it is then is compiled and
 * handed to every subscriber. Mutations and snapshotting are serialized on this session's monitor;
 * compilation runs on an immutable snapshot outside it. A result is published, under the monitor,
 * only if no edit happened since its snapshot was taken, so a slow compile never overwrites a newer one.
 * </p>
 */
@Slf4j
public class LiveCompilationSession {

    private final UUID id;
    private final WorkflowGraph graph;
    private final WorkflowCompiler compiler;
    private final TaskScheduler scheduler;
    private final Duration debounce;
    private final List<Consumer<CompiledWorkflow>> subscribers = new CopyOnWriteArrayList<>();

    private ScheduledFuture<?> pending;
    private long generation;
    private boolean closed;
    private volatile CompiledWorkflow latest;
    private volatile Instant lastAccess;

    public LiveCompilationSession(UUID id, WorkflowGraph graph, WorkflowCompiler compiler,
                                  TaskScheduler scheduler, Duration debounce) {
        this.id = Objects.requireNonNull(id, "id");
        this.graph = Objects.requireNonNull(graph, "graph");
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.debounce = Objects.requireNonNull(debounce, "debounce");
        this.lastAccess = scheduler.getClock().instant();
    }

    public UUID getId() {
        return id;
    }

    public synchronized void addNode(GraphNode node) {
        ensureOpen();
        graph.addNode(node);
        scheduleCompile();
    }

    /**
     * Adds a node, generating an id of the form {@code node-N} when none is given.
     */
    public synchronized GraphNode addNode(String nodeId, String label, NodePayload payload, Position position) {
        ensureOpen();
        String id = nodeId != null && !nodeId.isBlank() ? nodeId : graph.nextNodeId();
        GraphNode node = new GraphNode(id, label, payload, position);
        graph.addNode(node);
        scheduleCompile();
        return node;
    }

    public synchronized GraphNode appendNode(NodePayload payload, String label) {
        ensureOpen();
        GraphNode node = graph.appendNode(payload, label);
        scheduleCompile();
        return node;
    }

    /** Removes the node and all its edges in one step, before any compile can observe the graph. */
    public synchronized GraphNode removeNode(String nodeId) {
        ensureOpen();
        GraphNode removed = graph.removeNode(nodeId);
        scheduleCompile();
        return removed;
    }

    public synchronized GraphNode updatePayload(String nodeId, NodePayload payload) {
        ensureOpen();
        GraphNode updated = graph.updatePayload(nodeId, payload);
        scheduleCompile();
        return updated;
    }

    /**
     * Applies a change to one node, e.g. a new label, position or payload. Id and kind must be kept.
     */
    public synchronized GraphNode updateNode(String nodeId, UnaryOperator<GraphNode> change) {
        ensureOpen();
        GraphNode current = graph.node(nodeId)
                .orElseThrow(() -> new IllegalArgumentException("Node does not exist: " + nodeId));
        GraphNode changed = change.apply(current);
        if (!nodeId.equals(changed.id())) {
            throw new IllegalArgumentException("Cannot change node id " + nodeId + " to " + changed.id());
        }
        GraphNode updated = graph.replaceNode(changed);
        scheduleCompile();
        return updated;
    }

    public synchronized GraphEdge connect(String source, String target, BranchTag branch) {
        ensureOpen();
        GraphEdge edge = graph.connect(source, target, branch);
        scheduleCompile();
        return edge;
    }

    public synchronized GraphEdge addEdge(GraphEdge edge) {
        ensureOpen();
        GraphEdge added = graph.addEdge(edge);
        scheduleCompile();
        return added;
    }

    public synchronized GraphEdge reconnect(String edgeId, String source, String target) {
        ensureOpen();
        GraphEdge edge = graph.reconnect(edgeId, source, target);
        scheduleCompile();
        return edge;
    }

    public synchronized GraphEdge removeEdge(String edgeId) {
        ensureOpen();
        GraphEdge removed = graph.removeEdge(edgeId);
        scheduleCompile();
        return removed;
    }

    public synchronized GraphSnapshot snapshot() {
        return graph.snapshot();
    }

    /**
     * Registers a subscriber for compiled results. Returns a handle that unsubscribes it.
     */
    public Runnable subscribe(Consumer<CompiledWorkflow> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    /** Last published result, empty until the first compile has run. */
    public Optional<CompiledWorkflow> latest() {
        return Optional.ofNullable(latest);
    }

    public synchronized boolean hasPendingCompile() {
        return pending != null;
    }

    /**
     * Cancels any pending compile and compiles the current graph right away. The result is always
     * returned; it is only published if no edit happened while it was being compiled.
     */
    public CompiledWorkflow flush() {
        GraphSnapshot snapshot;
        long flushGeneration;
        synchronized (this) {
            ensureOpen();
            cancelPending();
            flushGeneration = ++generation;
            snapshot = graph.snapshot();
        }
        return compileAndPublish(snapshot, flushGeneration);
    }

    /** Marks the session as used at the given instant; idle eviction reads it. */
    public void touch(Instant now) {
        lastAccess = now;
    }

    public Instant lastAccess() {
        return lastAccess;
    }

    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        cancelPending();
        subscribers.clear();
        log.info("Closed editing session id={}", id);
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    private void scheduleCompile() {
        cancelPending();
        long scheduledGeneration = ++generation;
        pending = scheduler.schedule(() -> fire(scheduledGeneration), scheduler.getClock().instant().plus(debounce));
    }

    private void cancelPending() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    private void fire(long scheduledGeneration) {
        GraphSnapshot snapshot;
        synchronized (this) {
            if (closed || scheduledGeneration != generation) {
                return;
            }
            pending = null;
            snapshot = graph.snapshot();
        }
        compileAndPublish(snapshot, scheduledGeneration);
    }

    private CompiledWorkflow compileAndPublish(GraphSnapshot snapshot, long snapshotGeneration) {
        CompiledWorkflow compiled = compiler.compile(snapshot);
        synchronized (this) {
            if (closed || snapshotGeneration != generation) {
                log.debug("Dropping stale compile of session id={} generation={} current={}",
                        id, snapshotGeneration, generation);
                return compiled;
            }
            latest = compiled;
            log.debug("Publishing session id={} instructions={} subscribers={}",
                    id, compiled.program().size(), subscribers.size());
            for (Consumer<CompiledWorkflow> subscriber : subscribers) {
                try {
                    subscriber.accept(compiled);
                } catch (RuntimeException e) {
                    log.warn("Subscriber failed for session id={}: {}", id, e.getMessage(), e);
                }
            }
        }
        return compiled;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Editing session is closed: " + id);
        }
    }
}
