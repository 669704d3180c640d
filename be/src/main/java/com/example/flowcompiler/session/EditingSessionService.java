package com.example.flowcompiler.session;

import com.example.flowcompiler.api.SessionNotFoundException;
import com.example.flowcompiler.compiler.CompiledWorkflow;
import com.example.flowcompiler.compiler.WorkflowCompiler;
import com.example.flowcompiler.compiler.WorkflowDecompiler;
import com.example.flowcompiler.graph.WorkflowGraph;
import com.example.flowcompiler.validation.WorkflowSubmissionValidator;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

import lombok.extern.slf4j.Slf4j;

import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Opens, looks up and closes live compilation sessions.
 * <p>
 * New sessions start from the default trigger graph, or from a stored workflow pushed through the
 * {@link WorkflowDecompiler}. Submission flushes the session and runs the hosting form's checks.
 * Sessions not looked up for longer than the idle timeout are closed by a periodic sweep on the
 * compile scheduler.
 * </p>
 */
@Slf4j
public class EditingSessionService {

    private final WorkflowCompiler compiler;
    private final WorkflowDecompiler decompiler;
    private final TaskScheduler scheduler;
    private final Duration debounce;
    private final Duration idleTimeout;
    private final Duration sweepInterval;
    private final Map<UUID, LiveCompilationSession> sessions = new ConcurrentHashMap<>();

    private volatile ScheduledFuture<?> idleSweep;

    public EditingSessionService(WorkflowCompiler compiler, WorkflowDecompiler decompiler,
                                 TaskScheduler scheduler, Duration debounce,
                                 Duration idleTimeout, Duration sweepInterval) {
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.decompiler = Objects.requireNonNull(decompiler, "decompiler");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.debounce = Objects.requireNonNull(debounce, "debounce");
        this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout");
        this.sweepInterval = Objects.requireNonNull(sweepInterval, "sweepInterval");
    }

    @PostConstruct
    public void startIdleSweep() {
        if (idleSweep == null) {
            idleSweep = scheduler.scheduleWithFixedDelay(this::evictIdleSessions, sweepInterval);
            log.info("Idle session sweep every {} with timeout {}", sweepInterval, idleTimeout);
        }
    }

    public LiveCompilationSession open() {
        return register(WorkflowGraph.withDefaultTrigger());
    }

    public LiveCompilationSession open(CompiledWorkflow stored) {
        return register(decompiler.decompile(stored));
    }

    public LiveCompilationSession get(UUID sessionId) {
        LiveCompilationSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        session.touch(now());
        return session;
    }

    /**
     * Compiles the session's current graph and validates it for saving.
     *
     * @throws com.example.flowcompiler.validation.WorkflowValidationException if the workflow cannot be saved
     */
    public CompiledWorkflow submit(UUID sessionId) {
        CompiledWorkflow compiled = get(sessionId).flush();
        WorkflowSubmissionValidator.validate(compiled);
        log.info("Session id={} submitted triggerType={} instructions={}",
                sessionId, compiled.trigger().triggerType(), compiled.program().size());
        return compiled;
    }

    public void close(UUID sessionId) {
        LiveCompilationSession session = sessions.remove(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        session.close();
    }

    public int openSessionCount() {
        return sessions.size();
    }

    /**
     * Closes and forgets every session whose last access is older than the idle timeout.
     *
     * @return the number of sessions evicted
     */
    public int evictIdleSessions() {
        Instant cutoff = now().minus(idleTimeout);
        int evicted = 0;
        for (Map.Entry<UUID, LiveCompilationSession> entry : sessions.entrySet()) {
            LiveCompilationSession session = entry.getValue();
            if (session.lastAccess().isBefore(cutoff) && sessions.remove(entry.getKey(), session)) {
                session.close();
                evicted++;
                log.info("Evicted idle editing session id={} lastAccess={}", entry.getKey(), session.lastAccess());
            }
        }
        return evicted;
    }

    @PreDestroy
    public void closeAll() {
        ScheduledFuture<?> sweep = idleSweep;
        if (sweep != null) {
            sweep.cancel(false);
            idleSweep = null;
        }
        sessions.values().forEach(LiveCompilationSession::close);
        sessions.clear();
    }

    private LiveCompilationSession register(WorkflowGraph graph) {
        LiveCompilationSession session = new LiveCompilationSession(UUID.randomUUID(), graph, compiler, scheduler, debounce);
        session.touch(now());
        sessions.put(session.getId(), session);
        log.info("Opened editing session id={} nodes={} debounce={}", session.getId(), graph.nodes().size(), debounce);
        return session;
    }

    private Instant now() {
        return scheduler.getClock().instant();
    }
}
