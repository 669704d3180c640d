package com.example.flowcompiler.session;

import com.example.flowcompiler.api.SessionNotFoundException;
import com.example.flowcompiler.compiler.CompiledWorkflow;
import com.example.flowcompiler.compiler.Instruction;
import com.example.flowcompiler.compiler.Program;
import com.example.flowcompiler.compiler.TriggerDescriptor;
import com.example.flowcompiler.compiler.WorkflowCompiler;
import com.example.flowcompiler.compiler.WorkflowDecompiler;
import com.example.flowcompiler.graph.ActionPayload;
import com.example.flowcompiler.graph.GraphNode;
import com.example.flowcompiler.graph.TriggerPayload;
import com.example.flowcompiler.validation.ValidationError;
import com.example.flowcompiler.validation.WorkflowValidationException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EditingSessionService")
class EditingSessionServiceTest {

    private final ManualTaskScheduler scheduler = new ManualTaskScheduler();
    private final EditingSessionService service = new EditingSessionService(
            new WorkflowCompiler(), new WorkflowDecompiler(), scheduler, Duration.ofMillis(100),
            Duration.ofMinutes(30), Duration.ofMinutes(1));

    @Test
    @DisplayName("opens a session on the default trigger graph")
    void opensDefaultSession() {
        LiveCompilationSession session = service.open();

        assertThat(service.get(session.getId())).isSameAs(session);
        assertThat(session.snapshot().nodes()).extracting(GraphNode::id).containsExactly("trigger-0");
    }

    @Test
    @DisplayName("opens a session seeded from a stored workflow")
    void opensSeededSession() {
        CompiledWorkflow stored = new CompiledWorkflow(
                new TriggerDescriptor("manual", Map.of()),
                new Program(List.of(Instruction.action("send_email", Map.of()), Instruction.delay(Map.of()))));

        LiveCompilationSession session = service.open(stored);

        assertThat(session.snapshot().nodes()).hasSize(3);
        assertThat(session.flush()).isEqualTo(stored);
    }

    @Test
    @DisplayName("unknown ids raise SessionNotFoundException")
    void unknownSession() {
        UUID id = UUID.randomUUID();

        assertThatThrownBy(() -> service.get(id)).isInstanceOf(SessionNotFoundException.class);
        assertThatThrownBy(() -> service.close(id)).isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    @DisplayName("submit reports every validation problem of the default graph")
    void submitValidates() {
        LiveCompilationSession session = service.open();

        assertThatThrownBy(() -> service.submit(session.getId()))
                .isInstanceOfSatisfying(WorkflowValidationException.class, ex -> assertThat(ex.getErrors())
                        .extracting(ValidationError::field)
                        .containsExactly("trigger_config.event_types"));
    }

    @Test
    @DisplayName("submit returns the compiled workflow once the trigger is configured")
    void submitSucceeds() {
        LiveCompilationSession session = service.open();
        session.updatePayload("trigger-0", new TriggerPayload("event",
                Map.of("event_types", List.of("contact.created"))));
        session.appendNode(new ActionPayload("send_email", Map.of()), null);

        CompiledWorkflow compiled = service.submit(session.getId());

        assertThat(compiled.trigger().triggerType()).isEqualTo("event");
        assertThat(compiled.program().size()).isEqualTo(1);
        assertThat(scheduler.pendingCount()).isZero();
    }

    @Test
    @DisplayName("close removes the session and closeAll closes the rest")
    void closeSessions() {
        LiveCompilationSession first = service.open();
        LiveCompilationSession second = service.open();

        service.close(first.getId());
        assertThat(first.isClosed()).isTrue();
        assertThat(service.openSessionCount()).isEqualTo(1);

        service.closeAll();
        assertThat(second.isClosed()).isTrue();
        assertThat(service.openSessionCount()).isZero();
    }

    @Test
    @DisplayName("the idle sweep closes and forgets sessions nobody has used within the timeout")
    void idleSweepEvictsAbandonedSessions() {
        service.startIdleSweep();
        LiveCompilationSession abandoned = service.open();
        abandoned.appendNode(new ActionPayload("send_email", Map.of()), null);

        scheduler.advance(Duration.ofMinutes(31));
        scheduler.runDueTasks();

        assertThat(abandoned.isClosed()).isTrue();
        assertThat(service.openSessionCount()).isZero();
        assertThat(scheduler.pendingCount()).isZero();
        assertThatThrownBy(() -> service.get(abandoned.getId())).isInstanceOf(SessionNotFoundException.class);
        assertThat(scheduler.periodicCount()).isEqualTo(1);

        service.closeAll();
        assertThat(scheduler.periodicCount()).isZero();
    }

    @Test
    @DisplayName("looking a session up keeps it alive")
    void lookupRefreshesIdleTimer() {
        LiveCompilationSession active = service.open();
        LiveCompilationSession idle = service.open();

        scheduler.advance(Duration.ofMinutes(20));
        service.get(active.getId());
        scheduler.advance(Duration.ofMinutes(20));

        assertThat(service.evictIdleSessions()).isEqualTo(1);
        assertThat(idle.isClosed()).isTrue();
        assertThat(active.isClosed()).isFalse();
        assertThat(service.get(active.getId())).isSameAs(active);
    }
}
