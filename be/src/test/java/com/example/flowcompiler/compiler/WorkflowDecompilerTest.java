package com.example.flowcompiler.compiler;

import com.example.flowcompiler.graph.ActionPayload;
import com.example.flowcompiler.graph.BranchTag;
import com.example.flowcompiler.graph.ConditionPayload;
import com.example.flowcompiler.graph.DelayPayload;
import com.example.flowcompiler.graph.GraphEdge;
import com.example.flowcompiler.graph.GraphNode;
import com.example.flowcompiler.graph.GraphSnapshot;
import com.example.flowcompiler.graph.Position;
import com.example.flowcompiler.graph.TriggerPayload;
import com.example.flowcompiler.graph.WorkflowGraph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("WorkflowDecompiler")
class WorkflowDecompilerTest {

    private final WorkflowDecompiler decompiler = new WorkflowDecompiler();
    private final WorkflowCompiler compiler = new WorkflowCompiler();

    private static final TriggerDescriptor EVENT = new TriggerDescriptor("event", Map.of("event_types", List.of("task.completed")));

    @Nested
    @DisplayName("layout")
    class Layout {

        @Test
        @DisplayName("lays out trigger and steps in one column with chained edges")
        void columnLayout() {
            Program program = new Program(List.of(
                    Instruction.action("send_email", Map.of()),
                    Instruction.delay(Map.of("delay_value", 1, "delay_type", "days"))));

            WorkflowGraph graph = decompiler.decompile(EVENT, program);

            assertThat(graph.nodes()).extracting(GraphNode::id).containsExactly("trigger-0", "step-0", "step-1");
            assertThat(graph.nodes()).extracting(GraphNode::position).containsExactly(
                    new Position(250, 50), new Position(250, 200), new Position(250, 350));
            assertThat(graph.edges()).extracting(GraphEdge::id)
                    .containsExactly("edge-trigger-0-step-0", "edge-step-0-step-1");
        }

        @Test
        @DisplayName("labels nodes from their payloads")
        void labels() {
            Program program = new Program(List.of(
                    Instruction.action("send_email", Map.of()),
                    Instruction.condition(ConditionPayload.of("deal.stage", "not_equals", "won").config(), null),
                    Instruction.delay(DelayPayload.of(2, "hours").config()),
                    Instruction.action(null, Map.of())));

            WorkflowGraph graph = decompiler.decompile(EVENT, program);

            assertThat(graph.nodes()).extracting(GraphNode::label).containsExactly(
                    "Event Trigger", "Send Email", "If deal.stage not equals", "Wait 2 hours", "Action");
        }

        @Test
        @DisplayName("condition gets a true edge to the next step and a false edge to its branch target")
        void conditionEdges() {
            Program program = new Program(List.of(
                    Instruction.condition(Map.of(), 2),
                    Instruction.action("send_email", Map.of()),
                    Instruction.action("add_tag", Map.of())));

            WorkflowGraph graph = decompiler.decompile(EVENT, program);

            assertThat(graph.edge("edge-step-0-step-1-true").orElseThrow().branch()).isEqualTo(BranchTag.TRUE);
            assertThat(graph.edge("edge-step-0-step-2-false").orElseThrow().branch()).isEqualTo(BranchTag.FALSE);
        }

        @Test
        @DisplayName("out-of-range branch target is dropped")
        void outOfRangeTargetDropped() {
            Program program = new Program(List.of(Instruction.condition(Map.of(), 7)));

            WorkflowGraph graph = decompiler.decompile(EVENT, program);

            assertThat(graph.edges()).noneMatch(e -> e.branch() == BranchTag.FALSE);
        }

        @Test
        @DisplayName("absent descriptor gives a default-labelled trigger node")
        void absentTrigger() {
            WorkflowGraph graph = decompiler.decompile(null, null);

            assertThat(graph.nodes()).hasSize(1);
            assertEquals("Start Workflow", graph.nodes().get(0).label());
            assertThat(graph.edges()).isEmpty();
        }
    }

    @Nested
    @DisplayName("round trip")
    class RoundTrip {

        @Test
        @DisplayName("decompile then compile returns the same descriptor and program")
        void decompileCompile() {
            Program program = new Program(List.of(
                    Instruction.action("send_email", Map.of("to", "{{contact.email}}")),
                    Instruction.condition(Map.of("field", "contact.status", "operator", "equals", "value", "cold"), 4),
                    Instruction.delay(Map.of("delay_value", 2, "delay_type", "days")),
                    Instruction.condition(Map.of(), 0),
                    Instruction.action("loop", Map.of()),
                    Instruction.condition(Map.of(), 5)));
            CompiledWorkflow original = new CompiledWorkflow(EVENT, program);

            CompiledWorkflow again = compiler.compile(decompiler.decompile(original));

            assertEquals(original, again);
        }

        @Test
        @DisplayName("compile, decompile, compile is stable for an edited graph")
        void compileDecompileCompile() {
            GraphSnapshot graph = new GraphSnapshot(
                    List.of(
                            new GraphNode("t", "T", new TriggerPayload("schedule", Map.of("schedule_type", "daily")), null),
                            new GraphNode("c", "C", ConditionPayload.of("f", "equals", 1), null),
                            new GraphNode("a", "A", new ActionPayload("send_email", Map.of()), null),
                            new GraphNode("b", "B", new ActionPayload("add_tag", Map.of()), null),
                            new GraphNode("loose", "L", DelayPayload.of(5, "minutes"), null)),
                    List.of(
                            new GraphEdge("1", "t", "c"),
                            new GraphEdge("2", "c", "a", BranchTag.TRUE),
                            new GraphEdge("3", "c", "b", BranchTag.FALSE)));

            CompiledWorkflow first = compiler.compile(graph);
            CompiledWorkflow second = compiler.compile(decompiler.decompile(first));

            assertEquals(first, second);
        }
    }

    @Test
    @DisplayName("humanizes snake case action types")
    void humanize() {
        assertEquals("Send Email", WorkflowDecompiler.humanize("send_email"));
        assertEquals("Ai Generate", WorkflowDecompiler.humanize("ai_generate"));
    }
}
