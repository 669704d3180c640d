package com.example.flowcompiler.compiler;

import com.example.flowcompiler.graph.ActionPayload;
import com.example.flowcompiler.graph.BranchTag;
import com.example.flowcompiler.graph.ConditionPayload;
import com.example.flowcompiler.graph.DelayPayload;
import com.example.flowcompiler.graph.GraphEdge;
import com.example.flowcompiler.graph.GraphNode;
import com.example.flowcompiler.graph.GraphSnapshot;
import com.example.flowcompiler.graph.TriggerPayload;
import com.example.flowcompiler.graph.WorkflowGraph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

@DisplayName("WorkflowCompiler")
class WorkflowCompilerTest {

    private final WorkflowCompiler compiler = new WorkflowCompiler();

    private static GraphNode trigger() {
        return new GraphNode("t", "Start", new TriggerPayload("event", Map.of("event_types", List.of("contact.created"))), null);
    }

    private static GraphNode action(String id, String actionType) {
        return new GraphNode(id, id, new ActionPayload(actionType, Map.of("key", id)), null);
    }

    private static GraphNode condition(String id) {
        return new GraphNode(id, id, ConditionPayload.of("deal.amount", "greater_than", 1000), null);
    }

    @Nested
    @DisplayName("linear graphs")
    class Linear {

        @Test
        @DisplayName("trigger only compiles to an empty program with the trigger copied into the descriptor")
        void triggerOnly() {
            CompiledWorkflow compiled = compiler.compile(new GraphSnapshot(List.of(trigger()), List.of()));

            assertThat(compiled.program().isEmpty()).isTrue();
            assertEquals("event", compiled.trigger().triggerType());
            assertEquals(List.of("contact.created"), compiled.trigger().config().get("event_types"));
        }

        @Test
        @DisplayName("trigger -> A -> B -> C compiles to [A, B, C] without branch targets")
        void chain() {
            GraphSnapshot graph = new GraphSnapshot(
                    List.of(action("c", "add_tag"), trigger(), action("b", "send_slack"), action("a", "send_email")),
                    List.of(new GraphEdge("1", "t", "a"), new GraphEdge("2", "a", "b"), new GraphEdge("3", "b", "c")));

            Program program = compiler.compile(graph).program();

            assertThat(program.instructions()).extracting(Instruction::actionType)
                    .containsExactly("send_email", "send_slack", "add_tag");
            assertThat(program.instructions()).noneMatch(Instruction::hasBranchTarget);
            assertThat(program.get(0).config()).containsEntry("key", "a");
        }

        @Test
        @DisplayName("delay config is copied verbatim")
        void delayConfig() {
            GraphNode delay = new GraphNode("d", "Wait", DelayPayload.of(3, "hours"), null);
            Program program = compiler.compile(new GraphSnapshot(List.of(trigger(), delay),
                    List.of(new GraphEdge("1", "t", "d")))).program();

            assertEquals(InstructionKind.DELAY, program.get(0).kind());
            assertEquals(Map.of("delay_type", "hours", "delay_value", 3), program.get(0).config());
            assertNull(program.get(0).actionType());
        }

        @Test
        @DisplayName("graph without a trigger compiles with an absent descriptor")
        void noTrigger() {
            CompiledWorkflow compiled = compiler.compile(new GraphSnapshot(List.of(action("a", "send_email")), List.of()));

            assertFalse(compiled.trigger().isPresent());
            assertEquals(1, compiled.program().size());
        }
    }

    @Nested
    @DisplayName("conditions")
    class Conditions {

        @Test
        @DisplayName("false edge becomes the branch target index; true branch is the next instruction")
        void falseEdgeBecomesBranchTarget() {
            GraphSnapshot graph = new GraphSnapshot(
                    List.of(trigger(), condition("x"), action("y", "send_email"), action("z", "add_tag")),
                    List.of(
                            new GraphEdge("1", "t", "x"),
                            new GraphEdge("2", "x", "y", BranchTag.TRUE),
                            new GraphEdge("3", "x", "z", BranchTag.FALSE)));

            Program program = compiler.compile(graph).program();

            assertEquals(3, program.size());
            assertEquals(InstructionKind.CONDITION, program.get(0).kind());
            assertThat(program.get(0).branchTarget()).isEqualTo(2);
            assertEquals("send_email", program.get(1).actionType());
        }

        @Test
        @DisplayName("condition without a false edge has no branch target")
        void noFalseEdge() {
            GraphSnapshot graph = new GraphSnapshot(
                    List.of(trigger(), condition("x"), action("y", "send_email")),
                    List.of(new GraphEdge("1", "t", "x"), new GraphEdge("2", "x", "y", BranchTag.TRUE)));

            assertFalse(compiler.compile(graph).program().get(0).hasBranchTarget());
        }

        @Test
        @DisplayName("false edge pointing back to an earlier node falls back to declaration order")
        void backwardFalseEdge() {
            GraphSnapshot graph = new GraphSnapshot(
                    List.of(trigger(), action("a", "send_email"), condition("x")),
                    List.of(
                            new GraphEdge("1", "t", "a"),
                            new GraphEdge("2", "a", "x"),
                            new GraphEdge("3", "x", "a", BranchTag.FALSE)));

            Program program = compiler.compile(graph).program();

            assertEquals("send_email", program.get(0).actionType());
            assertThat(program.get(1).branchTarget()).isEqualTo(0);
        }

        @Test
        @DisplayName("false edge to the trigger yields no branch target")
        void falseEdgeToTrigger() {
            GraphSnapshot graph = new GraphSnapshot(
                    List.of(trigger(), condition("x")),
                    List.of(new GraphEdge("1", "x", "t", BranchTag.FALSE)));

            assertFalse(compiler.compile(graph).program().get(0).hasBranchTarget());
        }
    }

    @Nested
    @DisplayName("anomalies")
    class Anomalies {

        @Test
        @DisplayName("cycle A <-> B without trigger terminates with declaration order")
        void cycle() {
            GraphSnapshot graph = new GraphSnapshot(
                    List.of(action("a", "send_email"), action("b", "add_tag")),
                    List.of(new GraphEdge("1", "a", "b"), new GraphEdge("2", "b", "a")));

            Program program = compiler.compile(graph).program();

            assertThat(program.instructions()).extracting(Instruction::actionType).containsExactly("send_email", "add_tag");
        }

        @Test
        @DisplayName("dangling edges and duplicate node ids are ignored")
        void danglingAndDuplicates() {
            GraphSnapshot graph = new GraphSnapshot(
                    List.of(trigger(), action("a", "send_email"), action("a", "other"), condition("x")),
                    List.of(new GraphEdge("1", "t", "a"), new GraphEdge("2", "a", "x"), new GraphEdge("3", "x", "ghost", BranchTag.FALSE)));

            Program program = compiler.compile(graph).program();

            assertEquals(2, program.size());
            assertEquals("send_email", program.get(0).actionType());
            assertFalse(program.get(1).hasBranchTarget());
        }

        @Test
        @DisplayName("removing B from trigger -> A -> B -> C compiles to [A, C]")
        void removeMiddleNode() {
            WorkflowGraph graph = WorkflowGraph.withDefaultTrigger();
            GraphNode a = graph.appendNode(new ActionPayload("send_email", Map.of()), null);
            GraphNode b = graph.appendNode(new ActionPayload("send_slack", Map.of()), null);
            GraphNode c = graph.appendNode(new ActionPayload("add_tag", Map.of()), null);

            graph.removeNode(b.id());
            Program program = compiler.compile(graph).program();

            assertThat(program.instructions()).extracting(Instruction::actionType).containsExactly("send_email", "add_tag");
            assertThat(graph.nodes()).extracting(GraphNode::id).containsExactly("trigger-0", a.id(), c.id());
        }

        @Test
        @DisplayName("compiling the same graph twice gives equal results")
        void deterministic() {
            WorkflowGraph graph = WorkflowGraph.withDefaultTrigger();
            graph.appendNode(ConditionPayload.of("f", "equals", "v"), null);
            graph.appendNode(new ActionPayload("send_email", Map.of()), null);

            assertEquals(compiler.compile(graph), compiler.compile(graph));
        }
    }
}
