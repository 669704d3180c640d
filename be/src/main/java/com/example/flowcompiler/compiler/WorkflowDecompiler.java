package com.example.flowcompiler.compiler;

import com.example.flowcompiler.graph.ActionPayload;
import com.example.flowcompiler.graph.BranchTag;
import com.example.flowcompiler.graph.ConditionPayload;
import com.example.flowcompiler.graph.DelayPayload;
import com.example.flowcompiler.graph.GraphEdge;
import com.example.flowcompiler.graph.GraphNode;
import com.example.flowcompiler.graph.NodePayload;
import com.example.flowcompiler.graph.Position;
import com.example.flowcompiler.graph.WorkflowGraph;

import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * Rebuilds an editable graph from a trigger descriptor and a program.
 * <p>
 * Produces one trigger node and one node per instruction, laid out in a single column so the same
 * program always yields the same picture. Consecutive instructions are chained; a condition gets a
 * true edge to the next instruction and, when it has a branch target, a false edge to it.
 * Compiling the result gives back the same descriptor and instructions.
 * </p>
 */
@Slf4j
public class WorkflowDecompiler {

    static final String STEP_ID_PREFIX = "step-";

    public WorkflowGraph decompile(CompiledWorkflow compiled) {
        return decompile(compiled.trigger(), compiled.program());
    }

    public WorkflowGraph decompile(TriggerDescriptor trigger, Program program) {
        TriggerDescriptor descriptor = trigger != null ? trigger : TriggerDescriptor.NONE;
        Program steps = program != null ? program : Program.EMPTY;
        WorkflowGraph graph = WorkflowGraph.empty();

        graph.addNode(new GraphNode(
                WorkflowGraph.DEFAULT_TRIGGER_ID,
                triggerLabel(descriptor),
                descriptor.toPayload(),
                new Position(WorkflowGraph.COLUMN_X, WorkflowGraph.TOP_Y)
        ));
        for (int i = 0; i < steps.size(); i++) {
            Instruction instruction = steps.get(i);
            graph.addNode(new GraphNode(
                    stepId(i),
                    instructionLabel(instruction),
                    toPayload(instruction),
                    new Position(WorkflowGraph.COLUMN_X, WorkflowGraph.TOP_Y + WorkflowGraph.ROW_SPACING * (i + 1))
            ));
        }

        if (!steps.isEmpty()) {
            graph.addEdge(edge(WorkflowGraph.DEFAULT_TRIGGER_ID, stepId(0), BranchTag.NONE));
        }
        for (int i = 0; i < steps.size(); i++) {
            Instruction instruction = steps.get(i);
            boolean isCondition = instruction.kind() == InstructionKind.CONDITION;
            if (i + 1 < steps.size()) {
                graph.addEdge(edge(stepId(i), stepId(i + 1), isCondition ? BranchTag.TRUE : BranchTag.NONE));
            }
            if (isCondition && instruction.hasBranchTarget()) {
                int target = instruction.branchTarget();
                if (target < steps.size()) {
                    graph.addEdge(edge(stepId(i), stepId(target), BranchTag.FALSE));
                } else {
                    log.debug("Dropping out-of-range branch target {} on step {} of {}", target, i, steps.size());
                }
            }
        }
        log.debug("Decompiled program instructions={} into nodes={} edges={}",
                steps.size(), graph.nodes().size(), graph.edges().size());
        return graph;
    }

    static String stepId(int index) {
        return STEP_ID_PREFIX + index;
    }

    private static GraphEdge edge(String source, String target, BranchTag branch) {
        String id = "edge-" + source + "-" + target + (branch.isBranch() ? "-" + branch.wireName() : "");
        return new GraphEdge(id, source, target, branch);
    }

    private static NodePayload toPayload(Instruction instruction) {
        return switch (instruction.kind()) {
            case ACTION -> new ActionPayload(instruction.actionType(), instruction.config());
            case CONDITION -> new ConditionPayload(instruction.config());
            case DELAY -> new DelayPayload(instruction.config());
        };
    }

    private static String triggerLabel(TriggerDescriptor descriptor) {
        if (!descriptor.isPresent()) {
            return WorkflowGraph.DEFAULT_TRIGGER_LABEL;
        }
        return humanize(descriptor.triggerType()) + " Trigger";
    }

    private static String instructionLabel(Instruction instruction) {
        switch (instruction.kind()) {
            case CONDITION -> {
                ConditionPayload condition = new ConditionPayload(instruction.config());
                if (condition.field() == null || condition.field().isBlank()) {
                    return "Condition";
                }
                String operator = condition.operator() != null ? " " + condition.operator().replace('_', ' ') : "";
                return "If " + condition.field() + operator;
            }
            case DELAY -> {
                DelayPayload delay = new DelayPayload(instruction.config());
                if (delay.amount() == null) {
                    return "Delay";
                }
                return "Wait " + delay.amount() + (delay.unit() != null ? " " + delay.unit() : "");
            }
            default -> {
                String actionType = instruction.actionType();
                return actionType != null && !actionType.isBlank() ? humanize(actionType) : "Action";
            }
        }
    }

    /** {@code send_email} becomes {@code Send Email}. */
    static String humanize(String snakeCase) {
        StringBuilder out = new StringBuilder();
        for (String part : snakeCase.trim().split("[_\\s]+")) {
            if (part.isEmpty()) {
                continue;
            }
            if (out.length() > 0) {
                out.append(' ');
            }
            out.append(part.substring(0, 1).toUpperCase(Locale.ROOT)).append(part.substring(1));
        }
        return out.toString();
    }
}
