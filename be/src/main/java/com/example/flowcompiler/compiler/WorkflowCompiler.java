package com.example.flowcompiler.compiler;

import com.example.flowcompiler.graph.ActionPayload;
import com.example.flowcompiler.graph.BranchTag;
import com.example.flowcompiler.graph.ConditionPayload;
import com.example.flowcompiler.graph.GraphEdge;
import com.example.flowcompiler.graph.GraphNode;
import com.example.flowcompiler.graph.GraphSnapshot;
import com.example.flowcompiler.graph.NodeKind;
import com.example.flowcompiler.graph.NodePayload;
import com.example.flowcompiler.graph.TriggerPayload;
import com.example.flowcompiler.graph.WorkflowGraph;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compiles a workflow graph into a trigger descriptor and a program.
 * <p>
 * Nodes are ordered by {@link GraphLinearizer}. The trigger node is lifted into the descriptor and
 * every other node emits one instruction with its config copied verbatim. A condition's false edge
 * becomes its branch target, the index of the edge target in the emitted program. The true branch
 * is not encoded: it is whatever instruction follows the condition.
 * </p>
 * <p>
 * Total over any snapshot: cycles, dangling edges, duplicate ids and extra triggers are absorbed,
 * never thrown.
 * </p>
 */
@Slf4j
public class WorkflowCompiler {

    public CompiledWorkflow compile(WorkflowGraph graph) {
        return compile(graph.snapshot());
    }

    public CompiledWorkflow compile(GraphSnapshot snapshot) {
        List<GraphNode> nodes = snapshot.nodes();
        List<GraphEdge> edges = snapshot.edges();
        Map<String, GraphNode> byId = new HashMap<>();
        for (GraphNode node : nodes) {
            byId.putIfAbsent(node.id(), node);
        }

        TriggerDescriptor trigger = null;
        List<GraphNode> emitted = new ArrayList<>();
        Map<String, Integer> emittedIndex = new HashMap<>();
        Set<String> seen = new HashSet<>();
        for (String id : GraphLinearizer.order(nodes, edges)) {
            if (!seen.add(id)) {
                continue;
            }
            GraphNode node = byId.get(id);
            if (node.kind() == NodeKind.TRIGGER) {
                if (trigger == null) {
                    trigger = TriggerDescriptor.from((TriggerPayload) node.payload());
                } else {
                    log.debug("Ignoring extra trigger node id={}", id);
                }
                continue;
            }
            emittedIndex.put(id, emitted.size());
            emitted.add(node);
        }

        Map<String, String> falseTargets = new HashMap<>();
        for (GraphEdge edge : edges) {
            if (edge.branch() == BranchTag.FALSE && byId.containsKey(edge.target())) {
                falseTargets.putIfAbsent(edge.source(), edge.target());
            }
        }

        List<Instruction> instructions = new ArrayList<>(emitted.size());
        for (GraphNode node : emitted) {
            Integer branchTarget = null;
            if (node.kind() == NodeKind.CONDITION) {
                String falseTarget = falseTargets.get(node.id());
                branchTarget = falseTarget != null ? emittedIndex.get(falseTarget) : null;
            }
            instructions.add(toInstruction(node.payload(), branchTarget));
        }

        CompiledWorkflow compiled = new CompiledWorkflow(
                trigger != null ? trigger : TriggerDescriptor.NONE,
                new Program(instructions)
        );
        log.debug("Compiled graph nodes={} edges={} instructions={} triggerType={}",
                nodes.size(), edges.size(), instructions.size(), compiled.trigger().triggerType());
        return compiled;
    }

    private Instruction toInstruction(NodePayload payload, Integer branchTarget) {
        if (payload instanceof ActionPayload action) {
            return Instruction.action(action.actionType(), action.config());
        }
        if (payload instanceof ConditionPayload condition) {
            return Instruction.condition(condition.config(), branchTarget);
        }
        return Instruction.delay(payload.config());
    }
}
