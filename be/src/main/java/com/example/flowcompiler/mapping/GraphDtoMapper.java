package com.example.flowcompiler.mapping;

import com.example.flowcompiler.api.v1.dto.EdgeDto;
import com.example.flowcompiler.api.v1.dto.GraphDto;
import com.example.flowcompiler.api.v1.dto.NodeDto;
import com.example.flowcompiler.api.v1.dto.NodeUpdateRequest;
import com.example.flowcompiler.api.v1.dto.PositionDto;
import com.example.flowcompiler.graph.ActionPayload;
import com.example.flowcompiler.graph.BranchTag;
import com.example.flowcompiler.graph.ConditionPayload;
import com.example.flowcompiler.graph.DelayPayload;
import com.example.flowcompiler.graph.GraphEdge;
import com.example.flowcompiler.graph.GraphNode;
import com.example.flowcompiler.graph.GraphSnapshot;
import com.example.flowcompiler.graph.NodeKind;
import com.example.flowcompiler.graph.NodePayload;
import com.example.flowcompiler.graph.Position;
import com.example.flowcompiler.graph.TriggerPayload;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps editable graphs between the API shape and the graph model.
 * <p>
 * Incoming graphs are lenient: a node with an unknown kind becomes an action whose action type is
 * the given action type or the raw kind, missing ids are generated, and the result is sanitized
 * through {@link GraphSnapshot#of(List, List)}.
 * </p>
 */
@Component
@Slf4j
public class GraphDtoMapper {

    public GraphSnapshot toSnapshot(GraphDto graph) {
        if (graph == null) {
            return GraphSnapshot.EMPTY;
        }
        List<GraphNode> nodes = new ArrayList<>();
        List<NodeDto> nodeDtos = graph.nodes() != null ? graph.nodes() : List.of();
        Set<String> nodeIds = new HashSet<>();
        for (NodeDto dto : nodeDtos) {
            if (dto != null && !isBlank(dto.id())) {
                nodeIds.add(dto.id());
            }
        }
        for (int i = 0; i < nodeDtos.size(); i++) {
            NodeDto dto = nodeDtos.get(i);
            if (dto == null) {
                continue;
            }
            String id = isBlank(dto.id()) ? uniqueNodeId(i, nodeIds) : dto.id();
            nodes.add(new GraphNode(id, dto.label(), toPayload(dto.kind(), dto.triggerType(), dto.actionType(), dto.config()),
                    toPosition(dto.position())));
        }

        List<GraphEdge> edges = new ArrayList<>();
        Set<String> edgeIds = new HashSet<>();
        for (EdgeDto dto : graph.edges() != null ? graph.edges() : List.<EdgeDto>of()) {
            if (dto == null || isBlank(dto.source()) || isBlank(dto.target())) {
                continue;
            }
            BranchTag branch = BranchTag.fromWireName(dto.branch());
            String id = isBlank(dto.id()) ? uniqueEdgeId(dto.source(), dto.target(), branch, edgeIds) : dto.id();
            edgeIds.add(id);
            edges.add(new GraphEdge(id, dto.source(), dto.target(), branch));
        }
        return GraphSnapshot.of(nodes, edges);
    }

    public GraphDto toDto(GraphSnapshot snapshot) {
        List<NodeDto> nodes = snapshot.nodes().stream().map(this::toDto).toList();
        List<EdgeDto> edges = snapshot.edges().stream()
                .map(edge -> new EdgeDto(edge.id(), edge.source(), edge.target(), edge.branch().wireName()))
                .toList();
        return new GraphDto(nodes, edges);
    }

    public NodeDto toDto(GraphNode node) {
        NodePayload payload = node.payload();
        String triggerType = payload instanceof TriggerPayload trigger ? trigger.triggerType() : null;
        String actionType = payload instanceof ActionPayload action ? action.actionType() : null;
        return new NodeDto(
                node.id(),
                node.kind().wireName(),
                node.label(),
                triggerType,
                actionType,
                payload.config(),
                new PositionDto(node.position().x(), node.position().y())
        );
    }

    public EdgeDto toDto(GraphEdge edge) {
        return new EdgeDto(edge.id(), edge.source(), edge.target(), edge.branch().wireName());
    }

    /**
     * Builds the payload for a node of the given kind. Unknown kinds become actions.
     */
    public NodePayload toPayload(String kind, String triggerType, String actionType, Map<String, Object> config) {
        Optional<NodeKind> nodeKind = NodeKind.fromWireName(kind);
        if (nodeKind.isEmpty()) {
            String fallbackType = actionType != null ? actionType : kind;
            log.debug("Mapping unknown node kind '{}' to action '{}'", kind, fallbackType);
            return new ActionPayload(fallbackType, config);
        }
        switch (nodeKind.get()) {
            case TRIGGER:
                return new TriggerPayload(triggerType, config);
            case CONDITION:
                return new ConditionPayload(config);
            case DELAY:
                return new DelayPayload(config);
            default:
                return new ActionPayload(actionType, config);
        }
    }

    /**
     * Applies a partial update to a node. Absent fields keep their current value.
     */
    public GraphNode applyUpdate(GraphNode node, NodeUpdateRequest update) {
        NodePayload current = node.payload();
        Map<String, Object> config = update.config() != null ? update.config() : current.config();
        NodePayload payload;
        if (current instanceof TriggerPayload trigger) {
            payload = new TriggerPayload(update.triggerType() != null ? update.triggerType() : trigger.triggerType(), config);
        } else if (current instanceof ActionPayload action) {
            payload = new ActionPayload(update.actionType() != null ? update.actionType() : action.actionType(), config);
        } else if (current instanceof ConditionPayload) {
            payload = new ConditionPayload(config);
        } else {
            payload = new DelayPayload(config);
        }
        return new GraphNode(
                node.id(),
                update.label() != null ? update.label() : node.label(),
                payload,
                update.position() != null ? toPosition(update.position()) : node.position()
        );
    }

    public Position toPosition(PositionDto dto) {
        return dto != null ? new Position(dto.x(), dto.y()) : null;
    }

    /** {@code node-<index>}, suffixed until it collides with no id given or generated so far. */
    private static String uniqueNodeId(int index, Set<String> taken) {
        String base = "node-" + index;
        String id = base;
        for (int n = 1; taken.contains(id); n++) {
            id = base + "-" + n;
        }
        taken.add(id);
        return id;
    }

    private static String uniqueEdgeId(String source, String target, BranchTag branch, Set<String> taken) {
        String base = "edge-" + source + "-" + target + (branch.isBranch() ? "-" + branch.wireName() : "");
        String id = base;
        int suffix = 1;
        while (taken.contains(id)) {
            id = base + "-" + suffix++;
        }
        return id;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
