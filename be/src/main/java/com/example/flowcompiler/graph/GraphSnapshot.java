package com.example.flowcompiler.graph;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable view of a graph's nodes and edges in declaration order.
 * <p>
 * The canonical constructor copies its input as-is; consumers such as the compiler must tolerate
 * anomalies in it. {@link #of(List, List)} additionally sanitizes externally supplied graphs.
 * </p>
 */
@Slf4j
public record GraphSnapshot(List<GraphNode> nodes, List<GraphEdge> edges) {

    public static final GraphSnapshot EMPTY = new GraphSnapshot(List.of(), List.of());

    public GraphSnapshot {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }

    /**
     * Builds a snapshot that satisfies the graph invariants: duplicate node ids and extra trigger
     * nodes are dropped (first wins), edges with a missing endpoint are dropped, branch tags on edges
     * whose source is not a condition are cleared, and a second edge with the same branch tag from
     * one condition is dropped.
     */
    public static GraphSnapshot of(List<GraphNode> nodes, List<GraphEdge> edges) {
        Map<String, GraphNode> byId = new HashMap<>();
        List<GraphNode> keptNodes = new ArrayList<>();
        boolean triggerSeen = false;
        for (GraphNode node : nodes != null ? nodes : List.<GraphNode>of()) {
            if (node == null || byId.containsKey(node.id())) {
                continue;
            }
            if (node.kind() == NodeKind.TRIGGER) {
                if (triggerSeen) {
                    log.debug("Dropping extra trigger node id={}", node.id());
                    continue;
                }
                triggerSeen = true;
            }
            byId.put(node.id(), node);
            keptNodes.add(node);
        }

        Set<String> edgeIds = new HashSet<>();
        Set<String> usedBranches = new HashSet<>();
        List<GraphEdge> keptEdges = new ArrayList<>();
        for (GraphEdge edge : edges != null ? edges : List.<GraphEdge>of()) {
            if (edge == null || !edgeIds.add(edge.id())) {
                continue;
            }
            GraphNode source = byId.get(edge.source());
            if (source == null || !byId.containsKey(edge.target())) {
                log.debug("Dropping dangling edge id={} source={} target={}", edge.id(), edge.source(), edge.target());
                continue;
            }
            GraphEdge kept = edge;
            if (edge.branch().isBranch()) {
                if (source.kind() != NodeKind.CONDITION) {
                    kept = new GraphEdge(edge.id(), edge.source(), edge.target(), BranchTag.NONE);
                } else if (!usedBranches.add(edge.source() + "/" + edge.branch())) {
                    log.debug("Dropping duplicate {} edge id={} from condition {}", edge.branch(), edge.id(), edge.source());
                    continue;
                }
            }
            keptEdges.add(kept);
        }
        return new GraphSnapshot(keptNodes, keptEdges);
    }

    public Optional<GraphNode> node(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    public Optional<GraphNode> trigger() {
        return nodes.stream().filter(n -> n.kind() == NodeKind.TRIGGER).findFirst();
    }
}
