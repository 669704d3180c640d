package com.example.flowcompiler.graph;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Editable workflow graph: nodes and edges keyed by id, in declaration order.
 * <p>
 * Every mutation keeps the graph invariants: at most one trigger node, no edge with a missing
 * endpoint, branch tags only on edges leaving a condition, and at most one edge per branch tag
 * from a condition. A mutation that would break an invariant throws {@link IllegalArgumentException}
 * and leaves the graph unchanged. Not thread-safe; owned by one editing session.
 * </p>
 */
@Slf4j
public class WorkflowGraph {

    public static final String DEFAULT_TRIGGER_ID = "trigger-0";
    public static final String DEFAULT_TRIGGER_LABEL = "Start Workflow";
    public static final String DEFAULT_TRIGGER_TYPE = "event";
    public static final double COLUMN_X = 250;
    public static final double TOP_Y = 50;
    public static final double ROW_SPACING = 150;

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<String, GraphEdge> edges = new LinkedHashMap<>();
    private int nodeSequence;

    public static WorkflowGraph empty() {
        return new WorkflowGraph();
    }

    /**
     * A new graph holding only the default {@code event} trigger node, as a fresh editor starts.
     */
    public static WorkflowGraph withDefaultTrigger() {
        WorkflowGraph graph = new WorkflowGraph();
        graph.addNode(new GraphNode(
                DEFAULT_TRIGGER_ID,
                DEFAULT_TRIGGER_LABEL,
                new TriggerPayload(DEFAULT_TRIGGER_TYPE, Map.of()),
                new Position(COLUMN_X, TOP_Y)
        ));
        return graph;
    }

    /**
     * Builds a graph from a possibly malformed snapshot. Anomalies are dropped, never thrown.
     */
    public static WorkflowGraph from(GraphSnapshot snapshot) {
        GraphSnapshot clean = GraphSnapshot.of(snapshot.nodes(), snapshot.edges());
        WorkflowGraph graph = new WorkflowGraph();
        clean.nodes().forEach(graph::addNode);
        clean.edges().forEach(graph::addEdge);
        return graph;
    }

    public void addNode(GraphNode node) {
        Objects.requireNonNull(node, "node");
        if (nodes.containsKey(node.id())) {
            throw new IllegalArgumentException("Node id already exists: " + node.id());
        }
        if (node.kind() == NodeKind.TRIGGER) {
            trigger().ifPresent(existing -> {
                throw new IllegalArgumentException("Graph already has a trigger node: " + existing.id());
            });
        }
        nodes.put(node.id(), node);
    }

    /**
     * Adds a node below the lowest existing node and connects it from the previously last node,
     * unless the new node is a trigger.
     */
    public GraphNode appendNode(NodePayload payload, String label) {
        Objects.requireNonNull(payload, "payload");
        GraphNode last = nodes.isEmpty() ? null : lastNode();
        double y = nodes.isEmpty()
                ? TOP_Y
                : nodes.values().stream().mapToDouble(n -> n.position().y()).max().orElse(TOP_Y) + ROW_SPACING;
        String nodeLabel = label != null && !label.isBlank() ? label : "New " + payload.kind().displayName();
        GraphNode node = new GraphNode(nextNodeId(), nodeLabel, payload, new Position(COLUMN_X, y));
        addNode(node);
        if (last != null && node.kind() != NodeKind.TRIGGER) {
            connect(last.id(), node.id(), BranchTag.NONE);
        }
        return node;
    }

    /**
     * Removes a node together with every edge that references it.
     */
    public GraphNode removeNode(String nodeId) {
        GraphNode removed = requireNode(nodeId);
        edges.values().removeIf(edge -> edge.touches(nodeId));
        nodes.remove(nodeId);
        return removed;
    }

    /**
     * Replaces a node with an updated version. Id and kind must not change.
     */
    public GraphNode replaceNode(GraphNode updated) {
        Objects.requireNonNull(updated, "updated");
        GraphNode existing = requireNode(updated.id());
        if (existing.kind() != updated.kind()) {
            throw new IllegalArgumentException("Cannot change kind of node " + updated.id()
                    + " from " + existing.kind().wireName() + " to " + updated.kind().wireName());
        }
        nodes.put(updated.id(), updated);
        return updated;
    }

    public GraphNode updatePayload(String nodeId, NodePayload payload) {
        return replaceNode(requireNode(nodeId).withPayload(payload));
    }

    /**
     * Connects two nodes. Returns the existing edge if an identical one is present; a new branch edge
     * replaces any edge with the same branch tag from the same condition.
     */
    public GraphEdge connect(String source, String target, BranchTag branch) {
        BranchTag tag = branch != null ? branch : BranchTag.NONE;
        for (GraphEdge edge : edges.values()) {
            if (edge.source().equals(source) && edge.target().equals(target) && edge.branch() == tag) {
                return edge;
            }
        }
        String base = "edge-" + source + "-" + target + (tag.isBranch() ? "-" + tag.wireName() : "");
        String id = base;
        int suffix = 1;
        while (edges.containsKey(id)) {
            id = base + "-" + suffix++;
        }
        return addEdge(new GraphEdge(id, source, target, tag));
    }

    public GraphEdge addEdge(GraphEdge edge) {
        Objects.requireNonNull(edge, "edge");
        if (edges.containsKey(edge.id())) {
            throw new IllegalArgumentException("Edge id already exists: " + edge.id());
        }
        checkEndpoints(edge);
        if (edge.branch().isBranch()) {
            edges.values().removeIf(existing -> {
                boolean sameBranch = existing.source().equals(edge.source()) && existing.branch() == edge.branch();
                if (sameBranch) {
                    log.debug("Replacing {} edge id={} from condition {}", edge.branch(), existing.id(), edge.source());
                }
                return sameBranch;
            });
        }
        edges.put(edge.id(), edge);
        return edge;
    }

    /**
     * Moves an existing edge to new endpoints, keeping its id and branch tag.
     */
    public GraphEdge reconnect(String edgeId, String source, String target) {
        GraphEdge existing = requireEdge(edgeId);
        GraphEdge moved = existing.withEndpoints(source, target);
        checkEndpoints(moved);
        if (moved.branch().isBranch()) {
            for (GraphEdge other : edges.values()) {
                if (!other.id().equals(edgeId) && other.source().equals(source) && other.branch() == moved.branch()) {
                    throw new IllegalArgumentException("Condition " + source + " already has a "
                            + moved.branch().wireName() + " edge: " + other.id());
                }
            }
        }
        edges.put(edgeId, moved);
        return moved;
    }

    public GraphEdge removeEdge(String edgeId) {
        GraphEdge removed = requireEdge(edgeId);
        edges.remove(edgeId);
        return removed;
    }

    public Optional<GraphNode> node(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public Optional<GraphEdge> edge(String edgeId) {
        return Optional.ofNullable(edges.get(edgeId));
    }

    public Optional<GraphNode> trigger() {
        return nodes.values().stream().filter(n -> n.kind() == NodeKind.TRIGGER).findFirst();
    }

    public List<GraphNode> nodes() {
        return List.copyOf(nodes.values());
    }

    public List<GraphEdge> edges() {
        return List.copyOf(edges.values());
    }

    public GraphSnapshot snapshot() {
        return new GraphSnapshot(new ArrayList<>(nodes.values()), new ArrayList<>(edges.values()));
    }

    /** Next free generated node id of the form {@code node-N}. */
    public String nextNodeId() {
        String id;
        do {
            id = "node-" + ++nodeSequence;
        } while (nodes.containsKey(id));
        return id;
    }

    private GraphNode lastNode() {
        GraphNode last = null;
        for (GraphNode node : nodes.values()) {
            last = node;
        }
        return last;
    }

    private void checkEndpoints(GraphEdge edge) {
        GraphNode source = nodes.get(edge.source());
        if (source == null) {
            throw new IllegalArgumentException("Edge source does not exist: " + edge.source());
        }
        if (!nodes.containsKey(edge.target())) {
            throw new IllegalArgumentException("Edge target does not exist: " + edge.target());
        }
        if (edge.branch().isBranch() && source.kind() != NodeKind.CONDITION) {
            throw new IllegalArgumentException("Only condition nodes may have " + edge.branch().wireName()
                    + " edges; " + edge.source() + " is " + source.kind().wireName());
        }
    }

    private GraphNode requireNode(String nodeId) {
        GraphNode node = nodes.get(nodeId);
        if (node == null) {
            throw new IllegalArgumentException("Node does not exist: " + nodeId);
        }
        return node;
    }

    private GraphEdge requireEdge(String edgeId) {
        GraphEdge edge = edges.get(edgeId);
        if (edge == null) {
            throw new IllegalArgumentException("Edge does not exist: " + edgeId);
        }
        return edge;
    }
}
