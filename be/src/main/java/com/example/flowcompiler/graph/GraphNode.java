package com.example.flowcompiler.graph;

import java.util.Objects;

/**
 * One node of a workflow graph. The kind is taken from the payload.
 */
public record GraphNode(String id, String label, NodePayload payload, Position position) {

    public GraphNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(payload, "payload");
        label = label != null ? label : "";
        position = position != null ? position : Position.ORIGIN;
    }

    public NodeKind kind() {
        return payload.kind();
    }

    public GraphNode withPayload(NodePayload newPayload) {
        return new GraphNode(id, label, newPayload, position);
    }

    public GraphNode withLabel(String newLabel) {
        return new GraphNode(id, newLabel, payload, position);
    }

    public GraphNode withPosition(Position newPosition) {
        return new GraphNode(id, label, payload, newPosition);
    }
}
