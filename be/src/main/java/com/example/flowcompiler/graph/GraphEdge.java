package com.example.flowcompiler.graph;

import java.util.Objects;

/**
 * Directed edge between two nodes, optionally tagged with a condition branch.
 */
public record GraphEdge(String id, String source, String target, BranchTag branch) {

    public GraphEdge {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        branch = branch != null ? branch : BranchTag.NONE;
    }

    public GraphEdge(String id, String source, String target) {
        this(id, source, target, BranchTag.NONE);
    }

    public boolean touches(String nodeId) {
        return source.equals(nodeId) || target.equals(nodeId);
    }

    public GraphEdge withEndpoints(String newSource, String newTarget) {
        return new GraphEdge(id, newSource, newTarget, branch);
    }
}
