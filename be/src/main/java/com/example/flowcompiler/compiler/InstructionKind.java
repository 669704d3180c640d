package com.example.flowcompiler.compiler;

import com.example.flowcompiler.graph.NodeKind;

import java.util.Optional;

/**
 * Kind of a program instruction. Triggers never become instructions.
 */
public enum InstructionKind {

    ACTION("action", NodeKind.ACTION),
    CONDITION("condition", NodeKind.CONDITION),
    DELAY("delay", NodeKind.DELAY);

    private final String wireName;
    private final NodeKind nodeKind;

    InstructionKind(String wireName, NodeKind nodeKind) {
        this.wireName = wireName;
        this.nodeKind = nodeKind;
    }

    public String wireName() {
        return wireName;
    }

    public NodeKind nodeKind() {
        return nodeKind;
    }

    public static Optional<InstructionKind> fromWireName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim();
        for (InstructionKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
