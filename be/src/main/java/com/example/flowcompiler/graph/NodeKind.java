package com.example.flowcompiler.graph;

import java.util.Optional;

/**
 * Kind of a graph node. Determines the payload shape and the node's role in the compiled program.
 */
public enum NodeKind {

    TRIGGER("trigger", "Trigger"),
    ACTION("action", "Action"),
    CONDITION("condition", "Condition"),
    DELAY("delay", "Delay");

    private final String wireName;
    private final String displayName;

    NodeKind(String wireName, String displayName) {
        this.wireName = wireName;
        this.displayName = displayName;
    }

    public String wireName() {
        return wireName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Resolves a kind from its wire name (case-insensitive). Empty for null, blank or unknown names.
     */
    public static Optional<NodeKind> fromWireName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim();
        for (NodeKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
