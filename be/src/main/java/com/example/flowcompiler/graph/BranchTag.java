package com.example.flowcompiler.graph;

/**
 * Label on an edge. Only edges leaving a condition node may carry {@link #TRUE} or {@link #FALSE}.
 */
public enum BranchTag {

    NONE(null),
    TRUE("true"),
    FALSE("false");

    private final String wireName;

    BranchTag(String wireName) {
        this.wireName = wireName;
    }

    /** Wire name, or {@code null} for {@link #NONE}. */
    public String wireName() {
        return wireName;
    }

    public boolean isBranch() {
        return this != NONE;
    }

    /**
     * Parses a wire name. Null, blank and unrecognized values map to {@link #NONE}.
     */
    public static BranchTag fromWireName(String name) {
        if (name == null || name.isBlank()) {
            return NONE;
        }
        String normalized = name.trim();
        if (TRUE.wireName.equalsIgnoreCase(normalized)) {
            return TRUE;
        }
        if (FALSE.wireName.equalsIgnoreCase(normalized)) {
            return FALSE;
        }
        return NONE;
    }
}
