package com.example.flowcompiler.graph;

import java.util.Map;

/**
 * Payload of an action node. The action type may be unset while the node is still being configured.
 */
public record ActionPayload(String actionType, Map<String, Object> config) implements NodePayload {

    public ActionPayload {
        config = ConfigMaps.copyOf(config);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ACTION;
    }
}
