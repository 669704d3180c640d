package com.example.flowcompiler.graph;

import java.util.Map;

/**
 * Payload of the trigger node: trigger type (e.g. {@code event}, {@code schedule}) and its config.
 */
public record TriggerPayload(String triggerType, Map<String, Object> config) implements NodePayload {

    public TriggerPayload {
        config = ConfigMaps.copyOf(config);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TRIGGER;
    }
}
