package com.example.flowcompiler.compiler;

import com.example.flowcompiler.graph.ConfigMaps;
import com.example.flowcompiler.graph.TriggerPayload;

import java.util.Map;

/**
 * Trigger type and config extracted from the trigger node. Kept beside the program, not inside it.
 */
public record TriggerDescriptor(String triggerType, Map<String, Object> config) {

    /** Descriptor of a graph without a trigger node. */
    public static final TriggerDescriptor NONE = new TriggerDescriptor(null, Map.of());

    public TriggerDescriptor {
        config = ConfigMaps.copyOf(config);
    }

    public static TriggerDescriptor from(TriggerPayload payload) {
        return new TriggerDescriptor(payload.triggerType(), payload.config());
    }

    public boolean isPresent() {
        return triggerType != null && !triggerType.isBlank();
    }

    public TriggerPayload toPayload() {
        return new TriggerPayload(triggerType, config);
    }
}
