package com.example.flowcompiler.graph;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload of a delay node. Amount and unit live in the config as {@code delay_value} and
 * {@code delay_type} (minutes, hours or days).
 */
public record DelayPayload(Map<String, Object> config) implements NodePayload {

    public static final String AMOUNT = "delay_value";
    public static final String UNIT = "delay_type";

    public DelayPayload {
        config = ConfigMaps.copyOf(config);
    }

    public static DelayPayload of(int amount, String unit) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put(UNIT, unit);
        config.put(AMOUNT, amount);
        return new DelayPayload(config);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DELAY;
    }

    /** Amount as an integer, or {@code null} if missing or not numeric. */
    public Integer amount() {
        Object value = config.get(AMOUNT);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Integer.valueOf(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public String unit() {
        return ConfigMaps.stringValue(config, UNIT);
    }
}
