package com.example.flowcompiler.graph;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload of a condition node. The config holds {@code field}, {@code operator} and {@code value}.
 */
public record ConditionPayload(Map<String, Object> config) implements NodePayload {

    public static final String FIELD = "field";
    public static final String OPERATOR = "operator";
    public static final String VALUE = "value";

    public ConditionPayload {
        config = ConfigMaps.copyOf(config);
    }

    public static ConditionPayload of(String field, String operator, Object value) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put(FIELD, field);
        config.put(OPERATOR, operator);
        if (value != null) {
            config.put(VALUE, value);
        }
        return new ConditionPayload(config);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONDITION;
    }

    public String field() {
        return ConfigMaps.stringValue(config, FIELD);
    }

    public String operator() {
        return ConfigMaps.stringValue(config, OPERATOR);
    }

    public Object value() {
        return config.get(VALUE);
    }
}
