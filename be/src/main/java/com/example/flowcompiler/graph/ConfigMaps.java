package com.example.flowcompiler.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Copies opaque configuration maps. Keeps key order and null values, which {@link Map#copyOf} rejects.
 */
public final class ConfigMaps {

    private ConfigMaps() {
    }

    public static Map<String, Object> copyOf(Map<String, ?> config) {
        if (config == null || config.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    static String stringValue(Map<String, Object> config, String key) {
        Object value = config.get(key);
        return value != null ? value.toString() : null;
    }
}
