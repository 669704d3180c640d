package com.example.flowcompiler.api.v1.dto;

import java.util.Map;

/**
 * Partial node update. Absent fields are kept; the node kind cannot change.
 */
public record NodeUpdateRequest(
        String label,
        String triggerType,
        String actionType,
        Map<String, Object> config,
        PositionDto position
) {}
