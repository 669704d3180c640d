package com.example.flowcompiler.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * One node of an editable graph. {@code triggerType} is only set on the trigger node and
 * {@code actionType} only on actions; {@code id} may be omitted when adding a node.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeDto(
        String id,
        String kind,
        String label,
        String triggerType,
        String actionType,
        Map<String, Object> config,
        PositionDto position
) {}
