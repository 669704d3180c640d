package com.example.flowcompiler.api.v1.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Request body for appending a node below the current graph. Label defaults to {@code New <Kind>}.
 */
public record AppendNodeRequest(
        @NotBlank String kind,
        String label,
        String triggerType,
        String actionType,
        Map<String, Object> config
) {}
