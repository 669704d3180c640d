package com.example.flowcompiler.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.Valid;

import java.util.List;
import java.util.Map;

/**
 * Stored workflow shape exchanged with persistence and the execution engine:
 * trigger type and config plus the ordered steps.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowRecordDto(
        @JsonProperty("trigger_type") String triggerType,
        @JsonProperty("trigger_config") Map<String, Object> triggerConfig,
        @Valid List<StepDto> steps
) {}
