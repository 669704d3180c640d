package com.example.flowcompiler.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * One step of a stored workflow. {@code else_goto_step} is the zero-based step a condition jumps
 * to when it does not hold.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StepDto(
        @JsonProperty("step_type") String stepType,
        @JsonProperty("action_type") String actionType,
        Map<String, Object> config,
        @JsonProperty("else_goto_step") Integer elseGotoStep
) {}
