package com.example.flowcompiler.api.v1.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * A named sample workflow as loaded from the classpath and returned by GET /api/v1/samples/{name}.
 */
public record SampleWorkflowDto(
        @NotBlank String name,
        String title,
        String description,
        @NotNull @Valid WorkflowRecordDto workflow
) {}
