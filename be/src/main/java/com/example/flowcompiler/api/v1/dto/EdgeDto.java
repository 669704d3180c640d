package com.example.flowcompiler.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import jakarta.validation.constraints.NotBlank;

/**
 * One edge of an editable graph. {@code branch} is {@code true}, {@code false} or absent;
 * {@code id} may be omitted when adding an edge.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EdgeDto(
        String id,
        @NotBlank String source,
        @NotBlank String target,
        String branch
) {}
