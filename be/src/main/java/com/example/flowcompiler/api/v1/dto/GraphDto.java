package com.example.flowcompiler.api.v1.dto;

import jakarta.validation.Valid;

import java.util.List;

/**
 * Editable graph: nodes and edges in declaration order.
 */
public record GraphDto(@Valid List<NodeDto> nodes, @Valid List<EdgeDto> edges) {}
