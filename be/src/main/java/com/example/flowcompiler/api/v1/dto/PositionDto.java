package com.example.flowcompiler.api.v1.dto;

/**
 * Canvas coordinates of a node.
 */
public record PositionDto(double x, double y) {}
