package com.example.flowcompiler.api.v1.dto;

import java.util.UUID;

/**
 * Response after opening an editing session (201): only the id.
 */
public record SessionIdResponse(UUID id) {}
