package com.example.flowcompiler.api.v1.dto;

import java.util.List;

/**
 * Response for GET /api/v1/samples.
 */
public record SampleListResponse(List<SampleListItem> samples) {}
