package com.example.flowcompiler.api.v1.dto;

import java.util.List;

/**
 * API response for one action type and its config fields.
 */
public record ActionInfoDto(String actionType, String description, List<String> requiredFields, List<String> optionalFields) {}
