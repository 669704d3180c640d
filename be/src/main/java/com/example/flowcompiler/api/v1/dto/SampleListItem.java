package com.example.flowcompiler.api.v1.dto;

/**
 * Sample workflow list item (name, title, description).
 */
public record SampleListItem(String name, String title, String description) {}
