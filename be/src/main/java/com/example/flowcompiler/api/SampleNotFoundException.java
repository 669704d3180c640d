package com.example.flowcompiler.api;

import lombok.Getter;

/**
 * Thrown when no sample workflow has the requested name. Mapped to HTTP 404.
 */
@Getter
public class SampleNotFoundException extends RuntimeException {

    private final String sampleName;

    public SampleNotFoundException(String sampleName) {
        super("Sample workflow not found: " + sampleName);
        this.sampleName = sampleName;
    }
}
