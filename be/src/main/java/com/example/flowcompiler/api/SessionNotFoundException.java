package com.example.flowcompiler.api;

import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when an editing session is not found by id.
 * <p>
 * Mapped to HTTP 404 by {@link GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class SessionNotFoundException extends RuntimeException {

    private final UUID sessionId;

    public SessionNotFoundException(UUID sessionId) {
        super("Editing session not found: " + sessionId);
        this.sessionId = sessionId;
    }
}
