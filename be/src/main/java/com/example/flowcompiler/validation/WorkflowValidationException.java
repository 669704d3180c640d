package com.example.flowcompiler.validation;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a compiled workflow cannot be saved (e.g. no trigger, event trigger without event types).
 * <p>
 * Mapped to HTTP 400 with {@link #getErrors()} in the response body by {@link com.example.flowcompiler.api.GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class WorkflowValidationException extends RuntimeException {

    private final List<ValidationError> errors;

    public WorkflowValidationException(List<ValidationError> errors) {
        super("Workflow validation failed: " + (errors != null ? errors.size() + " error(s)" : ""));
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }
}
