package com.example.agencyworkflow.validation;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a graph cannot be turned into a usable schedule (cycle, nothing eligible).
 * <p>
 * Mapped to HTTP 400 with {@link #getErrors()} in the response body by
 * {@link com.example.agencyworkflow.api.GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class WorkflowGraphValidationException extends RuntimeException {

    private final List<ValidationError> errors;

    public WorkflowGraphValidationException(List<ValidationError> errors) {
        super("Workflow graph cannot be compiled: " + (errors != null ? errors.size() + " error(s)" : ""));
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public WorkflowGraphValidationException(String field, String message) {
        this(List.of(new ValidationError(field, message)));
    }
}
