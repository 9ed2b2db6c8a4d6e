package com.example.agencyworkflow.api;

import lombok.Getter;

import java.util.UUID;

/**
 * No stored workflow definition exists under the requested id, either on lookup,
 * update, delete, export or compile. {@link GlobalExceptionHandler} answers 404.
 */
@Getter
public class WorkflowNotFoundException extends RuntimeException {

    private final UUID workflowId;

    public WorkflowNotFoundException(UUID workflowId) {
        super("No stored workflow definition with id " + workflowId);
        this.workflowId = workflowId;
    }
}
