package com.example.agencyworkflow.validation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * One validator finding. {@code nodeId} is null for graph-level findings.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationIssue(String nodeId, IssueType type, String message, String suggestion) {
    public ValidationIssue {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(message, "message");
    }
}
