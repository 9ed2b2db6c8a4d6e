package com.example.agencyworkflow.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Validator output. Warnings never make a graph invalid.
 */
public record ValidationResult(
        @JsonProperty("isValid") boolean valid,
        List<ValidationIssue> errors,
        List<ValidationIssue> warnings
) {
    public ValidationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static ValidationResult of(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        return new ValidationResult(errors == null || errors.isEmpty(), errors, warnings);
    }
}
