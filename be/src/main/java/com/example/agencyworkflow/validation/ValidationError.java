package com.example.agencyworkflow.validation;

import java.util.Objects;

/**
 * A single request-level error (field and message), carried by hard failures.
 */
public record ValidationError(String field, String message) {
    public ValidationError {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(message, "message");
    }
}
