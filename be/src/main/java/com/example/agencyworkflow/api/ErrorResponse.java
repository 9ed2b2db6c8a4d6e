package com.example.agencyworkflow.api;

import com.example.agencyworkflow.validation.ValidationError;

import java.util.List;

/**
 * Body of every non-2xx answer from the workflow API.
 * <p>
 * {@code errors} is set only when a graph or request failed validation; each entry names
 * the offending node or edge, or the request field, and why it was refused.
 * </p>
 *
 * @param message what went wrong with the workflow or request
 * @param errors  per-element validation failures, or null
 */
public record ErrorResponse(String message, List<ValidationError> errors) {

    public ErrorResponse(String message) {
        this(message, null);
    }

    /**
     * Empty error lists are kept as an empty array so clients can tell "validated, none listed" from a plain error.
     */
    public static ErrorResponse withErrors(String message, List<ValidationError> errors) {
        return new ErrorResponse(message, errors != null ? List.copyOf(errors) : null);
    }
}
