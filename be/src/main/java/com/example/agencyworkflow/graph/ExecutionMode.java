package com.example.agencyworkflow.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How the workflow is meant to run; drives layout strategy and some validation rules.
 */
public enum ExecutionMode {
    SEQUENTIAL,
    PARALLEL,
    CONDITIONAL;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient lookup; unknown or blank values fall back to {@link #SEQUENTIAL}.
     */
    @JsonCreator
    public static ExecutionMode fromCode(String code) {
        if (code == null || code.isBlank()) {
            return SEQUENTIAL;
        }
        for (ExecutionMode mode : values()) {
            if (mode.code().equalsIgnoreCase(code.trim())) {
                return mode;
            }
        }
        return SEQUENTIAL;
    }
}
