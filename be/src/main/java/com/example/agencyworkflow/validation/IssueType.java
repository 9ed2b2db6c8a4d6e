package com.example.agencyworkflow.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum IssueType {
    @JsonProperty("error") ERROR,
    @JsonProperty("performance") PERFORMANCE,
    @JsonProperty("best-practice") BEST_PRACTICE
}
