package com.example.agencyworkflow.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Rendering hint for an edge. {@link #DEFAULT} edges carry an {@code Always} condition,
 * {@link #CONDITIONAL} edges anything else.
 */
public enum EdgeType {
    @JsonProperty("default") DEFAULT,
    @JsonProperty("conditional") CONDITIONAL,
    @JsonProperty("parallel") PARALLEL,
    @JsonProperty("trigger") TRIGGER
}
