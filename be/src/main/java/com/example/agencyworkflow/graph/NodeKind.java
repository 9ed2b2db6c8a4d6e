package com.example.agencyworkflow.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Node discriminator. Only {@link #AGENT} nodes become compiled steps; the other kinds
 * are reserved for non-executable annotations on the canvas.
 */
public enum NodeKind {
    @JsonProperty("agent") AGENT,
    @JsonProperty("trigger") TRIGGER,
    @JsonProperty("condition") CONDITION,
    @JsonProperty("parallel") PARALLEL
}
