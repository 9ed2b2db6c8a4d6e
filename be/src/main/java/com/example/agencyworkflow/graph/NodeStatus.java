package com.example.agencyworkflow.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum NodeStatus {
    @JsonProperty("configured") CONFIGURED,
    @JsonProperty("unconfigured") UNCONFIGURED,
    @JsonProperty("error") ERROR,
    @JsonProperty("valid") VALID
}
