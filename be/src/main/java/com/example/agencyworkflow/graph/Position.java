package com.example.agencyworkflow.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Canvas coordinate of a node. Advisory only; the compiler never reads it.
 */
public record Position(double x, double y) {

    public static final Position ORIGIN = new Position(0, 0);

    /**
     * Missing coordinates read as 0.
     */
    @JsonCreator
    public static Position of(@JsonProperty("x") Double x, @JsonProperty("y") Double y) {
        return new Position(x != null ? x : 0, y != null ? y : 0);
    }
}
