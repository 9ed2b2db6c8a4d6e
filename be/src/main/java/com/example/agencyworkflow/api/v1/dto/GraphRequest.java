package com.example.agencyworkflow.api.v1.dto;

import com.example.agencyworkflow.graph.ExecutionMode;
import com.example.agencyworkflow.graph.WorkflowEdge;
import com.example.agencyworkflow.graph.WorkflowNode;

import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Graph plus execution mode, for validate, layout and estimate.
 */
public record GraphRequest(
        @NotNull List<WorkflowNode> nodes,
        List<WorkflowEdge> edges,
        ExecutionMode mode
) {
    public List<WorkflowEdge> edgesOrEmpty() {
        return edges != null ? edges : List.of();
    }

    public ExecutionMode modeOrDefault() {
        return mode != null ? mode : ExecutionMode.SEQUENTIAL;
    }
}
