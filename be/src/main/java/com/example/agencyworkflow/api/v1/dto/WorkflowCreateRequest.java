package com.example.agencyworkflow.api.v1.dto;

import com.example.agencyworkflow.graph.ExecutionMode;
import com.example.agencyworkflow.graph.WorkflowEdge;
import com.example.agencyworkflow.graph.WorkflowNode;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Request body for creating a workflow. Partially configured graphs are accepted.
 */
public record WorkflowCreateRequest(
        @NotBlank String name,
        String description,
        ExecutionMode executionMode,
        List<WorkflowNode> nodes,
        List<WorkflowEdge> edges
) {}
