package com.example.agencyworkflow.api.v1.dto;

import com.example.agencyworkflow.graph.ExecutionMode;
import com.example.agencyworkflow.graph.WorkflowEdge;
import com.example.agencyworkflow.graph.WorkflowNode;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Request body for replacing a workflow's name, mode and graph.
 */
public record WorkflowUpdateRequest(
        @NotBlank String name,
        String description,
        ExecutionMode executionMode,
        List<WorkflowNode> nodes,
        List<WorkflowEdge> edges
) {}
