package com.example.agencyworkflow.api.v1.dto;

import com.example.agencyworkflow.graph.ExecutionMode;
import com.example.agencyworkflow.graph.WorkflowEdge;
import com.example.agencyworkflow.graph.WorkflowNode;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Full workflow response (get by id, update).
 */
public record WorkflowResponse(
        UUID id,
        String name,
        String description,
        ExecutionMode executionMode,
        List<WorkflowNode> nodes,
        List<WorkflowEdge> edges,
        String estimatedTime,
        Instant createdAt,
        Instant updatedAt
) {}
