package com.example.agencyworkflow.api.v1.dto;

import com.example.agencyworkflow.graph.WorkflowEdge;
import com.example.agencyworkflow.graph.WorkflowNode;

import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Request body for POST /api/v1/graph/compile. {@code excludedCanisterId} falls back to the
 * configured host canister when absent.
 */
public record CompileRequest(
        @NotNull List<WorkflowNode> nodes,
        List<WorkflowEdge> edges,
        String excludedCanisterId,
        List<String> allowedCanisterIds
) {}
