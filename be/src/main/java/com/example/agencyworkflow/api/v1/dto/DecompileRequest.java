package com.example.agencyworkflow.api.v1.dto;

import com.example.agencyworkflow.compiler.AgentConnection;
import com.example.agencyworkflow.compiler.AgentStep;

import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Request body for POST /api/v1/graph/decompile. Without connections the steps are chained linearly.
 */
public record DecompileRequest(
        @NotNull List<AgentStep> steps,
        List<AgentConnection> connections
) {}
