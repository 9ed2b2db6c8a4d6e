package com.example.agencyworkflow.api.v1.dto;

import com.example.agencyworkflow.graph.ExecutionMode;

import java.time.Instant;
import java.util.UUID;

/**
 * Workflow list item (id, name, mode, updatedAt).
 */
public record WorkflowListItem(
        UUID id,
        String name,
        ExecutionMode executionMode,
        Instant updatedAt
) {}
