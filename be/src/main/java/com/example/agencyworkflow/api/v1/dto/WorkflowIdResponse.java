package com.example.agencyworkflow.api.v1.dto;

import java.util.UUID;

/**
 * Answer to a create or document import: the id under which the workflow graph was stored.
 */
public record WorkflowIdResponse(UUID id) {}
