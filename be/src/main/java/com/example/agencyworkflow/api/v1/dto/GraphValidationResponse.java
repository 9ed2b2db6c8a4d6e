package com.example.agencyworkflow.api.v1.dto;

import com.example.agencyworkflow.graph.WorkflowNode;
import com.example.agencyworkflow.validation.ValidationResult;

import java.util.List;

/**
 * Validation findings plus the nodes annotated with their errors.
 */
public record GraphValidationResponse(ValidationResult result, List<WorkflowNode> nodes) {}
