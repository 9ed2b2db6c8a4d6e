package com.example.agencyworkflow.api.v1.dto;

import java.util.List;

/**
 * Summaries of stored workflows, as returned by the list and bundled-samples endpoints.
 * The graphs themselves are fetched one workflow at a time.
 */
public record WorkflowListResponse(List<WorkflowListItem> workflows) {}
