package com.example.agencyworkflow.api.v1.dto;

/**
 * Display-only execution time estimate, e.g. {@code ~1m}.
 */
public record EstimateResponse(String estimatedTime) {}
