package com.example.agencyworkflow.document;

import com.example.agencyworkflow.graph.WorkflowEdge;
import com.example.agencyworkflow.graph.WorkflowGraph;
import com.example.agencyworkflow.graph.WorkflowNode;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Persisted/exported form of a workflow. {@code nodes} and {@code edges} read as empty when absent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowDocument(
        String version,
        WorkflowMetadata metadata,
        List<WorkflowNode> nodes,
        List<WorkflowEdge> edges,
        String exportedAt
) {
    public static final String CURRENT_VERSION = "1.0";

    public WorkflowDocument {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }

    @JsonIgnore
    public WorkflowGraph graph() {
        return new WorkflowGraph(nodes, edges);
    }
}
