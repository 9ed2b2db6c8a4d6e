package com.example.agencyworkflow.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Nodes and edges of one editable workflow. Missing lists read as empty.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowGraph(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {

    public WorkflowGraph {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }

    public static WorkflowGraph empty() {
        return new WorkflowGraph(List.of(), List.of());
    }
}
