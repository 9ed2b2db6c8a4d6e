package com.example.agencyworkflow.compiler;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Output of {@link WorkflowCompiler}: ordered steps and index-based connections.
 * Disposable; the graph remains the system of record.
 */
public record CompiledSchedule(List<AgentStep> steps, List<AgentConnection> connections) {

    public CompiledSchedule {
        steps = steps != null ? List.copyOf(steps) : List.of();
        connections = connections != null ? List.copyOf(connections) : List.of();
    }

    public static CompiledSchedule empty() {
        return new CompiledSchedule(List.of(), List.of());
    }

    /**
     * True when no node survived filtering. Not an error for the compiler; callers that
     * need at least one step check this themselves.
     */
    @JsonIgnore
    public boolean isEmpty() {
        return steps.isEmpty();
    }
}
