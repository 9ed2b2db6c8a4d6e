package com.example.agencyworkflow.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Directed relation {@code source -> target} between node ids. A missing condition means
 * {@link EdgeCondition.Always}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowEdge(
        String id,
        String source,
        String target,
        EdgeType type,
        EdgeCondition condition,
        String label
) {
    public WorkflowEdge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        id = id != null ? id : source + "->" + target;
        type = type != null ? type : EdgeType.DEFAULT;
    }

    public static WorkflowEdge of(String source, String target) {
        return new WorkflowEdge(null, source, target, EdgeType.DEFAULT, null, null);
    }

    public static WorkflowEdge of(String source, String target, EdgeCondition condition) {
        EdgeType type = condition == null || condition.isAlways() ? EdgeType.DEFAULT : EdgeType.CONDITIONAL;
        return new WorkflowEdge(null, source, target, type, condition, null);
    }

    public EdgeCondition conditionOrAlways() {
        return condition != null ? condition : EdgeCondition.always();
    }
}
