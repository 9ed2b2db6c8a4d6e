package com.example.agencyworkflow.compiler;

import com.example.agencyworkflow.graph.EdgeCondition;

import java.util.Objects;

/**
 * Compiled edge between two steps, addressed by step index.
 */
public record AgentConnection(int sourceStepIndex, int targetStepIndex, EdgeCondition condition) {

    public AgentConnection {
        condition = condition != null ? condition : EdgeCondition.always();
    }

    boolean resolvesWithin(int stepCount) {
        return sourceStepIndex >= 0 && sourceStepIndex < stepCount
                && targetStepIndex >= 0 && targetStepIndex < stepCount;
    }

    @Override
    public String toString() {
        return sourceStepIndex + "->" + targetStepIndex + " " + Objects.toString(condition);
    }
}
