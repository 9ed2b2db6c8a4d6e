package com.example.agencyworkflow.layout;

import com.example.agencyworkflow.graph.NodeKind;
import com.example.agencyworkflow.graph.WorkflowNode;

import java.util.List;

/**
 * Rough display-only duration estimate: 30 seconds per agent at 60% parallel efficiency.
 */
public final class ExecutionTimeEstimator {

    static final double SECONDS_PER_AGENT = 30;
    static final double PARALLEL_FACTOR = 0.6;

    private ExecutionTimeEstimator() {
    }

    public static String estimate(List<WorkflowNode> nodes) {
        long agentCount = nodes.stream().filter(n -> n.type() == NodeKind.AGENT).count();
        return format(agentCount * SECONDS_PER_AGENT * PARALLEL_FACTOR);
    }

    static String format(double totalSeconds) {
        if (totalSeconds < 60) {
            return "~" + Math.round(totalSeconds) + "s";
        }
        if (totalSeconds < 3600) {
            return "~" + Math.round(totalSeconds / 60) + "m";
        }
        return "~" + Math.round(totalSeconds / 3600) + "h";
    }
}
