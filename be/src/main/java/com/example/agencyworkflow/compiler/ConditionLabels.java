package com.example.agencyworkflow.compiler;

import com.example.agencyworkflow.graph.EdgeCondition;

/**
 * Human-readable labels for edge conditions.
 */
public final class ConditionLabels {

    private ConditionLabels() {
    }

    public static String label(EdgeCondition condition) {
        if (condition instanceof EdgeCondition.OnSuccess) {
            return "On Success";
        }
        if (condition instanceof EdgeCondition.OnFailure) {
            return "On Failure";
        }
        if (condition instanceof EdgeCondition.Always) {
            return "Always";
        }
        if (condition instanceof EdgeCondition.IfContains c) {
            return "If Contains: " + c.field() + " = " + c.value();
        }
        if (condition instanceof EdgeCondition.IfEquals c) {
            return "If Equals: " + c.field() + " = " + c.value();
        }
        return "Always";
    }
}
