package com.example.agencyworkflow.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a step invokes: a single agent, or another whole workflow by reference.
 * Wire form is {@code {"agent": {...}}} or {@code {"nestedWorkflow": {...}}}.
 */
public sealed interface StepTarget permits StepTarget.Agent, StepTarget.NestedWorkflow {

    String AGENT_KEY = "agent";
    String NESTED_WORKFLOW_KEY = "nestedWorkflow";

    record Agent(String canisterRef) implements StepTarget {
    }

    /**
     * Invokes another workflow. The reference is not checked for recursion back into the
     * referencing workflow.
     */
    record NestedWorkflow(String workflowRef, String inputMapping) implements StepTarget {
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static StepTarget fromJson(Map<String, Object> raw) {
        if (raw == null) {
            return null;
        }
        if (raw.get(NESTED_WORKFLOW_KEY) instanceof Map<?, ?> payload) {
            return new NestedWorkflow(text(payload.get("workflowRef")), text(payload.get("inputMapping")));
        }
        if (raw.get(AGENT_KEY) instanceof Map<?, ?> payload) {
            return new Agent(text(payload.get("canisterRef")));
        }
        throw new IllegalArgumentException("stepTarget must contain 'agent' or 'nestedWorkflow', got keys " + raw.keySet());
    }

    @JsonValue
    default Map<String, Object> toJson() {
        Map<String, Object> payload = new LinkedHashMap<>();
        String key;
        if (this instanceof NestedWorkflow nested) {
            key = NESTED_WORKFLOW_KEY;
            payload.put("workflowRef", nested.workflowRef());
            payload.put("inputMapping", nested.inputMapping());
        } else {
            key = AGENT_KEY;
            payload.put("canisterRef", ((Agent) this).canisterRef());
        }
        Map<String, Object> json = new LinkedHashMap<>();
        json.put(key, payload);
        return json;
    }

    private static String text(Object value) {
        return value != null ? value.toString() : null;
    }
}
