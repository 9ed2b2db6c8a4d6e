package com.example.agencyworkflow.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One vertex of the editable workflow graph.
 * <p>
 * Only {@link NodeKind#AGENT} nodes with a non-blank {@code canisterRef} can become steps.
 * {@code position}, {@code icon}, {@code description}, {@code status} and
 * {@code validationErrors} are editor state and never reach the compiled schedule.
 * </p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowNode(
        String id,
        NodeKind type,
        Position position,
        String canisterRef,
        String displayName,
        String inputTemplate,
        Boolean requiresApproval,
        Boolean retryOnFailure,
        Integer timeoutSeconds,
        Map<String, Object> triggerConfig,
        StepTarget stepTarget,
        LoopConfig loopConfig,
        String description,
        String icon,
        NodeStatus status,
        List<String> validationErrors
) {
    public WorkflowNode {
        Objects.requireNonNull(id, "id");
        type = type != null ? type : NodeKind.AGENT;
        position = position != null ? position : Position.ORIGIN;
        displayName = displayName != null ? displayName : "";
        inputTemplate = inputTemplate != null ? inputTemplate : "";
        requiresApproval = Boolean.TRUE.equals(requiresApproval);
        retryOnFailure = Boolean.TRUE.equals(retryOnFailure);
        triggerConfig = triggerConfig != null ? Collections.unmodifiableMap(new LinkedHashMap<>(triggerConfig)) : null;
        validationErrors = validationErrors != null ? List.copyOf(validationErrors) : List.of();
    }

    /**
     * Minimal agent node; the remaining fields take their defaults.
     */
    public static WorkflowNode agent(String id, String canisterRef, String displayName, String inputTemplate) {
        return new WorkflowNode(id, NodeKind.AGENT, null, canisterRef, displayName, inputTemplate,
                false, false, null, null, null, null, null, null,
                canisterRef != null && !canisterRef.isBlank() ? NodeStatus.CONFIGURED : NodeStatus.UNCONFIGURED,
                null);
    }

    public WorkflowNode withPosition(Position newPosition) {
        return new WorkflowNode(id, type, newPosition, canisterRef, displayName, inputTemplate,
                requiresApproval, retryOnFailure, timeoutSeconds, triggerConfig, stepTarget, loopConfig,
                description, icon, status, validationErrors);
    }

    public WorkflowNode withValidation(NodeStatus newStatus, List<String> errors) {
        return new WorkflowNode(id, type, position, canisterRef, displayName, inputTemplate,
                requiresApproval, retryOnFailure, timeoutSeconds, triggerConfig, stepTarget, loopConfig,
                description, icon, newStatus, errors);
    }

    public boolean hasCanisterRef() {
        return canisterRef != null && !canisterRef.isBlank();
    }
}
