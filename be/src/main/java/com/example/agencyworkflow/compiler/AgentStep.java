package com.example.agencyworkflow.compiler;

import com.example.agencyworkflow.graph.LoopConfig;
import com.example.agencyworkflow.graph.StepTarget;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One compiled step. Its index in {@link CompiledSchedule#steps()} is its identity.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentStep(
        String agentCanisterId,
        String agentName,
        String inputTemplate,
        Boolean requiresApproval,
        Boolean retryOnFailure,
        Integer timeout,
        Map<String, Object> triggerConfig,
        StepTarget stepTarget,
        LoopConfig loopConfig
) {
    public AgentStep {
        agentName = agentName != null ? agentName : "";
        inputTemplate = inputTemplate != null ? inputTemplate : "";
        requiresApproval = Boolean.TRUE.equals(requiresApproval);
        retryOnFailure = Boolean.TRUE.equals(retryOnFailure);
        triggerConfig = triggerConfig != null ? Collections.unmodifiableMap(new LinkedHashMap<>(triggerConfig)) : null;
    }
}
