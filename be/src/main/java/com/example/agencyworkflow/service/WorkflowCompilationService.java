package com.example.agencyworkflow.service;

import com.example.agencyworkflow.api.v1.dto.WorkflowResponse;
import com.example.agencyworkflow.compiler.AgentConnection;
import com.example.agencyworkflow.compiler.AgentStep;
import com.example.agencyworkflow.compiler.CompiledSchedule;
import com.example.agencyworkflow.compiler.CycleDetector;
import com.example.agencyworkflow.compiler.ScheduleDecompiler;
import com.example.agencyworkflow.compiler.WorkflowCompiler;
import com.example.agencyworkflow.config.WorkflowCompilerProperties;
import com.example.agencyworkflow.graph.ExecutionMode;
import com.example.agencyworkflow.graph.WorkflowEdge;
import com.example.agencyworkflow.graph.WorkflowGraph;
import com.example.agencyworkflow.graph.WorkflowNode;
import com.example.agencyworkflow.layout.ExecutionTimeEstimator;
import com.example.agencyworkflow.layout.LayoutEngine;
import com.example.agencyworkflow.validation.ValidationResult;
import com.example.agencyworkflow.validation.WorkflowGraphValidationException;
import com.example.agencyworkflow.validation.WorkflowGraphValidator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Entry point for compiling, decompiling, validating and laying out graphs.
 * <p>
 * Wraps the pure core with the caller-side policies: a cycle is a hard error before
 * compiling, the configured host canister is excluded by default, and a stored workflow
 * must compile to at least one step.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowCompilationService {

    private final WorkflowDefinitionService definitionService;
    private final WorkflowCompilerProperties properties;

    /**
     * Compiles a graph after checking it for cycles.
     *
     * @param excludedRef canister to exclude; the configured host canister when null
     * @param allowedRefs when non-empty, the only canisters accepted; the configured list when null
     * @throws WorkflowGraphValidationException if the graph contains a cycle
     */
    public CompiledSchedule compile(List<WorkflowNode> nodes, List<WorkflowEdge> edges,
                                    String excludedRef, List<String> allowedRefs) {
        List<WorkflowEdge> safeEdges = edges != null ? edges : List.of();
        if (CycleDetector.hasCycle(nodes, safeEdges)) {
            log.warn("Refusing to compile graph with circular dependencies nodes={} edges={}", nodes.size(), safeEdges.size());
            throw new WorkflowGraphValidationException("edges", "Workflow contains circular dependencies");
        }
        String excluded = excludedRef != null ? excludedRef : properties.hostCanisterId();
        List<String> allowed = allowedRefs != null ? allowedRefs : properties.allowedCanisterIds();
        CompiledSchedule schedule = WorkflowCompiler.compile(nodes, safeEdges, excluded, allowed);
        log.debug("Compiled graph nodes={} into steps={} connections={}",
                nodes.size(), schedule.steps().size(), schedule.connections().size());
        return schedule;
    }

    /**
     * Compiles a stored workflow for the execution runtime.
     *
     * @throws WorkflowGraphValidationException if the graph has a cycle or no eligible step
     */
    public CompiledSchedule scheduleFor(UUID workflowId, String excludedRef, List<String> allowedRefs) {
        WorkflowResponse workflow = definitionService.findById(workflowId);
        CompiledSchedule schedule = compile(workflow.nodes(), workflow.edges(), excludedRef, allowedRefs);
        if (schedule.isEmpty()) {
            log.warn("Workflow id={} has no eligible agent steps", workflowId);
            throw new WorkflowGraphValidationException("nodes",
                    "Workflow has no configured agent steps; add at least one agent with a canister ID");
        }
        return schedule;
    }

    public WorkflowGraph decompile(List<AgentStep> steps, List<AgentConnection> connections) {
        return ScheduleDecompiler.decompile(steps, connections);
    }

    public ValidationResult validate(List<WorkflowNode> nodes, List<WorkflowEdge> edges, ExecutionMode mode) {
        return WorkflowGraphValidator.validate(nodes, edges != null ? edges : List.of(), mode);
    }

    public ValidationResult validateStored(UUID workflowId) {
        WorkflowResponse workflow = definitionService.findById(workflowId);
        return validate(workflow.nodes(), workflow.edges(), workflow.executionMode());
    }

    public List<WorkflowNode> annotate(List<WorkflowNode> nodes, ValidationResult result) {
        return WorkflowGraphValidator.annotate(nodes, result);
    }

    public List<WorkflowNode> layout(List<WorkflowNode> nodes, List<WorkflowEdge> edges, ExecutionMode mode) {
        return LayoutEngine.layout(nodes, edges != null ? edges : List.of(), mode);
    }

    public String estimate(List<WorkflowNode> nodes) {
        return ExecutionTimeEstimator.estimate(nodes);
    }
}
