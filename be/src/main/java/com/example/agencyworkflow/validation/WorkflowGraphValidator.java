package com.example.agencyworkflow.validation;

import com.example.agencyworkflow.compiler.CycleDetector;
import com.example.agencyworkflow.graph.ExecutionMode;
import com.example.agencyworkflow.graph.NodeKind;
import com.example.agencyworkflow.graph.NodeStatus;
import com.example.agencyworkflow.graph.WorkflowEdge;
import com.example.agencyworkflow.graph.WorkflowNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Structural checks on an editable graph. Returns findings as data and never mutates or throws.
 * <p>
 * Errors: agent without canister id, canister id that is not a canonical principal, any cycle
 * (reported once for the whole graph). Warnings: blank input template, unconnected nodes in
 * sequential mode, graphs above {@value #LARGE_WORKFLOW_THRESHOLD} nodes.
 * </p>
 */
public final class WorkflowGraphValidator {

    static final int LARGE_WORKFLOW_THRESHOLD = 10;

    private WorkflowGraphValidator() {
    }

    public static ValidationResult validate(List<WorkflowNode> nodes, List<WorkflowEdge> edges, ExecutionMode mode) {
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(edges, "edges");
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();

        for (WorkflowNode node : nodes) {
            validateNode(node, errors, warnings);
        }

        if (mode == ExecutionMode.SEQUENTIAL && nodes.size() > 1) {
            Set<String> connected = new HashSet<>();
            for (WorkflowEdge edge : edges) {
                connected.add(edge.source());
                connected.add(edge.target());
            }
            for (WorkflowNode node : nodes) {
                if (!connected.contains(node.id())) {
                    warnings.add(new ValidationIssue(node.id(), IssueType.PERFORMANCE,
                            "Agent \"" + node.displayName() + "\" is not connected to the workflow",
                            "Connect this agent to other agents to include it in the execution flow"));
                }
            }
        }

        if (CycleDetector.hasCycle(nodes, edges)) {
            errors.add(new ValidationIssue(null, IssueType.ERROR,
                    "Workflow contains circular dependencies",
                    "Remove connections that create loops in the workflow"));
        }

        if (nodes.size() > LARGE_WORKFLOW_THRESHOLD) {
            warnings.add(new ValidationIssue(null, IssueType.PERFORMANCE,
                    "Large workflow may impact execution performance",
                    "Consider breaking this into smaller sub-workflows"));
        }

        return ValidationResult.of(errors, warnings);
    }

    /**
     * Copies of {@code nodes} carrying the error messages found for them; nodes with errors get
     * {@link NodeStatus#ERROR}, agent nodes without errors {@link NodeStatus#VALID}.
     */
    public static List<WorkflowNode> annotate(List<WorkflowNode> nodes, ValidationResult result) {
        Map<String, List<String>> messagesByNode = new HashMap<>();
        for (ValidationIssue error : result.errors()) {
            if (error.nodeId() != null) {
                messagesByNode.computeIfAbsent(error.nodeId(), k -> new ArrayList<>()).add(error.message());
            }
        }
        return nodes.stream()
                .map(node -> {
                    List<String> messages = messagesByNode.getOrDefault(node.id(), List.of());
                    NodeStatus status = !messages.isEmpty()
                            ? NodeStatus.ERROR
                            : node.type() == NodeKind.AGENT ? NodeStatus.VALID : node.status();
                    return node.withValidation(status, messages);
                })
                .toList();
    }

    private static void validateNode(WorkflowNode node, List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        if (node.type() == NodeKind.AGENT && !node.hasCanisterRef()) {
            errors.add(new ValidationIssue(node.id(), IssueType.ERROR,
                    "Agent \"" + node.displayName() + "\" is missing a canister ID",
                    "Configure the agent by selecting a canister ID from available agents"));
        }
        if (node.hasCanisterRef() && !CanisterIdFormat.isValid(node.canisterRef())) {
            errors.add(new ValidationIssue(node.id(), IssueType.ERROR,
                    "Invalid canister ID format: " + node.canisterRef(),
                    "Enter a valid Internet Computer Principal ID"));
        }
        if (node.inputTemplate().isBlank()) {
            warnings.add(new ValidationIssue(node.id(), IssueType.BEST_PRACTICE,
                    "Agent \"" + node.displayName() + "\" has an empty input template",
                    "Provide an input template to define how data flows to this agent"));
        }
    }
}
