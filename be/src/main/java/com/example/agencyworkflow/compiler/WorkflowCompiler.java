package com.example.agencyworkflow.compiler;

import com.example.agencyworkflow.graph.WorkflowEdge;
import com.example.agencyworkflow.graph.WorkflowNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compiles an editable graph into an ordered step list and index-based connections.
 * <p>
 * Nodes are sorted globally, then filtered for eligibility; a step's index is its position
 * in the eligible subsequence. Edges with an ineligible endpoint are dropped without error.
 * Compilation never throws and returns an empty schedule when no node is eligible.
 * Cycle members are missing from the sorted order, so callers check
 * {@link CycleDetector#hasCycle} first.
 * </p>
 */
public final class WorkflowCompiler {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCompiler.class);

    private WorkflowCompiler() {
    }

    public static CompiledSchedule compile(List<WorkflowNode> nodes, List<WorkflowEdge> edges,
                                           String excludedRef, Collection<String> allowedRefs) {
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(edges, "edges");
        List<WorkflowNode> eligible = eligibleInOrder(nodes, edges, excludedRef, allowedRefs);
        List<AgentStep> steps = eligible.stream().map(WorkflowCompiler::toStep).toList();
        List<AgentConnection> connections = connect(eligible, edges);
        log.debug("Compiled nodeCount={} edgeCount={} into steps={} connections={}",
                nodes.size(), edges.size(), steps.size(), connections.size());
        return new CompiledSchedule(steps, connections);
    }

    public static CompiledSchedule compile(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        return compile(nodes, edges, null, null);
    }

    public static List<AgentStep> compileSteps(List<WorkflowNode> nodes, List<WorkflowEdge> edges,
                                               String excludedRef, Collection<String> allowedRefs) {
        return eligibleInOrder(nodes, edges, excludedRef, allowedRefs).stream()
                .map(WorkflowCompiler::toStep)
                .toList();
    }

    public static List<AgentConnection> compileConnections(List<WorkflowNode> nodes, List<WorkflowEdge> edges,
                                                           String excludedRef, Collection<String> allowedRefs) {
        return connect(eligibleInOrder(nodes, edges, excludedRef, allowedRefs), edges);
    }

    private static List<WorkflowNode> eligibleInOrder(List<WorkflowNode> nodes, List<WorkflowEdge> edges,
                                                      String excludedRef, Collection<String> allowedRefs) {
        List<WorkflowNode> sorted = TopologicalSorter.sort(nodes, edges);
        return EligibilityFilter.filter(sorted, excludedRef, allowedRefs);
    }

    private static List<AgentConnection> connect(List<WorkflowNode> eligible, List<WorkflowEdge> edges) {
        Map<String, Integer> stepIndexById = new HashMap<>();
        for (int i = 0; i < eligible.size(); i++) {
            stepIndexById.put(eligible.get(i).id(), i);
        }
        List<AgentConnection> connections = new ArrayList<>();
        for (WorkflowEdge edge : edges) {
            Integer source = stepIndexById.get(edge.source());
            Integer target = stepIndexById.get(edge.target());
            if (source == null || target == null) {
                log.debug("Dropping edge {} -> {}: endpoint is not an eligible step", edge.source(), edge.target());
                continue;
            }
            connections.add(new AgentConnection(source, target, edge.conditionOrAlways()));
        }
        return connections;
    }

    private static AgentStep toStep(WorkflowNode node) {
        return new AgentStep(
                node.canisterRef(),
                node.displayName(),
                node.inputTemplate(),
                node.requiresApproval(),
                node.retryOnFailure(),
                node.timeoutSeconds(),
                node.triggerConfig(),
                node.stepTarget(),
                node.loopConfig()
        );
    }
}
