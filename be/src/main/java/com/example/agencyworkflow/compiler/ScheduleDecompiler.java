package com.example.agencyworkflow.compiler;

import com.example.agencyworkflow.graph.EdgeCondition;
import com.example.agencyworkflow.graph.EdgeType;
import com.example.agencyworkflow.graph.LoopConfig;
import com.example.agencyworkflow.graph.NodeKind;
import com.example.agencyworkflow.graph.NodeStatus;
import com.example.agencyworkflow.graph.Position;
import com.example.agencyworkflow.graph.StepTarget;
import com.example.agencyworkflow.graph.WorkflowEdge;
import com.example.agencyworkflow.graph.WorkflowGraph;
import com.example.agencyworkflow.graph.WorkflowNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rebuilds an editable graph from a compiled schedule.
 * <p>
 * Node ids ({@code step-<i>}) and positions are regenerated, so a round trip through
 * {@link WorkflowCompiler} preserves step content and edge conditions but not identity.
 * Without connections the steps are chained linearly with {@code Always} edges.
 * </p>
 */
public final class ScheduleDecompiler {

    private static final Logger log = LoggerFactory.getLogger(ScheduleDecompiler.class);

    static final String NODE_ID_PREFIX = "step-";
    static final String EDGE_ID_PREFIX = "edge-";

    private ScheduleDecompiler() {
    }

    public static WorkflowGraph decompile(List<AgentStep> steps, List<AgentConnection> connections) {
        Objects.requireNonNull(steps, "steps");
        List<WorkflowNode> nodes = new ArrayList<>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            nodes.add(toNode(steps.get(i), i));
        }

        List<WorkflowEdge> edges = new ArrayList<>();
        if (connections != null && !connections.isEmpty()) {
            for (int i = 0; i < connections.size(); i++) {
                AgentConnection connection = connections.get(i);
                if (!connection.resolvesWithin(nodes.size())) {
                    log.warn("Skipping connection {} with unresolved step index: {}", i, connection);
                    continue;
                }
                EdgeCondition condition = connection.condition();
                edges.add(new WorkflowEdge(
                        EDGE_ID_PREFIX + i,
                        nodes.get(connection.sourceStepIndex()).id(),
                        nodes.get(connection.targetStepIndex()).id(),
                        condition.isAlways() ? EdgeType.DEFAULT : EdgeType.CONDITIONAL,
                        condition,
                        ConditionLabels.label(condition)
                ));
            }
        } else {
            for (int i = 0; i < nodes.size() - 1; i++) {
                edges.add(new WorkflowEdge(
                        EDGE_ID_PREFIX + i,
                        nodes.get(i).id(),
                        nodes.get(i + 1).id(),
                        EdgeType.DEFAULT,
                        EdgeCondition.always(),
                        null
                ));
            }
        }
        log.debug("Decompiled steps={} into nodes={} edges={}", steps.size(), nodes.size(), edges.size());
        return new WorkflowGraph(nodes, edges);
    }

    public static WorkflowGraph decompile(List<AgentStep> steps) {
        return decompile(steps, null);
    }

    private static WorkflowNode toNode(AgentStep step, int index) {
        String icon = AgentIcons.iconFor(step.agentName());
        String description = "Agent: " + step.agentName();
        if (step.stepTarget() instanceof StepTarget.NestedWorkflow nested) {
            icon = AgentIcons.NESTED_WORKFLOW_ICON;
            description = "Sub-workflow: " + nested.workflowRef();
        }
        description += loopSuffix(step.loopConfig());

        boolean configured = (step.agentCanisterId() != null && !step.agentCanisterId().isEmpty())
                || step.stepTarget() != null;
        return new WorkflowNode(
                NODE_ID_PREFIX + index,
                NodeKind.AGENT,
                new Position(100 + index * 300, 100),
                step.agentCanisterId(),
                step.agentName(),
                step.inputTemplate(),
                step.requiresApproval(),
                step.retryOnFailure(),
                step.timeout(),
                step.triggerConfig(),
                step.stepTarget(),
                step.loopConfig(),
                description,
                icon,
                configured ? NodeStatus.CONFIGURED : NodeStatus.UNCONFIGURED,
                List.of()
        );
    }

    private static String loopSuffix(LoopConfig loop) {
        if (loop instanceof LoopConfig.ForEach forEach) {
            return " (Loop: for each in " + forEach.arraySource() + ")";
        }
        if (loop instanceof LoopConfig.WhileLoop whileLoop) {
            return " (Loop: while " + whileLoop.condition() + ")";
        }
        if (loop instanceof LoopConfig.Repeat repeat) {
            return " (Loop: repeat " + repeat.count() + " times)";
        }
        return "";
    }
}
