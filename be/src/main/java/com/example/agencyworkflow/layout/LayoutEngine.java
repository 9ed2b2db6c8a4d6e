package com.example.agencyworkflow.layout;

import com.example.agencyworkflow.compiler.TopologicalSorter;
import com.example.agencyworkflow.graph.ExecutionMode;
import com.example.agencyworkflow.graph.Position;
import com.example.agencyworkflow.graph.WorkflowEdge;
import com.example.agencyworkflow.graph.WorkflowNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Assigns canvas positions. Returns new node instances; inputs are left untouched.
 */
public final class LayoutEngine {

    static final double ORIGIN_X = 100;
    static final double COLUMN_WIDTH = 300;
    static final double SEQUENTIAL_Y = 200;
    static final double LEVEL_TOP = 100;
    static final double ROW_HEIGHT = 150;
    static final double SINGLE_NODE_OFFSET = 50;

    private LayoutEngine() {
    }

    public static List<WorkflowNode> layout(List<WorkflowNode> nodes, List<WorkflowEdge> edges, ExecutionMode mode) {
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(edges, "edges");
        if (mode == ExecutionMode.SEQUENTIAL) {
            return layoutSequential(nodes, edges);
        }
        if (mode == ExecutionMode.PARALLEL) {
            return layoutParallel(nodes, edges);
        }
        return layoutConditional(nodes, edges);
    }

    /**
     * Left to right in topological order. Nodes on a cycle are not part of the sorted order and
     * are therefore absent from the result.
     */
    static List<WorkflowNode> layoutSequential(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        List<WorkflowNode> sorted = TopologicalSorter.sort(nodes, edges);
        List<WorkflowNode> positioned = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            positioned.add(sorted.get(i).withPosition(new Position(ORIGIN_X + i * COLUMN_WIDTH, SEQUENTIAL_Y)));
        }
        return positioned;
    }

    /**
     * Columns by BFS level from all roots. A node's level is fixed when it is first dequeued,
     * so a merge node may sit at a shorter-path level than its longest predecessor chain.
     * Unreached nodes (cycle members) land in level 0.
     */
    static List<WorkflowNode> layoutParallel(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        Map<String, Integer> levels = levels(nodes, edges);

        Map<Integer, List<String>> groups = new HashMap<>();
        for (WorkflowNode node : nodes) {
            groups.computeIfAbsent(levels.getOrDefault(node.id(), 0), k -> new ArrayList<>()).add(node.id());
        }

        List<WorkflowNode> positioned = new ArrayList<>(nodes.size());
        for (WorkflowNode node : nodes) {
            int level = levels.getOrDefault(node.id(), 0);
            List<String> group = groups.get(level);
            int indexInGroup = group.indexOf(node.id());
            double y = LEVEL_TOP + indexInGroup * ROW_HEIGHT + (group.size() > 1 ? 0 : SINGLE_NODE_OFFSET);
            positioned.add(node.withPosition(new Position(ORIGIN_X + level * COLUMN_WIDTH, y)));
        }
        return positioned;
    }

    // Same as parallel until branches get their own arrangement.
    static List<WorkflowNode> layoutConditional(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        return layoutParallel(nodes, edges);
    }

    static Map<String, Integer> levels(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        Set<String> known = new HashSet<>();
        Map<String, Integer> incoming = new HashMap<>();
        for (WorkflowNode node : nodes) {
            known.add(node.id());
            incoming.put(node.id(), 0);
        }
        Map<String, List<String>> children = new HashMap<>();
        for (WorkflowEdge edge : edges) {
            incoming.merge(edge.target(), 1, Integer::sum);
            if (known.contains(edge.target())) {
                children.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge.target());
            }
        }

        record Pending(String nodeId, int level) {
        }
        Deque<Pending> queue = new ArrayDeque<>();
        for (WorkflowNode node : nodes) {
            if (incoming.get(node.id()) == 0) {
                queue.add(new Pending(node.id(), 0));
            }
        }

        Map<String, Integer> levels = new HashMap<>();
        while (!queue.isEmpty()) {
            Pending current = queue.poll();
            if (levels.containsKey(current.nodeId())) {
                continue;
            }
            levels.put(current.nodeId(), current.level());
            for (String child : children.getOrDefault(current.nodeId(), List.of())) {
                if (!levels.containsKey(child)) {
                    queue.add(new Pending(child, current.level() + 1));
                }
            }
        }
        return levels;
    }
}
