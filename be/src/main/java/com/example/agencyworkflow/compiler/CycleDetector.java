package com.example.agencyworkflow.compiler;

import com.example.agencyworkflow.graph.WorkflowEdge;
import com.example.agencyworkflow.graph.WorkflowNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Depth-first search with a recursion stack. Independent of {@link TopologicalSorter};
 * a cycle is a hard compile error for callers.
 */
public final class CycleDetector {

    private CycleDetector() {
    }

    public static boolean hasCycle(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        Map<String, List<String>> adjacency = new HashMap<>();
        for (WorkflowNode node : nodes) {
            adjacency.put(node.id(), new ArrayList<>());
        }
        for (WorkflowEdge edge : edges) {
            adjacency.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge.target());
        }

        Set<String> visited = new HashSet<>();
        Set<String> onStack = new HashSet<>();
        for (WorkflowNode node : nodes) {
            if (!visited.contains(node.id()) && visit(node.id(), adjacency, visited, onStack)) {
                return true;
            }
        }
        return false;
    }

    private static boolean visit(String nodeId, Map<String, List<String>> adjacency,
                                 Set<String> visited, Set<String> onStack) {
        visited.add(nodeId);
        onStack.add(nodeId);
        for (String neighbor : adjacency.getOrDefault(nodeId, List.of())) {
            if (!visited.contains(neighbor)) {
                if (visit(neighbor, adjacency, visited, onStack)) {
                    return true;
                }
            } else if (onStack.contains(neighbor)) {
                return true;
            }
        }
        onStack.remove(nodeId);
        return false;
    }
}
