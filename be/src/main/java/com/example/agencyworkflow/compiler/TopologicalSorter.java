package com.example.agencyworkflow.compiler;

import com.example.agencyworkflow.graph.WorkflowEdge;
import com.example.agencyworkflow.graph.WorkflowNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Kahn's algorithm over node ids.
 * <p>
 * Zero in-degree nodes are seeded in input order and processed FIFO, so the result is
 * deterministic for a given input order. Nodes on a cycle never reach zero in-degree and
 * are silently left out: check {@link CycleDetector#hasCycle} before assuming the result
 * covers the whole graph.
 * </p>
 */
public final class TopologicalSorter {

    private TopologicalSorter() {
    }

    public static List<WorkflowNode> sort(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, List<String>> adjacency = new HashMap<>();
        Map<String, WorkflowNode> byId = new HashMap<>();
        for (WorkflowNode node : nodes) {
            inDegree.put(node.id(), 0);
            adjacency.put(node.id(), new ArrayList<>());
            byId.putIfAbsent(node.id(), node);
        }
        for (WorkflowEdge edge : edges) {
            adjacency.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge.target());
            inDegree.merge(edge.target(), 1, Integer::sum);
        }

        Deque<String> queue = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                queue.add(id);
            }
        });

        List<WorkflowNode> sorted = new ArrayList<>(nodes.size());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            WorkflowNode node = byId.get(current);
            if (node != null) {
                sorted.add(node);
            }
            for (String neighbor : adjacency.getOrDefault(current, List.of())) {
                int remaining = inDegree.getOrDefault(neighbor, 1) - 1;
                inDegree.put(neighbor, remaining);
                if (remaining == 0) {
                    queue.add(neighbor);
                }
            }
        }
        return sorted;
    }
}
