package com.example.agencyworkflow.compiler;

import com.example.agencyworkflow.graph.WorkflowEdge;
import com.example.agencyworkflow.graph.WorkflowNode;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("CycleDetector")
class CycleDetectorTest {

    private static WorkflowNode node(String id) {
        return WorkflowNode.agent(id, null, id, "");
    }

    @Test
    @DisplayName("finds A -> B -> C -> A next to an isolated node")
    void threeNodeCycle() {
        List<WorkflowNode> nodes = List.of(node("a"), node("b"), node("c"), node("d"));
        List<WorkflowEdge> edges = List.of(
                WorkflowEdge.of("a", "b"),
                WorkflowEdge.of("b", "c"),
                WorkflowEdge.of("c", "a"));

        assertTrue(CycleDetector.hasCycle(nodes, edges));
    }

    @Test
    @DisplayName("finds a self loop")
    void selfLoop() {
        assertTrue(CycleDetector.hasCycle(List.of(node("a")), List.of(WorkflowEdge.of("a", "a"))));
    }

    @Test
    @DisplayName("does not report a diamond as a cycle")
    void diamondIsAcyclic() {
        List<WorkflowNode> nodes = List.of(node("a"), node("b"), node("c"), node("d"));
        List<WorkflowEdge> edges = List.of(
                WorkflowEdge.of("a", "b"),
                WorkflowEdge.of("a", "c"),
                WorkflowEdge.of("b", "d"),
                WorkflowEdge.of("c", "d"));

        assertFalse(CycleDetector.hasCycle(nodes, edges));
    }

    @Test
    @DisplayName("empty graph has no cycle")
    void emptyGraph() {
        assertFalse(CycleDetector.hasCycle(List.of(), List.of()));
    }
}
