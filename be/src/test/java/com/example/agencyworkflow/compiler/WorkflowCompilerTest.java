package com.example.agencyworkflow.compiler;

import com.example.agencyworkflow.graph.EdgeCondition;
import com.example.agencyworkflow.graph.NodeKind;
import com.example.agencyworkflow.graph.WorkflowEdge;
import com.example.agencyworkflow.graph.WorkflowNode;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("WorkflowCompiler")
class WorkflowCompilerTest {

    private static final String C1 = "ryjl3-tyaaa-aaaaa-aaaba-cai";
    private static final String C2 = "r7inp-6aaaa-aaaaa-aaabq-cai";
    private static final String HOST = "rrkah-fqaaa-aaaaa-aaaaq-cai";

    @Nested
    @DisplayName("steps")
    class Steps {

        @Test
        @DisplayName("compiles only the allowed node when allow-list is set and nothing is excluded")
        void filterComposition() {
            List<WorkflowNode> nodes = List.of(
                    WorkflowNode.agent("x", C1, "X", "do x"),
                    WorkflowNode.agent("y", "", "Y", "do y"));

            CompiledSchedule schedule = WorkflowCompiler.compile(nodes, List.of(), null, List.of(C1));

            assertEquals(1, schedule.steps().size());
            assertEquals("X", schedule.steps().get(0).agentName());
            assertEquals(C1, schedule.steps().get(0).agentCanisterId());
        }

        @Test
        @DisplayName("excludes the hosting canister when it is passed as excluded ref")
        void excludedHost() {
            List<WorkflowNode> nodes = List.of(
                    WorkflowNode.agent("x", C1, "X", ""),
                    WorkflowNode.agent("z", HOST, "Z", ""));

            CompiledSchedule schedule = WorkflowCompiler.compile(nodes, List.of(), HOST, null);

            assertThat(schedule.steps()).extracting(AgentStep::agentName).containsExactly("X");
        }

        @Test
        @DisplayName("steps follow topological order, not input order")
        void topologicalOrder() {
            List<WorkflowNode> nodes = List.of(
                    WorkflowNode.agent("second", C2, "Second", ""),
                    WorkflowNode.agent("first", C1, "First", ""));

            CompiledSchedule schedule = WorkflowCompiler.compile(nodes, List.of(WorkflowEdge.of("first", "second")));

            assertThat(schedule.steps()).extracting(AgentStep::agentName).containsExactly("First", "Second");
            assertEquals(List.of(new AgentConnection(0, 1, EdgeCondition.always())), schedule.connections());
        }

        @Test
        @DisplayName("copies every configuration field of the node")
        void configurationCopied() {
            WorkflowNode node = new WorkflowNode("n1", NodeKind.AGENT, null, C1, "Writer", "Write {{input}}",
                    true, true, 45, Map.of("cron", "* * * * *"), null, null,
                    "ignored", "ignored", null, null);

            AgentStep step = WorkflowCompiler.compile(List.of(node), List.of()).steps().get(0);

            assertEquals(new AgentStep(C1, "Writer", "Write {{input}}", true, true, 45,
                    Map.of("cron", "* * * * *"), null, null), step);
        }

        @Test
        @DisplayName("returns an empty schedule when nothing is eligible")
        void emptyWhenNothingEligible() {
            CompiledSchedule schedule = WorkflowCompiler.compile(
                    List.of(WorkflowNode.agent("a", "", "A", "")), List.of());

            assertTrue(schedule.isEmpty());
            assertTrue(schedule.connections().isEmpty());
        }
    }

    @Nested
    @DisplayName("connections")
    class Connections {

        @Test
        @DisplayName("maps node ids to step indices and keeps the condition")
        void indexMapping() {
            List<WorkflowNode> nodes = List.of(
                    WorkflowNode.agent("n1", C1, "X", ""),
                    WorkflowNode.agent("n2", C2, "Y", ""));
            List<WorkflowEdge> edges = List.of(WorkflowEdge.of("n1", "n2", EdgeCondition.onFailure()));

            CompiledSchedule schedule = WorkflowCompiler.compile(nodes, edges);

            assertEquals(List.of(new AgentConnection(0, 1, EdgeCondition.onFailure())), schedule.connections());
        }

        @Test
        @DisplayName("indices count eligible nodes only")
        void indicesSkipIneligibleNodes() {
            List<WorkflowNode> nodes = List.of(
                    WorkflowNode.agent("a", C1, "A", ""),
                    WorkflowNode.agent("gap", "", "Gap", ""),
                    WorkflowNode.agent("b", C2, "B", ""));
            List<WorkflowEdge> edges = List.of(WorkflowEdge.of("a", "b", EdgeCondition.onSuccess()));

            CompiledSchedule schedule = WorkflowCompiler.compile(nodes, edges);

            assertEquals(List.of(new AgentConnection(0, 1, EdgeCondition.onSuccess())), schedule.connections());
        }

        @Test
        @DisplayName("silently drops an edge into an ineligible node")
        void edgeToIneligibleDropped() {
            List<WorkflowNode> nodes = List.of(
                    WorkflowNode.agent("a", C1, "A", ""),
                    WorkflowNode.agent("b", "", "B", ""));

            CompiledSchedule schedule = WorkflowCompiler.compile(nodes, List.of(WorkflowEdge.of("a", "b")));

            assertEquals(1, schedule.steps().size());
            assertTrue(schedule.connections().isEmpty());
        }

        @Test
        @DisplayName("edge without a condition compiles to Always")
        void missingConditionIsAlways() {
            List<WorkflowNode> nodes = List.of(
                    WorkflowNode.agent("a", C1, "A", ""),
                    WorkflowNode.agent("b", C2, "B", ""));
            WorkflowEdge edge = new WorkflowEdge("e", "a", "b", null, null, null);

            CompiledSchedule schedule = WorkflowCompiler.compile(nodes, List.of(edge));

            assertTrue(schedule.connections().get(0).condition().isAlways());
        }
    }

    @Test
    @DisplayName("compiling the same input twice gives equal output")
    void deterministic() {
        List<WorkflowNode> nodes = List.of(
                WorkflowNode.agent("a", C1, "A", ""),
                WorkflowNode.agent("b", C2, "B", ""),
                WorkflowNode.agent("c", C1, "C", ""));
        List<WorkflowEdge> edges = List.of(
                WorkflowEdge.of("a", "c", EdgeCondition.ifEquals("status", "ok")),
                WorkflowEdge.of("b", "c"));

        assertEquals(WorkflowCompiler.compile(nodes, edges), WorkflowCompiler.compile(nodes, edges));
        assertEquals(WorkflowCompiler.compileSteps(nodes, edges, null, null), WorkflowCompiler.compile(nodes, edges).steps());
        assertEquals(WorkflowCompiler.compileConnections(nodes, edges, null, null), WorkflowCompiler.compile(nodes, edges).connections());
    }
}
