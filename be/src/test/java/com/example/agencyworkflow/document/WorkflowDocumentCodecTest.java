package com.example.agencyworkflow.document;

import com.example.agencyworkflow.graph.EdgeCondition;
import com.example.agencyworkflow.graph.LoopConfig;
import com.example.agencyworkflow.graph.NodeKind;
import com.example.agencyworkflow.graph.Position;
import com.example.agencyworkflow.graph.StepTarget;
import com.example.agencyworkflow.graph.WorkflowEdge;
import com.example.agencyworkflow.graph.WorkflowGraph;
import com.example.agencyworkflow.graph.WorkflowNode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import tools.jackson.databind.json.JsonMapper;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("WorkflowDocumentCodec")
class WorkflowDocumentCodecTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final JsonMapper jsonMapper = JsonMapper.builder().build();
    private WorkflowDocumentCodec codec;

    @BeforeEach
    void setUp() {
        codec = new WorkflowDocumentCodec(jsonMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("export")
    class Export {

        @Test
        @DisplayName("round trips nodes, edges and metadata through import")
        void roundTrip() {
            WorkflowNode fetch = new WorkflowNode("fetch", NodeKind.AGENT, new Position(100, 200),
                    "ryjl3-tyaaa-aaaaa-aaaba-cai", "Fetcher", "fetch {{input}}", true, false, 30,
                    null, new StepTarget.Agent("ryjl3-tyaaa-aaaaa-aaaba-cai"),
                    new LoopConfig.ForEach("input.items", "item", "i", 10),
                    null, null, null, null);
            WorkflowNode publish = new WorkflowNode("publish", NodeKind.AGENT, null,
                    "r7inp-6aaaa-aaaaa-aaabq-cai", "Publisher", "", false, true, null,
                    Map.of("cron", "0 2 * * *"), new StepTarget.NestedWorkflow("publishing", "{}"),
                    new LoopConfig.WhileLoop("more", 5), null, null, null, null);
            WorkflowGraph graph = new WorkflowGraph(
                    List.of(fetch, publish),
                    List.of(WorkflowEdge.of("fetch", "publish", EdgeCondition.ifContains("tags", "urgent"))));

            String json = codec.export(graph, new WorkflowMetadata("Nightly", "Runs at night"));
            WorkflowDocument document = codec.importDocument(json);

            assertEquals(WorkflowDocument.CURRENT_VERSION, document.version());
            assertEquals(new WorkflowMetadata("Nightly", "Runs at night"), document.metadata());
            assertEquals(NOW.toString(), document.exportedAt());
            assertEquals(graph, document.graph());
        }

        @Test
        @DisplayName("writes the document envelope")
        void envelope() {
            String json = codec.export(WorkflowGraph.empty(), new WorkflowMetadata("Empty", null));
            Map<?, ?> raw = jsonMapper.readValue(json, Map.class);

            assertEquals("1.0", raw.get("version"));
            assertEquals("2026-03-01T12:00:00Z", raw.get("exportedAt"));
            assertEquals("Empty", ((Map<?, ?>) raw.get("metadata")).get("name"));
            assertEquals(List.of(), raw.get("nodes"));
        }
    }

    @Nested
    @DisplayName("import")
    class Import {

        @Test
        @DisplayName("reads missing nodes and edges as empty lists")
        void missingListsAreEmpty() {
            WorkflowDocument document = codec.importDocument("{\"version\":\"1.0\",\"metadata\":{\"name\":\"n\"}}");

            assertTrue(document.nodes().isEmpty());
            assertTrue(document.edges().isEmpty());
        }

        @Test
        @DisplayName("reads agent nodes that leave out the approval and retry flags")
        void nodesWithoutFlags() {
            WorkflowDocument document = codec.importDocument("""
                    {"version":"1.0","nodes":[{"id":"a","type":"agent","canisterRef":"ryjl3-tyaaa-aaaaa-aaaba-cai",
                      "displayName":"A","inputTemplate":"x"}],"edges":[]}
                    """);

            WorkflowNode node = document.nodes().get(0);
            assertEquals("ryjl3-tyaaa-aaaaa-aaaba-cai", node.canisterRef());
            assertEquals(false, node.requiresApproval());
            assertEquals(false, node.retryOnFailure());
            assertEquals(Position.ORIGIN, node.position());
        }

        @Test
        @DisplayName("reads a condition carrying several keys by precedence")
        void conditionPrecedence() {
            WorkflowDocument document = codec.importDocument("""
                    {
                      "nodes": [ { "id": "a" }, { "id": "b" } ],
                      "edges": [ { "source": "a", "target": "b", "condition": { "always": null, "onSuccess": null } } ]
                    }
                    """);

            assertEquals(EdgeCondition.onSuccess(), document.edges().get(0).condition());
            assertEquals("a->b", document.edges().get(0).id());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "null", "{not json", "[1, 2]", "{\"nodes\": [ { \"id\": \"a\", \"stepTarget\": { \"bogus\": {} } } ]}"})
        @DisplayName("rejects unparsable documents with a fixed message")
        void rejectsGarbage(String json) {
            InvalidWorkflowJsonException ex = assertThrows(InvalidWorkflowJsonException.class,
                    () -> codec.importDocument(json));

            assertEquals("Invalid workflow JSON format", ex.getMessage());
        }

        @Test
        @DisplayName("rejects a null document")
        void rejectsNull() {
            assertThrows(InvalidWorkflowJsonException.class, () -> codec.importDocument(null));
        }
    }
}
