package com.example.agencyworkflow.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tools.jackson.databind.json.JsonMapper;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("WorkflowNode JSON")
class WorkflowNodeTest {

    private final JsonMapper jsonMapper = JsonMapper.builder().build();

    @Test
    @DisplayName("reads a node carrying only its id with every default applied")
    void minimalNode() {
        WorkflowNode node = jsonMapper.readValue("{\"id\":\"a\"}", WorkflowNode.class);

        assertEquals("a", node.id());
        assertEquals(NodeKind.AGENT, node.type());
        assertEquals(Position.ORIGIN, node.position());
        assertEquals("", node.displayName());
        assertEquals("", node.inputTemplate());
        assertFalse(node.requiresApproval());
        assertFalse(node.retryOnFailure());
        assertNull(node.timeoutSeconds());
        assertTrue(node.validationErrors().isEmpty());
    }

    @Test
    @DisplayName("reads explicit flags and null flags")
    void flags() {
        WorkflowNode set = jsonMapper.readValue(
                "{\"id\":\"a\",\"requiresApproval\":true,\"retryOnFailure\":true}", WorkflowNode.class);
        WorkflowNode nulls = jsonMapper.readValue(
                "{\"id\":\"a\",\"requiresApproval\":null,\"retryOnFailure\":null}", WorkflowNode.class);

        assertTrue(set.requiresApproval());
        assertTrue(set.retryOnFailure());
        assertFalse(nulls.requiresApproval());
        assertFalse(nulls.retryOnFailure());
    }

    @Test
    @DisplayName("reads a partial position with the missing coordinate at 0")
    void partialPosition() {
        WorkflowNode node = jsonMapper.readValue("{\"id\":\"a\",\"position\":{\"x\":250}}", WorkflowNode.class);

        assertEquals(new Position(250, 0), node.position());
    }

    @Test
    @DisplayName("reads a configured agent node as the editor sends it")
    void editorNode() {
        WorkflowNode node = jsonMapper.readValue("""
                {
                  "id": "classify",
                  "type": "agent",
                  "canisterRef": "ryjl3-tyaaa-aaaaa-aaaba-cai",
                  "displayName": "Classifier",
                  "inputTemplate": "classify {{input}}",
                  "timeoutSeconds": 60,
                  "status": "configured",
                  "validationErrors": []
                }
                """, WorkflowNode.class);

        assertEquals(WorkflowNode.agent("classify", "ryjl3-tyaaa-aaaaa-aaaba-cai", "Classifier", "classify {{input}}")
                .withPosition(Position.ORIGIN), withoutTimeout(node));
        assertEquals(60, node.timeoutSeconds());
        assertEquals(List.of(), node.validationErrors());
    }

    private static WorkflowNode withoutTimeout(WorkflowNode node) {
        return new WorkflowNode(node.id(), node.type(), node.position(), node.canisterRef(), node.displayName(),
                node.inputTemplate(), node.requiresApproval(), node.retryOnFailure(), null, node.triggerConfig(),
                node.stepTarget(), node.loopConfig(), node.description(), node.icon(), node.status(),
                node.validationErrors());
    }
}
