package com.example.agencyworkflow.document;

import com.example.agencyworkflow.graph.WorkflowGraph;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import java.time.Clock;
import java.time.Instant;

/**
 * Writes and reads the JSON export document
 * {@code {version, metadata: {name, description}, nodes, edges, exportedAt}}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkflowDocumentCodec {

    private final JsonMapper jsonMapper;
    private final Clock clock;

    public WorkflowDocument toDocument(WorkflowGraph graph, WorkflowMetadata metadata) {
        return new WorkflowDocument(
                WorkflowDocument.CURRENT_VERSION,
                metadata,
                graph.nodes(),
                graph.edges(),
                Instant.now(clock).toString()
        );
    }

    public String export(WorkflowGraph graph, WorkflowMetadata metadata) {
        WorkflowDocument document = toDocument(graph, metadata);
        try {
            String json = jsonMapper.writer().withDefaultPrettyPrinter().writeValueAsString(document);
            log.debug("Exported workflow name={} nodes={} edges={}",
                    metadata != null ? metadata.name() : null, graph.nodes().size(), graph.edges().size());
            return json;
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize workflow document", e);
        }
    }

    /**
     * Parses an exported document.
     *
     * @throws InvalidWorkflowJsonException on any parse failure, with no partial result
     */
    public WorkflowDocument importDocument(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidWorkflowJsonException();
        }
        WorkflowDocument document;
        try {
            document = jsonMapper.readValue(json, WorkflowDocument.class);
        } catch (JacksonException | IllegalArgumentException e) {
            log.warn("Rejected workflow document: {}", e.getMessage());
            throw new InvalidWorkflowJsonException(e);
        }
        if (document == null) {
            throw new InvalidWorkflowJsonException();
        }
        log.debug("Imported workflow document version={} nodes={} edges={}",
                document.version(), document.nodes().size(), document.edges().size());
        return document;
    }
}
