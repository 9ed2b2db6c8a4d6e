package com.example.agencyworkflow.service;

import com.example.agencyworkflow.api.WorkflowNotFoundException;
import com.example.agencyworkflow.api.v1.dto.WorkflowCreateRequest;
import com.example.agencyworkflow.api.v1.dto.WorkflowListItem;
import com.example.agencyworkflow.api.v1.dto.WorkflowResponse;
import com.example.agencyworkflow.api.v1.dto.WorkflowUpdateRequest;
import com.example.agencyworkflow.document.WorkflowDocument;
import com.example.agencyworkflow.document.WorkflowDocumentCodec;
import com.example.agencyworkflow.document.WorkflowMetadata;
import com.example.agencyworkflow.domain.WorkflowDefinition;
import com.example.agencyworkflow.graph.ExecutionMode;
import com.example.agencyworkflow.graph.WorkflowGraph;
import com.example.agencyworkflow.layout.ExecutionTimeEstimator;
import com.example.agencyworkflow.repository.WorkflowDefinitionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static java.util.Collections.unmodifiableList;

/**
 * Application service for workflow definition CRUD and document export/import.
 * <p>
 * Graphs are stored as JSON in {@link WorkflowDefinition#getGraphJson()} exactly as the editor
 * sent them: partially configured nodes and dangling edges are kept, since compilation drops
 * them silently later on.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowDefinitionService {

    private static final String IMPORTED_WORKFLOW_NAME = "Imported workflow";

    /** Names of sample workflows loaded from classpath at startup. */
    public static final List<String> EXAMPLE_WORKFLOW_NAMES = unmodifiableList(List.of(
            "Customer support triage",
            "Data processing pipeline",
            "Nightly report fan-out"
    ));

    private final WorkflowDefinitionRepository repository;
    private final WorkflowDocumentCodec documentCodec;
    private final JsonMapper jsonMapper;
    private final Clock clock;

    @Transactional
    public UUID create(WorkflowCreateRequest request) {
        WorkflowGraph graph = new WorkflowGraph(request.nodes(), request.edges());
        log.debug("Persisting new workflow name={} nodes={} edges={}", request.name(), graph.nodes().size(), graph.edges().size());
        Instant now = Instant.now(clock);
        UUID id = UUID.randomUUID();
        WorkflowDefinition entity = new WorkflowDefinition(
                id,
                request.name(),
                request.description(),
                modeOrDefault(request.executionMode()).code(),
                writeGraphAsJson(graph),
                now,
                now
        );
        repository.save(entity);
        log.debug("Persisted workflow id={}", id);
        return id;
    }

    @Transactional(readOnly = true)
    public List<WorkflowListItem> findAll() {
        List<WorkflowListItem> list = repository.findAll().stream()
                .map(this::toListItem)
                .toList();
        log.debug("findAll returned {} workflows", list.size());
        return list;
    }

    @Transactional(readOnly = true)
    public List<WorkflowListItem> findSamples() {
        List<WorkflowListItem> list = repository.findByNameIn(EXAMPLE_WORKFLOW_NAMES).stream()
                .map(this::toListItem)
                .toList();
        log.debug("findSamples returned {} workflows", list.size());
        return list;
    }

    @Transactional(readOnly = true)
    public WorkflowResponse findById(UUID id) {
        log.debug("Finding workflow by id={}", id);
        return toResponse(load(id));
    }

    @Transactional
    public WorkflowResponse update(UUID id, WorkflowUpdateRequest request) {
        log.debug("Updating workflow id={} name={}", id, request.name());
        WorkflowDefinition existing = load(id);
        WorkflowGraph graph = new WorkflowGraph(request.nodes(), request.edges());
        WorkflowDefinition updated = new WorkflowDefinition(
                existing.getId(),
                request.name(),
                request.description(),
                modeOrDefault(request.executionMode()).code(),
                writeGraphAsJson(graph),
                existing.getCreatedAt(),
                Instant.now(clock)
        );
        repository.save(updated);
        log.debug("Updated workflow id={}", id);
        return toResponse(updated);
    }

    @Transactional
    public void delete(UUID id) {
        log.debug("Deleting workflow id={}", id);
        if (!repository.existsById(id)) {
            throw new WorkflowNotFoundException(id);
        }
        repository.deleteById(id);
    }

    @Transactional(readOnly = true)
    public String exportDocument(UUID id) {
        WorkflowDefinition entity = load(id);
        return documentCodec.export(readGraphFromJson(entity.getGraphJson()),
                new WorkflowMetadata(entity.getName(), entity.getDescription()));
    }

    /**
     * Stores an exported document as a new workflow.
     *
     * @throws com.example.agencyworkflow.document.InvalidWorkflowJsonException if the document cannot be parsed
     */
    @Transactional
    public UUID importDocument(String json, ExecutionMode executionMode) {
        WorkflowDocument document = documentCodec.importDocument(json);
        WorkflowMetadata metadata = document.metadata();
        String name = metadata != null && metadata.name() != null && !metadata.name().isBlank()
                ? metadata.name()
                : IMPORTED_WORKFLOW_NAME;
        String description = metadata != null ? metadata.description() : null;
        return create(new WorkflowCreateRequest(name, description, executionMode, document.nodes(), document.edges()));
    }

    private WorkflowDefinition load(UUID id) {
        return repository.findById(id)
                .orElseThrow(() -> new WorkflowNotFoundException(id));
    }

    private WorkflowListItem toListItem(WorkflowDefinition entity) {
        return new WorkflowListItem(entity.getId(), entity.getName(),
                ExecutionMode.fromCode(entity.getExecutionMode()), entity.getUpdatedAt());
    }

    private WorkflowResponse toResponse(WorkflowDefinition entity) {
        WorkflowGraph graph = readGraphFromJson(entity.getGraphJson());
        return new WorkflowResponse(
                entity.getId(),
                entity.getName(),
                entity.getDescription(),
                ExecutionMode.fromCode(entity.getExecutionMode()),
                graph.nodes(),
                graph.edges(),
                ExecutionTimeEstimator.estimate(graph.nodes()),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }

    private static ExecutionMode modeOrDefault(ExecutionMode mode) {
        return mode != null ? mode : ExecutionMode.SEQUENTIAL;
    }

    private String writeGraphAsJson(WorkflowGraph graph) {
        try {
            return jsonMapper.writeValueAsString(graph);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize workflow graph", e);
        }
    }

    private WorkflowGraph readGraphFromJson(String graphJson) {
        try {
            WorkflowGraph graph = jsonMapper.readValue(graphJson, WorkflowGraph.class);
            return graph != null ? graph : WorkflowGraph.empty();
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to deserialize workflow graph", e);
        }
    }
}
