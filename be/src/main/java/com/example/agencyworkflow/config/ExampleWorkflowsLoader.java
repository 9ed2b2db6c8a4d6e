package com.example.agencyworkflow.config;

import com.example.agencyworkflow.api.v1.dto.WorkflowCreateRequest;
import com.example.agencyworkflow.api.v1.dto.WorkflowUpdateRequest;
import com.example.agencyworkflow.document.InvalidWorkflowJsonException;
import com.example.agencyworkflow.document.WorkflowDocument;
import com.example.agencyworkflow.document.WorkflowDocumentCodec;
import com.example.agencyworkflow.domain.WorkflowDefinition;
import com.example.agencyworkflow.graph.ExecutionMode;
import com.example.agencyworkflow.repository.WorkflowDefinitionRepository;
import com.example.agencyworkflow.service.WorkflowDefinitionService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Loads the sample workflow documents from {@code classpath:examples/} at startup.
 * Existing samples are updated in place (by name) so they stay in sync with the resources.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExampleWorkflowsLoader implements ApplicationRunner {

    private static final String EXAMPLES_DIR = "examples/";
    private static final Map<String, ExecutionMode> EXAMPLE_FILES = examples();

    private final WorkflowDefinitionRepository repository;
    private final WorkflowDefinitionService service;
    private final WorkflowDocumentCodec documentCodec;

    private static Map<String, ExecutionMode> examples() {
        Map<String, ExecutionMode> files = new LinkedHashMap<>();
        files.put("support-triage-workflow.json", ExecutionMode.CONDITIONAL);
        files.put("data-pipeline-workflow.json", ExecutionMode.SEQUENTIAL);
        files.put("report-fan-out-workflow.json", ExecutionMode.PARALLEL);
        return files;
    }

    @Override
    public void run(ApplicationArguments args) {
        EXAMPLE_FILES.forEach((filename, mode) -> loadExample(EXAMPLES_DIR + filename, mode));
    }

    private void loadExample(String path, ExecutionMode mode) {
        Resource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            log.warn("Example workflow resource not found: {}", path);
            return;
        }
        try (InputStream in = resource.getInputStream()) {
            WorkflowDocument document = documentCodec.importDocument(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            String name = document.metadata() != null ? document.metadata().name() : null;
            if (name == null || name.isBlank()) {
                log.warn("Example workflow {} has no name, skipping", path);
                return;
            }
            String description = document.metadata().description();
            Optional<WorkflowDefinition> existing = repository.findFirstByNameOrderByCreatedAtAsc(name);
            if (existing.isPresent()) {
                service.update(existing.get().getId(),
                        new WorkflowUpdateRequest(name, description, mode, document.nodes(), document.edges()));
                log.info("Updated example workflow: {}", name);
            } else {
                service.create(new WorkflowCreateRequest(name, description, mode, document.nodes(), document.edges()));
                log.info("Loaded example workflow: {}", name);
            }
        } catch (InvalidWorkflowJsonException e) {
            log.error("Failed to parse example workflow {}: {}", path, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } catch (IOException e) {
            log.error("Failed to read example workflow {}: {}", path, e.getMessage());
        }
    }
}
