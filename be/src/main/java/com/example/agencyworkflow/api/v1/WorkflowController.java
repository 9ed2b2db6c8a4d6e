package com.example.agencyworkflow.api.v1;

import com.example.agencyworkflow.api.v1.dto.WorkflowCreateRequest;
import com.example.agencyworkflow.api.v1.dto.WorkflowIdResponse;
import com.example.agencyworkflow.api.v1.dto.WorkflowListResponse;
import com.example.agencyworkflow.api.v1.dto.WorkflowResponse;
import com.example.agencyworkflow.api.v1.dto.WorkflowUpdateRequest;
import com.example.agencyworkflow.compiler.CompiledSchedule;
import com.example.agencyworkflow.graph.ExecutionMode;
import com.example.agencyworkflow.service.WorkflowCompilationService;
import com.example.agencyworkflow.service.WorkflowDefinitionService;
import com.example.agencyworkflow.validation.ValidationResult;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for stored workflows.
 * <p>
 * Exposes {@code /api/v1/workflows} for CRUD, document export/import, and the compiled
 * schedule and validation report of a stored workflow.
 * </p>
 */
@RestController
@RequestMapping("/api/v1/workflows")
@RequiredArgsConstructor
@Slf4j
public class WorkflowController {

    private final WorkflowDefinitionService service;
    private final WorkflowCompilationService compilationService;

    @PostMapping
    public ResponseEntity<WorkflowIdResponse> create(@Valid @RequestBody WorkflowCreateRequest request) {
        log.info("Creating workflow name={} nodeCount={}", request.name(), request.nodes() != null ? request.nodes().size() : 0);
        UUID id = service.create(request);
        log.info("Created workflow id={} name={}", id, request.name());
        return ResponseEntity.status(HttpStatus.CREATED).body(new WorkflowIdResponse(id));
    }

    @GetMapping
    public ResponseEntity<WorkflowListResponse> list() {
        log.debug("Listing all workflows");
        return ResponseEntity.ok(new WorkflowListResponse(service.findAll()));
    }

    @GetMapping("/samples")
    public ResponseEntity<WorkflowListResponse> samples() {
        log.debug("Listing sample workflows");
        return ResponseEntity.ok(new WorkflowListResponse(service.findSamples()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<WorkflowResponse> getById(@PathVariable UUID id) {
        log.info("Getting workflow id={}", id);
        return ResponseEntity.ok(service.findById(id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<WorkflowResponse> update(@PathVariable UUID id, @Valid @RequestBody WorkflowUpdateRequest request) {
        log.info("Updating workflow id={} name={} nodeCount={}", id, request.name(), request.nodes() != null ? request.nodes().size() : 0);
        return ResponseEntity.ok(service.update(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        log.info("Deleting workflow id={}", id);
        service.delete(id);
        log.info("Deleted workflow id={}", id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping(value = "/{id}/export", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> export(@PathVariable UUID id) {
        log.info("Exporting workflow id={}", id);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(service.exportDocument(id));
    }

    @PostMapping(value = "/import", consumes = {MediaType.APPLICATION_JSON_VALUE, MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<WorkflowIdResponse> importDocument(
            @RequestBody String document,
            @RequestParam(name = "mode", required = false) String mode) {
        log.info("Importing workflow document length={}", document.length());
        UUID id = service.importDocument(document, ExecutionMode.fromCode(mode));
        log.info("Imported workflow id={}", id);
        return ResponseEntity.status(HttpStatus.CREATED).body(new WorkflowIdResponse(id));
    }

    @GetMapping("/{id}/schedule")
    public ResponseEntity<CompiledSchedule> schedule(
            @PathVariable UUID id,
            @RequestParam(name = "excludedCanisterId", required = false) String excludedCanisterId,
            @RequestParam(name = "allowedCanisterIds", required = false) List<String> allowedCanisterIds) {
        log.info("Compiling schedule for workflow id={}", id);
        return ResponseEntity.ok(compilationService.scheduleFor(id, excludedCanisterId, allowedCanisterIds));
    }

    @GetMapping("/{id}/validation")
    public ResponseEntity<ValidationResult> validation(@PathVariable UUID id) {
        log.info("Validating workflow id={}", id);
        return ResponseEntity.ok(compilationService.validateStored(id));
    }
}
