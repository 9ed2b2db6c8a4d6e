package com.example.agencyworkflow.api.v1;

import com.example.agencyworkflow.api.v1.dto.CompileRequest;
import com.example.agencyworkflow.api.v1.dto.DecompileRequest;
import com.example.agencyworkflow.api.v1.dto.EstimateResponse;
import com.example.agencyworkflow.api.v1.dto.GraphRequest;
import com.example.agencyworkflow.api.v1.dto.GraphValidationResponse;
import com.example.agencyworkflow.compiler.CompiledSchedule;
import com.example.agencyworkflow.graph.WorkflowGraph;
import com.example.agencyworkflow.graph.WorkflowNode;
import com.example.agencyworkflow.service.WorkflowCompilationService;
import com.example.agencyworkflow.validation.ValidationResult;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Stateless graph operations for the editor: nothing is persisted.
 */
@RestController
@RequestMapping("/api/v1/graph")
@RequiredArgsConstructor
@Slf4j
public class GraphController {

    private final WorkflowCompilationService compilationService;

    @PostMapping("/compile")
    public ResponseEntity<CompiledSchedule> compile(@Valid @RequestBody CompileRequest request) {
        log.info("Compiling graph nodeCount={} edgeCount={}", request.nodes().size(), request.edges() != null ? request.edges().size() : 0);
        return ResponseEntity.ok(compilationService.compile(
                request.nodes(), request.edges(), request.excludedCanisterId(), request.allowedCanisterIds()));
    }

    @PostMapping("/decompile")
    public ResponseEntity<WorkflowGraph> decompile(@Valid @RequestBody DecompileRequest request) {
        log.info("Decompiling schedule stepCount={} connectionCount={}",
                request.steps().size(), request.connections() != null ? request.connections().size() : 0);
        return ResponseEntity.ok(compilationService.decompile(request.steps(), request.connections()));
    }

    @PostMapping("/validate")
    public ResponseEntity<GraphValidationResponse> validate(@Valid @RequestBody GraphRequest request) {
        log.info("Validating graph nodeCount={} mode={}", request.nodes().size(), request.modeOrDefault());
        ValidationResult result = compilationService.validate(request.nodes(), request.edgesOrEmpty(), request.modeOrDefault());
        List<WorkflowNode> annotated = compilationService.annotate(request.nodes(), result);
        return ResponseEntity.ok(new GraphValidationResponse(result, annotated));
    }

    @PostMapping("/layout")
    public ResponseEntity<List<WorkflowNode>> layout(@Valid @RequestBody GraphRequest request) {
        log.info("Laying out graph nodeCount={} mode={}", request.nodes().size(), request.modeOrDefault());
        return ResponseEntity.ok(compilationService.layout(request.nodes(), request.edgesOrEmpty(), request.modeOrDefault()));
    }

    @PostMapping("/estimate")
    public ResponseEntity<EstimateResponse> estimate(@Valid @RequestBody GraphRequest request) {
        log.debug("Estimating execution time nodeCount={}", request.nodes().size());
        return ResponseEntity.ok(new EstimateResponse(compilationService.estimate(request.nodes())));
    }
}
