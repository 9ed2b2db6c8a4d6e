package com.example.agencyworkflow.api.v1;

import com.example.agencyworkflow.config.WorkflowCompilerProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Objects;

/**
 * Liveness of the workflow compiler service.
 * <p>
 * GET /api/v1/health also reports the host canister id the compiler excludes from every
 * schedule, so an editor can show which canister its workflows will run on.
 * </p>
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final WorkflowCompilerProperties properties;

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        log.trace("Health check");
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "service", "agency-workflow-be",
                "hostCanisterId", Objects.toString(properties.hostCanisterId(), "")));
    }
}
