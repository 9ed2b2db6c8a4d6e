package com.example.agencyworkflow.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Settings under {@code agency.workflow}.
 *
 * @param hostCanisterId     canister hosting the workflow itself; excluded from compiled steps by default
 * @param allowedCanisterIds when non-empty, the only agent canisters stored workflows may compile against
 * @param corsAllowedOrigins origins allowed to call {@code /api/**}
 */
@ConfigurationProperties(prefix = "agency.workflow")
public record WorkflowCompilerProperties(
        String hostCanisterId,
        List<String> allowedCanisterIds,
        List<String> corsAllowedOrigins
) {
    public WorkflowCompilerProperties {
        allowedCanisterIds = allowedCanisterIds != null ? List.copyOf(allowedCanisterIds) : List.of();
        corsAllowedOrigins = corsAllowedOrigins != null ? List.copyOf(corsAllowedOrigins) : List.of();
    }
}
