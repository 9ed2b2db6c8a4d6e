package com.example.agencyworkflow.compiler;

import com.example.agencyworkflow.graph.NodeKind;
import com.example.agencyworkflow.graph.WorkflowNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Decides which nodes qualify as executable steps.
 * <p>
 * Rejection is silent to the caller: nothing is thrown, the node is left out and the reason
 * is logged. Partially configured graphs therefore still compile to a smaller schedule.
 * A non-blank but malformed canister reference is still eligible; the validator reports it.
 * </p>
 */
public final class EligibilityFilter {

    private static final Logger log = LoggerFactory.getLogger(EligibilityFilter.class);

    private EligibilityFilter() {
    }

    /**
     * Order-preserving subset of {@code nodes} that may be compiled.
     *
     * @param excludedRef the workflow's own hosting canister; nodes pointing at it are dropped (nullable)
     * @param allowedRefs when non-empty, only these canister references are accepted (nullable)
     */
    public static List<WorkflowNode> filter(List<WorkflowNode> nodes, String excludedRef, Collection<String> allowedRefs) {
        Objects.requireNonNull(nodes, "nodes");
        return nodes.stream()
                .filter(node -> isEligible(node, excludedRef, allowedRefs))
                .toList();
    }

    public static boolean isEligible(WorkflowNode node, String excludedRef, Collection<String> allowedRefs) {
        if (node.type() != NodeKind.AGENT) {
            return false;
        }
        String ref = node.canisterRef();
        if (ref == null || ref.trim().isEmpty()) {
            log.warn("Agent node \"{}\" (id={}) has no canister id - skipping", node.displayName(), node.id());
            return false;
        }
        if (excludedRef != null && !excludedRef.isEmpty() && ref.equals(excludedRef)) {
            log.error("Agent node \"{}\" (id={}) references the workflow's own canister {} - skipping",
                    node.displayName(), node.id(), ref);
            return false;
        }
        if (allowedRefs != null && !allowedRefs.isEmpty() && !allowedRefs.contains(ref)) {
            log.warn("Agent node \"{}\" (id={}) has canister id {} which is not among the available agents - skipping",
                    node.displayName(), node.id(), ref);
            return false;
        }
        return true;
    }
}
