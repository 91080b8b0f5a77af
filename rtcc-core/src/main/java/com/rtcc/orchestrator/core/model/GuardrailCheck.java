package com.rtcc.orchestrator.core.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Result of evaluating one policy binding against one proposed action.
 * Append-only audit record.
 */
public record GuardrailCheck(
    String checkId,
    String bindingId,
    String bindingName,
    PolicyType policyType,
    String workflowId,
    String actionId,
    ActionType actionType,
    boolean passed,
    GuardrailSeverity severity,
    String message,
    List<String> violations,
    List<String> recommendations,
    double score,
    Instant timestamp
) {
    public GuardrailCheck {
        violations = violations == null ? List.of() : List.copyOf(violations);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public static GuardrailCheck of(
            PolicyBinding binding,
            String workflowId,
            String actionId,
            ActionType actionType,
            boolean passed,
            String message,
            List<String> violations,
            List<String> recommendations,
            double score) {
        return new GuardrailCheck(
            UUID.randomUUID().toString(),
            binding.bindingId(),
            binding.name(),
            binding.policyType(),
            workflowId,
            actionId,
            actionType,
            passed,
            binding.severity(),
            message,
            violations,
            recommendations,
            score,
            Instant.now()
        );
    }

    /**
     * A failed check that vetoes dispatch.
     */
    public boolean isBlockingFailure() {
        return !passed && severity.isBlocking();
    }
}
