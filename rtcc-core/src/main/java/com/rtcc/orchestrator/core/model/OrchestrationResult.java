package com.rtcc.orchestrator.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one action, appended to the kernel's audit trail.
 *
 * Invariants:
 * - success implies failureKind == null and errors is empty
 * - a blocking guardrail failure always appears in errors and the audit trail
 */
public record OrchestrationResult(
    String resultId,
    String actionId,
    ActionType actionType,
    String targetSubsystem,
    String workflowId,
    String executionId,
    String stepName,
    boolean success,
    ActionStatus status,
    FailureKind failureKind,
    JsonNode output,
    List<String> errors,
    List<GuardrailCheck> guardrailChecks,
    String resourceId,
    List<String> auditTrail,
    int attempts,
    Instant startedAt,
    Instant completedAt
) {
    public OrchestrationResult {
        if (resultId == null) {
            resultId = UUID.randomUUID().toString();
        }
        errors = errors == null ? List.of() : List.copyOf(errors);
        guardrailChecks = guardrailChecks == null ? List.of() : List.copyOf(guardrailChecks);
        auditTrail = auditTrail == null ? List.of() : List.copyOf(auditTrail);
    }

    public Duration duration() {
        if (startedAt == null || completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, completedAt);
    }

    public static OrchestrationResult succeeded(
            OrchestrationAction action,
            JsonNode output,
            List<GuardrailCheck> checks,
            String resourceId,
            List<String> auditTrail,
            Instant startedAt) {
        return new OrchestrationResult(null, action.actionId(), action.actionType(),
            action.targetSubsystem(), action.workflowId(), action.executionId(), action.stepName(),
            true, ActionStatus.SUCCEEDED, null, output, List.of(), checks, resourceId, auditTrail,
            action.attempt(), startedAt, Instant.now());
    }

    public static OrchestrationResult failed(
            OrchestrationAction action,
            ActionStatus status,
            FailureKind failureKind,
            List<String> errors,
            List<GuardrailCheck> checks,
            String resourceId,
            List<String> auditTrail,
            Instant startedAt) {
        return new OrchestrationResult(null, action.actionId(), action.actionType(),
            action.targetSubsystem(), action.workflowId(), action.executionId(), action.stepName(),
            false, status, failureKind, null, errors, checks, resourceId, auditTrail,
            action.attempt(), startedAt, Instant.now());
    }
}
