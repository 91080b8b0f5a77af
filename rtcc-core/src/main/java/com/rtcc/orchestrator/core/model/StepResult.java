package com.rtcc.orchestrator.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Recorded result of one step (or compensation step) of an execution.
 */
public record StepResult(
    String stepName,
    int stepIndex,
    boolean compensation,
    String actionId,
    StepStatus status,
    FailureKind failureKind,
    JsonNode output,
    String error,
    Instant dispatchedAt,
    Instant resolvedAt
) {
    public static StepResult dispatched(String stepName, int stepIndex, boolean compensation, String actionId) {
        return new StepResult(stepName, stepIndex, compensation, actionId, StepStatus.DISPATCHED,
            null, null, null, Instant.now(), null);
    }

    public StepResult resolve(StepStatus status, FailureKind failureKind, JsonNode output, String error) {
        return new StepResult(stepName, stepIndex, compensation, actionId, status, failureKind,
            output, error, dispatchedAt, Instant.now());
    }
}
