package com.rtcc.orchestrator.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Dispatchable unit of work, one per workflow step at run time.
 * Created by the workflow engine, owned by the kernel's queue until dispatched.
 * Priority 1 is served first.
 */
public record OrchestrationAction(
    String actionId,
    ActionType actionType,
    String targetSubsystem,
    Map<String, Object> parameters,
    int priority,
    Duration timeout,
    boolean requiresConfirmation,
    boolean confirmed,
    List<String> guardrails,
    ResourceRequirement resource,
    GeoLocation location,

    // Owner
    String workflowId,
    String executionId,
    String stepName,
    int stepIndex,

    int attempt,
    Instant createdAt
) {
    public OrchestrationAction {
        if (actionType == null) {
            throw new IllegalArgumentException("Action type is required");
        }
        if (targetSubsystem == null || targetSubsystem.isBlank()) {
            throw new IllegalArgumentException("Target subsystem is required");
        }
        if (actionId == null || actionId.isBlank()) {
            actionId = UUID.randomUUID().toString();
        }
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        guardrails = guardrails == null ? List.of() : List.copyOf(guardrails);
        if (attempt < 1) {
            attempt = 1;
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public boolean needsResource() {
        return resource != null;
    }

    public boolean isAwaitingConfirmation() {
        return requiresConfirmation && !confirmed;
    }

    public OrchestrationAction withAttempt(int nextAttempt) {
        return new OrchestrationAction(actionId, actionType, targetSubsystem, parameters, priority,
            timeout, requiresConfirmation, confirmed, guardrails, resource, location,
            workflowId, executionId, stepName, stepIndex, nextAttempt, createdAt);
    }

    public OrchestrationAction confirm() {
        return new OrchestrationAction(actionId, actionType, targetSubsystem, parameters, priority,
            timeout, requiresConfirmation, true, guardrails, resource, location,
            workflowId, executionId, stepName, stepIndex, attempt, createdAt);
    }

    public static Builder builder(ActionType actionType, String targetSubsystem) {
        return new Builder(actionType, targetSubsystem);
    }

    public static class Builder {
        private String actionId;
        private final ActionType actionType;
        private final String targetSubsystem;
        private Map<String, Object> parameters = Map.of();
        private int priority = Workflow.DEFAULT_PRIORITY;
        private Duration timeout;
        private boolean requiresConfirmation;
        private List<String> guardrails = List.of();
        private ResourceRequirement resource;
        private GeoLocation location;
        private String workflowId;
        private String executionId;
        private String stepName;
        private int stepIndex = -1;

        private Builder(ActionType actionType, String targetSubsystem) {
            this.actionType = actionType;
            this.targetSubsystem = targetSubsystem;
        }

        public Builder actionId(String actionId) {
            this.actionId = actionId;
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder requiresConfirmation(boolean requiresConfirmation) {
            this.requiresConfirmation = requiresConfirmation;
            return this;
        }

        public Builder guardrails(List<String> guardrails) {
            this.guardrails = guardrails;
            return this;
        }

        public Builder resource(ResourceRequirement resource) {
            this.resource = resource;
            return this;
        }

        public Builder location(GeoLocation location) {
            this.location = location;
            return this;
        }

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder step(String stepName, int stepIndex) {
            this.stepName = stepName;
            this.stepIndex = stepIndex;
            return this;
        }

        public OrchestrationAction build() {
            return new OrchestrationAction(actionId, actionType, targetSubsystem, parameters,
                priority, timeout, requiresConfirmation, false, guardrails, resource, location,
                workflowId, executionId, stepName, stepIndex, 1, null);
        }
    }
}
