package com.rtcc.orchestrator.core.model;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * One unit of a workflow, turned into an action at run time.
 */
public record WorkflowStep(
    String name,
    ActionType actionType,
    String targetSubsystem,
    Map<String, Object> parameters,
    StepExecutionMode mode,
    Duration timeout,
    List<String> guardrails,
    boolean required,
    boolean requiresConfirmation,
    ResourceRequirement resource
) {
    public WorkflowStep {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Step name cannot be empty");
        }
        if (actionType == null) {
            throw new IllegalArgumentException("Step '" + name + "' has no action type");
        }
        if (targetSubsystem == null || targetSubsystem.isBlank()) {
            throw new IllegalArgumentException("Step '" + name + "' has no target subsystem");
        }
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        if (mode == null) {
            mode = StepExecutionMode.SEQUENTIAL;
        }
        guardrails = guardrails == null ? List.of() : List.copyOf(guardrails);
    }

    public boolean isParallel() {
        return mode == StepExecutionMode.PARALLEL;
    }

    public static Builder builder(String name, ActionType actionType, String targetSubsystem) {
        return new Builder(name, actionType, targetSubsystem);
    }

    public static class Builder {
        private final String name;
        private final ActionType actionType;
        private final String targetSubsystem;
        private Map<String, Object> parameters = Map.of();
        private StepExecutionMode mode = StepExecutionMode.SEQUENTIAL;
        private Duration timeout;
        private List<String> guardrails = List.of();
        private boolean required = true;
        private boolean requiresConfirmation;
        private ResourceRequirement resource;

        private Builder(String name, ActionType actionType, String targetSubsystem) {
            this.name = name;
            this.actionType = actionType;
            this.targetSubsystem = targetSubsystem;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder parallel() {
            this.mode = StepExecutionMode.PARALLEL;
            return this;
        }

        public Builder mode(StepExecutionMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder guardrails(String... guardrails) {
            this.guardrails = List.of(guardrails);
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder requiresConfirmation(boolean requiresConfirmation) {
            this.requiresConfirmation = requiresConfirmation;
            return this;
        }

        public Builder resource(ResourceRequirement resource) {
            this.resource = resource;
            return this;
        }

        public WorkflowStep build() {
            return new WorkflowStep(name, actionType, targetSubsystem, parameters, mode, timeout,
                guardrails, required, requiresConfirmation, resource);
        }
    }
}
