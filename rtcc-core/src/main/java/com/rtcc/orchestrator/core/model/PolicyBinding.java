package com.rtcc.orchestrator.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * A named policy rule bound to workflows and action types.
 *
 * Workflow filter entries match a workflow exactly, a trailing {@code *} makes the
 * entry a prefix, and {@code *} alone or an empty set matches every workflow.
 * An empty action set matches every action type.
 */
public record PolicyBinding(
    String bindingId,
    String name,
    PolicyType policyType,
    GuardrailSeverity severity,
    String description,
    Set<String> workflows,
    Set<ActionType> actions,
    List<String> conditions,
    List<String> requirements,
    List<String> prohibitions,
    boolean enabled,
    Instant createdAt
) {
    public static final String WILDCARD = "*";

    public PolicyBinding {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Binding name cannot be empty");
        }
        if (policyType == null) {
            throw new IllegalArgumentException("Binding policy type is required");
        }
        if (severity == null) {
            severity = GuardrailSeverity.WARNING;
        }
        if (bindingId == null || bindingId.isBlank()) {
            bindingId = UUID.randomUUID().toString();
        }
        workflows = workflows == null ? Set.of() : Set.copyOf(workflows);
        actions = actions == null ? Set.of() : Set.copyOf(actions);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
        prohibitions = prohibitions == null ? List.of() : List.copyOf(prohibitions);
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /**
     * Check the workflow filter against a workflow id or display name.
     * Entries and candidates are compared in slug form, so "Gunfire Response"
     * and "gunfire-response" name the same workflow.
     */
    public boolean appliesToWorkflow(String workflow) {
        if (workflows.isEmpty() || workflows.contains(WILDCARD)) {
            return true;
        }
        if (workflow == null) {
            return false;
        }
        String candidate = Workflow.slugOf(workflow);
        for (String pattern : workflows) {
            if (pattern.endsWith(WILDCARD)) {
                if (candidate.startsWith(Workflow.slugOf(pattern.substring(0, pattern.length() - 1)))) {
                    return true;
                }
            } else if (candidate.equals(Workflow.slugOf(pattern))) {
                return true;
            }
        }
        return false;
    }

    public boolean appliesToAction(ActionType actionType) {
        return actions.isEmpty() || actions.contains(actionType);
    }

    public PolicyBinding withEnabled(boolean enabled) {
        return new PolicyBinding(bindingId, name, policyType, severity, description, workflows,
            actions, conditions, requirements, prohibitions, enabled, createdAt);
    }

    public static Builder builder(String name, PolicyType policyType) {
        return new Builder(name, policyType);
    }

    public static class Builder {
        private String bindingId;
        private final String name;
        private final PolicyType policyType;
        private GuardrailSeverity severity = GuardrailSeverity.WARNING;
        private String description;
        private Set<String> workflows = Set.of();
        private Set<ActionType> actions = Set.of();
        private List<String> conditions = List.of();
        private List<String> requirements = List.of();
        private List<String> prohibitions = List.of();
        private boolean enabled = true;

        private Builder(String name, PolicyType policyType) {
            this.name = name;
            this.policyType = policyType;
        }

        public Builder bindingId(String bindingId) {
            this.bindingId = bindingId;
            return this;
        }

        public Builder severity(GuardrailSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder workflows(String... workflows) {
            this.workflows = Set.of(workflows);
            return this;
        }

        public Builder actions(ActionType... actions) {
            this.actions = Set.of(actions);
            return this;
        }

        public Builder conditions(String... conditions) {
            this.conditions = List.of(conditions);
            return this;
        }

        public Builder requirements(String... requirements) {
            this.requirements = List.of(requirements);
            return this;
        }

        public Builder prohibitions(String... prohibitions) {
            this.prohibitions = List.of(prohibitions);
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public PolicyBinding build() {
            return new PolicyBinding(bindingId, name, policyType, severity, description, workflows,
                actions, conditions, requirements, prohibitions, enabled, null);
        }
    }
}
