package com.rtcc.orchestrator.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * Immutable workflow definition.
 * Registering a definition with an existing id replaces it for future executions only.
 *
 * Invariants (enforced on registration):
 * - at least one step
 * - step names are unique
 * - priority >= 1 (1 is highest)
 */
public record Workflow(
    // Identity
    String id,
    String name,
    String version,
    String category,
    String description,

    // Structure
    List<WorkflowTrigger> triggers,
    List<WorkflowStep> steps,
    List<WorkflowStep> compensationSteps,

    // Guardrails
    List<String> guardrails,
    List<String> legalGuardrails,
    List<String> ethicalGuardrails,

    // Policies
    Duration timeout,
    int priority,
    FailureStrategy failureStrategy,
    boolean enabled,

    Instant createdAt
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(300);
    public static final int DEFAULT_PRIORITY = 5;

    public Workflow {
        if (id == null || id.isBlank()) {
            id = slugOf(name);
        }
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
        steps = steps == null ? List.of() : List.copyOf(steps);
        compensationSteps = compensationSteps == null ? List.of() : List.copyOf(compensationSteps);
        guardrails = guardrails == null ? List.of() : List.copyOf(guardrails);
        legalGuardrails = legalGuardrails == null ? List.of() : List.copyOf(legalGuardrails);
        ethicalGuardrails = ethicalGuardrails == null ? List.of() : List.copyOf(ethicalGuardrails);
        if (timeout == null) {
            timeout = DEFAULT_TIMEOUT;
        }
        if (failureStrategy == null) {
            failureStrategy = FailureStrategy.ABORT;
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /**
     * Derive an id from a display name: "Gunfire Response" becomes "gunfire-response".
     */
    public static String slugOf(String name) {
        if (name == null) {
            return null;
        }
        String slug = name.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        return slug.replaceAll("(^-+)|(-+$)", "");
    }

    /**
     * All workflow-level guardrail names, generic then legal then ethical, without duplicates.
     */
    public List<String> allGuardrails() {
        LinkedHashSet<String> all = new LinkedHashSet<>(guardrails);
        all.addAll(legalGuardrails);
        all.addAll(ethicalGuardrails);
        return List.copyOf(all);
    }

    /**
     * Guardrails that apply to a step: the workflow's followed by the step's own.
     */
    public List<String> guardrailsFor(WorkflowStep step) {
        LinkedHashSet<String> all = new LinkedHashSet<>(allGuardrails());
        all.addAll(step.guardrails());
        return List.copyOf(all);
    }

    /**
     * Split steps into dispatch groups: each sequential step is a group of its own,
     * and every contiguous run of parallel steps forms one group.
     *
     * @return groups of step indices, in declared order
     */
    public List<List<Integer>> stepGroups() {
        List<List<Integer>> groups = new ArrayList<>();
        List<Integer> parallelRun = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).isParallel()) {
                parallelRun.add(i);
                continue;
            }
            if (!parallelRun.isEmpty()) {
                groups.add(List.copyOf(parallelRun));
                parallelRun.clear();
            }
            groups.add(List.of(i));
        }
        if (!parallelRun.isEmpty()) {
            groups.add(List.copyOf(parallelRun));
        }
        return List.copyOf(groups);
    }

    public boolean hasEventTriggers() {
        return triggers.stream().anyMatch(t -> t.type() == TriggerType.EVENT && t.enabled());
    }

    public Workflow withEnabled(boolean enabled) {
        return new Workflow(id, name, version, category, description, triggers, steps,
            compensationSteps, guardrails, legalGuardrails, ethicalGuardrails, timeout,
            priority, failureStrategy, enabled, createdAt);
    }

    /**
     * Builder for Workflow.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private String version = "1.0";
        private String category;
        private String description;
        private List<WorkflowTrigger> triggers = new ArrayList<>();
        private List<WorkflowStep> steps = new ArrayList<>();
        private List<WorkflowStep> compensationSteps = new ArrayList<>();
        private List<String> guardrails = List.of();
        private List<String> legalGuardrails = List.of();
        private List<String> ethicalGuardrails = List.of();
        private Duration timeout = DEFAULT_TIMEOUT;
        private int priority = DEFAULT_PRIORITY;
        private FailureStrategy failureStrategy = FailureStrategy.ABORT;
        private boolean enabled = true;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder trigger(WorkflowTrigger trigger) {
            this.triggers.add(trigger);
            return this;
        }

        public Builder triggers(List<WorkflowTrigger> triggers) {
            this.triggers = new ArrayList<>(triggers);
            return this;
        }

        public Builder step(WorkflowStep step) {
            this.steps.add(step);
            return this;
        }

        public Builder steps(List<WorkflowStep> steps) {
            this.steps = new ArrayList<>(steps);
            return this;
        }

        public Builder compensationStep(WorkflowStep step) {
            this.compensationSteps.add(step);
            return this;
        }

        public Builder compensationSteps(List<WorkflowStep> steps) {
            this.compensationSteps = new ArrayList<>(steps);
            return this;
        }

        public Builder guardrails(String... guardrails) {
            this.guardrails = List.of(guardrails);
            return this;
        }

        public Builder legalGuardrails(String... guardrails) {
            this.legalGuardrails = List.of(guardrails);
            return this;
        }

        public Builder ethicalGuardrails(String... guardrails) {
            this.ethicalGuardrails = List.of(guardrails);
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder failureStrategy(FailureStrategy failureStrategy) {
            this.failureStrategy = failureStrategy;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Workflow build() {
            return new Workflow(
                id, name, version, category, description, triggers, steps,
                compensationSteps, guardrails, legalGuardrails, ethicalGuardrails,
                timeout, priority, failureStrategy, enabled, null
            );
        }
    }
}
