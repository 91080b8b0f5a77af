package com.rtcc.orchestrator.core.model;

import com.rtcc.orchestrator.core.exception.InvalidStateTransitionException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * A single run of a workflow, created per trigger match.
 * Never shared between triggers.
 *
 * Invariants:
 * - status transitions follow the execution state machine
 * - actionIds only grows
 * - at most one step result per action id
 */
public record WorkflowExecution(
    // Identity
    String executionId,
    String workflowId,
    String workflowName,
    String workflowVersion,

    // Trigger
    TriggerType triggerType,
    String triggerEventId,
    Map<String, Object> triggerContext,

    // State
    ExecutionStatus status,
    int priority,
    int currentGroup,
    List<Integer> currentStepIndices,
    boolean compensating,
    List<StepResult> stepResults,
    List<String> actionIds,
    String error,

    // Timing
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Instant deadline
) {
    public WorkflowExecution {
        triggerContext = triggerContext == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(triggerContext));
        currentStepIndices = currentStepIndices == null ? List.of() : List.copyOf(currentStepIndices);
        stepResults = stepResults == null ? List.of() : List.copyOf(stepResults);
        actionIds = actionIds == null ? List.of() : List.copyOf(actionIds);
    }

    /**
     * Create a new execution in PENDING state.
     */
    public static WorkflowExecution create(
            Workflow workflow,
            TriggerType triggerType,
            String triggerEventId,
            Map<String, Object> triggerContext) {
        Instant now = Instant.now();
        return new WorkflowExecution(
            UUID.randomUUID().toString(),
            workflow.id(),
            workflow.name(),
            workflow.version(),
            triggerType,
            triggerEventId,
            triggerContext,
            ExecutionStatus.PENDING,
            workflow.priority(),
            -1,
            List.of(),
            false,
            List.of(),
            List.of(),
            null,
            now,
            null,
            null,
            now.plus(workflow.timeout())
        );
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Find the result recorded for an action.
     */
    public Optional<StepResult> resultFor(String actionId) {
        return stepResults.stream().filter(r -> actionId.equals(r.actionId())).findFirst();
    }

    public Duration elapsed() {
        Instant start = startedAt != null ? startedAt : createdAt;
        Instant end = completedAt != null ? completedAt : Instant.now();
        return Duration.between(start, end);
    }

    /**
     * Create a copy in the target state.
     *
     * @throws InvalidStateTransitionException if the state machine forbids the move
     */
    public WorkflowExecution transitionTo(ExecutionStatus target, String reason) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(status, target);
        }
        Instant now = Instant.now();
        Builder builder = toBuilder().status(target);
        if (target == ExecutionStatus.RUNNING && startedAt == null) {
            builder.startedAt(now);
        }
        if (target.isTerminal()) {
            builder.completedAt(now).currentStepIndices(List.of());
        }
        if (reason != null) {
            builder.error(reason);
        }
        return builder.build();
    }

    /**
     * Create a copy with a dispatched step recorded.
     */
    public WorkflowExecution withDispatched(StepResult dispatched) {
        List<StepResult> results = new ArrayList<>(stepResults);
        results.add(dispatched);
        List<String> ids = new ArrayList<>(actionIds);
        ids.add(dispatched.actionId());
        return toBuilder().stepResults(results).actionIds(ids).build();
    }

    /**
     * Create a copy with the step result for the same action replaced.
     */
    public WorkflowExecution withResolved(StepResult resolved) {
        List<StepResult> results = new ArrayList<>(stepResults.size());
        for (StepResult r : stepResults) {
            results.add(r.actionId().equals(resolved.actionId()) ? resolved : r);
        }
        return toBuilder().stepResults(results).build();
    }

    /**
     * Builder for creating modified copies.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private final String executionId;
        private final String workflowId;
        private final String workflowName;
        private final String workflowVersion;
        private final TriggerType triggerType;
        private final String triggerEventId;
        private final Map<String, Object> triggerContext;
        private ExecutionStatus status;
        private final int priority;
        private int currentGroup;
        private List<Integer> currentStepIndices;
        private boolean compensating;
        private List<StepResult> stepResults;
        private List<String> actionIds;
        private String error;
        private final Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private final Instant deadline;

        public Builder(WorkflowExecution execution) {
            this.executionId = execution.executionId();
            this.workflowId = execution.workflowId();
            this.workflowName = execution.workflowName();
            this.workflowVersion = execution.workflowVersion();
            this.triggerType = execution.triggerType();
            this.triggerEventId = execution.triggerEventId();
            this.triggerContext = execution.triggerContext();
            this.status = execution.status();
            this.priority = execution.priority();
            this.currentGroup = execution.currentGroup();
            this.currentStepIndices = execution.currentStepIndices();
            this.compensating = execution.compensating();
            this.stepResults = execution.stepResults();
            this.actionIds = execution.actionIds();
            this.error = execution.error();
            this.createdAt = execution.createdAt();
            this.startedAt = execution.startedAt();
            this.completedAt = execution.completedAt();
            this.deadline = execution.deadline();
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder currentGroup(int currentGroup) {
            this.currentGroup = currentGroup;
            return this;
        }

        public Builder currentStepIndices(List<Integer> currentStepIndices) {
            this.currentStepIndices = currentStepIndices;
            return this;
        }

        public Builder compensating(boolean compensating) {
            this.compensating = compensating;
            return this;
        }

        public Builder stepResults(List<StepResult> stepResults) {
            this.stepResults = stepResults;
            return this;
        }

        public Builder actionIds(List<String> actionIds) {
            this.actionIds = actionIds;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public WorkflowExecution build() {
            return new WorkflowExecution(
                executionId, workflowId, workflowName, workflowVersion,
                triggerType, triggerEventId, triggerContext,
                status, priority, currentGroup, currentStepIndices, compensating,
                stepResults, actionIds, error,
                createdAt, startedAt, completedAt, deadline
            );
        }
    }
}
