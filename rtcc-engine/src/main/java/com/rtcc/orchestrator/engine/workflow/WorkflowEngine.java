package com.rtcc.orchestrator.engine.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rtcc.orchestrator.core.exception.InvalidStateTransitionException;
import com.rtcc.orchestrator.core.exception.NotFoundException;
import com.rtcc.orchestrator.core.exception.WorkflowValidationException;
import com.rtcc.orchestrator.core.model.ActionStatus;
import com.rtcc.orchestrator.core.model.ExecutionEvent;
import com.rtcc.orchestrator.core.model.ExecutionEventType;
import com.rtcc.orchestrator.core.model.ExecutionStatus;
import com.rtcc.orchestrator.core.model.FailureKind;
import com.rtcc.orchestrator.core.model.FailureStrategy;
import com.rtcc.orchestrator.core.model.GeoLocation;
import com.rtcc.orchestrator.core.model.GuardrailCheck;
import com.rtcc.orchestrator.core.model.NormalizedEvent;
import com.rtcc.orchestrator.core.model.OrchestrationAction;
import com.rtcc.orchestrator.core.model.OrchestrationResult;
import com.rtcc.orchestrator.core.model.StepResult;
import com.rtcc.orchestrator.core.model.StepStatus;
import com.rtcc.orchestrator.core.model.TriggerType;
import com.rtcc.orchestrator.core.model.Workflow;
import com.rtcc.orchestrator.core.model.WorkflowExecution;
import com.rtcc.orchestrator.core.model.WorkflowStep;
import com.rtcc.orchestrator.core.model.WorkflowTrigger;
import com.rtcc.orchestrator.core.repository.ExecutionEventRepository;
import com.rtcc.orchestrator.core.repository.WorkflowExecutionRepository;
import com.rtcc.orchestrator.core.repository.WorkflowRepository;
import com.rtcc.orchestrator.engine.condition.ConditionEvaluator;
import com.rtcc.orchestrator.engine.logging.LoggingContext;
import com.rtcc.orchestrator.engine.metrics.OrchestrationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs workflow executions as state machines driven by action results.
 *
 * An execution moves pending -> running on its first dispatch and ends in exactly one
 * terminal state. Steps are dispatched group by group: a sequential step is a group of
 * one, a contiguous run of parallel steps is one group, and the next group starts only
 * when every action of the current one has resolved.
 *
 * A failed required step ends the execution according to the workflow's
 * {@link FailureStrategy}; a failed optional step is recorded and the execution moves on.
 * All state changes for one execution happen under that execution's lock.
 */
public class WorkflowEngine implements ActionResultListener {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    private final WorkflowRepository workflowRepository;
    private final WorkflowExecutionRepository executionRepository;
    private final ExecutionEventRepository eventRepository;
    private final ConditionEvaluator conditionEvaluator;
    private final ActionPublisher publisher;
    private final OrchestrationMetrics metrics;
    private final ObjectMapper objectMapper;

    private final ScheduledExecutorService scheduler;
    private final Map<String, Object> executionLocks = new ConcurrentHashMap<>();
    private final Map<String, Workflow> runningDefinitions = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> deadlines = new ConcurrentHashMap<>();
    private final Map<String, List<ScheduledFuture<?>>> schedules = new ConcurrentHashMap<>();

    // Statistics
    private final AtomicLong totalExecutions = new AtomicLong();
    private final AtomicLong completedExecutions = new AtomicLong();
    private final AtomicLong failedExecutions = new AtomicLong();
    private final AtomicLong timedOutExecutions = new AtomicLong();
    private final AtomicLong abortedExecutions = new AtomicLong();

    public WorkflowEngine(
            WorkflowRepository workflowRepository,
            WorkflowExecutionRepository executionRepository,
            ExecutionEventRepository eventRepository,
            ConditionEvaluator conditionEvaluator,
            ActionPublisher publisher,
            OrchestrationMetrics metrics,
            ObjectMapper objectMapper) {
        this.workflowRepository = workflowRepository;
        this.executionRepository = executionRepository;
        this.eventRepository = eventRepository;
        this.conditionEvaluator = conditionEvaluator;
        this.publisher = publisher;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        AtomicInteger threads = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "rtcc-workflow-timer-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    // ========== Definitions ==========

    /**
     * Store a workflow definition. Registering the same id again replaces the stored
     * definition; executions already running keep the definition they started with.
     */
    public Workflow registerWorkflow(Workflow workflow) {
        validateWorkflow(workflow);
        Optional<Workflow> previous = workflowRepository.save(workflow);
        rescheduleTriggers(workflow);
        log.info("{} workflow {} ({}) v{} with {} steps, priority {}",
            previous.isPresent() ? "Replaced" : "Registered",
            workflow.name(), workflow.id(), workflow.version(), workflow.steps().size(), workflow.priority());
        return workflow;
    }

    public boolean unregisterWorkflow(String workflowId) {
        cancelSchedules(workflowId);
        boolean removed = workflowRepository.delete(workflowId);
        if (removed) {
            log.info("Unregistered workflow {}", workflowId);
        }
        return removed;
    }

    public Workflow getWorkflow(String workflowId) {
        return workflowRepository.findById(workflowId)
            .orElseThrow(() -> new NotFoundException("Workflow", workflowId));
    }

    /**
     * @param category Filter by category, or null for all
     */
    public List<Workflow> listWorkflows(String category) {
        return workflowRepository.findAll().stream()
            .filter(w -> category == null || category.equalsIgnoreCase(w.category()))
            .toList();
    }

    private void validateWorkflow(Workflow workflow) {
        if (workflow.name() == null || workflow.name().isBlank()) {
            throw new WorkflowValidationException("name", "cannot be empty");
        }
        if (workflow.id() == null || workflow.id().isBlank()) {
            throw new WorkflowValidationException("id", "cannot be derived from name '" + workflow.name() + "'");
        }
        if (workflow.steps().isEmpty()) {
            throw new WorkflowValidationException("steps", "cannot be empty");
        }
        if (workflow.priority() < 1) {
            throw new WorkflowValidationException("priority", "must be at least 1");
        }
        if (workflow.timeout().isZero() || workflow.timeout().isNegative()) {
            throw new WorkflowValidationException("timeout", "must be positive");
        }
        Set<String> names = new HashSet<>();
        for (WorkflowStep step : workflow.steps()) {
            if (!names.add(step.name())) {
                throw new WorkflowValidationException("steps", "duplicate step name: " + step.name());
            }
        }
    }

    // ========== Triggers ==========

    /**
     * Enabled workflows with an event trigger matching this type and source.
     * Trigger conditions are not evaluated.
     */
    public List<Workflow> matchTrigger(String eventType, String eventSource) {
        return workflowRepository.findAll().stream()
            .filter(Workflow::enabled)
            .filter(w -> w.triggers().stream().anyMatch(t -> t.matchesEvent(eventType, eventSource)))
            .toList();
    }

    /**
     * Enabled workflows with an event trigger matching this type and source whose
     * conditions all hold against the payload.
     */
    public List<Workflow> matchTrigger(String eventType, String eventSource, Map<String, ?> payload) {
        return workflowRepository.findAll().stream()
            .filter(Workflow::enabled)
            .filter(w -> w.triggers().stream().anyMatch(t ->
                t.matchesEvent(eventType, eventSource)
                    && conditionEvaluator.evaluateAll(t.conditions(), payload)))
            .toList();
    }

    /**
     * Start one execution per workflow whose trigger matches a routed event.
     */
    public List<WorkflowExecution> handleEvent(NormalizedEvent event) {
        List<Workflow> matched = matchTrigger(event.eventType(), event.sourceChannel(), event.data());
        if (matched.isEmpty()) {
            log.debug("No workflow triggered by {} from {}", event.eventType(), event.sourceChannel());
            return List.of();
        }
        Map<String, Object> context = eventContext(event);
        List<WorkflowExecution> started = new ArrayList<>();
        for (Workflow workflow : matched) {
            started.add(execute(workflow, TriggerType.EVENT, event.eventId(), context));
        }
        return started;
    }

    private Map<String, Object> eventContext(NormalizedEvent event) {
        Map<String, Object> context = new LinkedHashMap<>(event.data());
        context.put("event_id", event.eventId());
        context.put("event_type", event.eventType());
        context.put("source_channel", event.sourceChannel());
        context.put("category", event.category().code());
        context.put("priority", event.priority().level());
        if (event.location() != null) {
            context.put("location", Map.of(
                "latitude", event.location().latitude(),
                "longitude", event.location().longitude()));
        }
        return context;
    }

    private void rescheduleTriggers(Workflow workflow) {
        cancelSchedules(workflow.id());
        if (!workflow.enabled()) {
            return;
        }
        List<ScheduledFuture<?>> futures = new ArrayList<>();
        for (WorkflowTrigger trigger : workflow.triggers()) {
            if (trigger.type() != TriggerType.SCHEDULE || !trigger.enabled()) {
                continue;
            }
            long intervalMs = trigger.interval().toMillis();
            futures.add(scheduler.scheduleAtFixedRate(
                () -> fireSchedule(workflow.id()), intervalMs, intervalMs, TimeUnit.MILLISECONDS));
            log.info("Scheduled workflow {} every {}", workflow.id(), trigger.interval());
        }
        if (!futures.isEmpty()) {
            schedules.put(workflow.id(), futures);
        }
    }

    private void fireSchedule(String workflowId) {
        if (!publisher.isDispatching()) {
            return;
        }
        try {
            Workflow workflow = getWorkflow(workflowId);
            execute(workflow, TriggerType.SCHEDULE, null, Map.of());
        } catch (RuntimeException e) {
            log.error("Scheduled run of workflow {} failed to start: {}", workflowId, e.getMessage(), e);
        }
    }

    private void cancelSchedules(String workflowId) {
        List<ScheduledFuture<?>> futures = schedules.remove(workflowId);
        if (futures != null) {
            futures.forEach(f -> f.cancel(false));
        }
    }

    // ========== Execution ==========

    /**
     * Run a registered workflow on demand.
     */
    public WorkflowExecution execute(String workflowId, TriggerType triggerType, Map<String, Object> inputs) {
        return execute(getWorkflow(workflowId), triggerType, null, inputs);
    }

    /**
     * Create an execution and dispatch its first step group.
     *
     * @param triggerContext Event data or manual inputs, merged under each step's parameters
     */
    public WorkflowExecution execute(
            Workflow workflow,
            TriggerType triggerType,
            String triggerEventId,
            Map<String, Object> triggerContext) {
        if (!workflow.enabled()) {
            throw new WorkflowValidationException("enabled", "workflow " + workflow.id() + " is disabled");
        }
        WorkflowExecution execution = WorkflowExecution.create(workflow, triggerType, triggerEventId, triggerContext);
        String executionId = execution.executionId();

        try (LoggingContext ignored = LoggingContext.forExecution(executionId, workflow.id())) {
            synchronized (lockFor(executionId)) {
                runningDefinitions.put(executionId, workflow);
                executionRepository.save(execution);
                totalExecutions.incrementAndGet();
                metrics.executionStarted(workflow.id());
                recordEvent(executionId, ExecutionEventType.EXECUTION_CREATED, ExecutionEvent.ACTOR_ENGINE, payload -> {
                    payload.put("workflow", workflow.id());
                    payload.put("version", workflow.version());
                    payload.put("trigger", triggerType.name());
                    if (triggerEventId != null) {
                        payload.put("triggerEventId", triggerEventId);
                    }
                });
                log.info("Created execution {} of {} (trigger {})", executionId, workflow.name(), triggerType);

                deadlines.put(executionId, scheduler.schedule(
                    () -> onDeadline(executionId), workflow.timeout().toMillis(), TimeUnit.MILLISECONDS));

                dispatchGroup(execution, workflow, 0);
            }
            return getExecution(executionId);
        }
    }

    /**
     * Abort a running execution. Pending actions are withdrawn; running ones finish
     * but no longer affect the execution.
     *
     * @throws InvalidStateTransitionException if the execution already ended
     */
    public WorkflowExecution abort(String executionId, String reason) {
        WorkflowExecution current = getExecution(executionId);
        try (LoggingContext ignored = LoggingContext.forExecution(executionId, current.workflowId())) {
            Object lock = executionLocks.get(executionId);
            if (lock == null) {
                throw new InvalidStateTransitionException(current.status(), ExecutionStatus.ABORTED);
            }
            synchronized (lock) {
                WorkflowExecution execution = getExecution(executionId);
                String why = reason == null || reason.isBlank() ? "Aborted by operator" : reason;
                finish(execution, ExecutionStatus.ABORTED, why, ExecutionEvent.ACTOR_OPERATOR);
            }
            publisher.withdrawActions(executionId);
            return getExecution(executionId);
        }
    }

    private void onDeadline(String executionId) {
        WorkflowExecution current = executionRepository.findById(executionId).orElse(null);
        if (current == null || current.isTerminal()) {
            return;
        }
        try (LoggingContext ignored = LoggingContext.forExecution(executionId, current.workflowId())) {
            Object lock = executionLocks.get(executionId);
            if (lock == null) {
                return;
            }
            synchronized (lock) {
                WorkflowExecution execution = executionRepository.findById(executionId).orElse(null);
                if (execution == null || execution.isTerminal()) {
                    return;
                }
                Workflow workflow = runningDefinitions.get(executionId);
                Duration timeout = workflow != null ? workflow.timeout() : Duration.between(execution.createdAt(), execution.deadline());
                finish(execution, ExecutionStatus.TIMED_OUT,
                    "Execution exceeded timeout of " + timeout.toSeconds() + "s", ExecutionEvent.ACTOR_ENGINE);
            }
            publisher.withdrawActions(executionId);
        } catch (RuntimeException e) {
            log.error("Failed to time out execution {}: {}", executionId, e.getMessage(), e);
        }
    }

    private void dispatchGroup(WorkflowExecution execution, Workflow workflow, int groupIndex) {
        List<Integer> group = workflow.stepGroups().get(groupIndex);
        WorkflowExecution updated = execution.toBuilder()
            .currentGroup(groupIndex)
            .currentStepIndices(group)
            .build();
        if (updated.status() == ExecutionStatus.PENDING) {
            updated = transitionState(updated, ExecutionStatus.RUNNING, null);
            recordEvent(updated.executionId(), ExecutionEventType.EXECUTION_STARTED, ExecutionEvent.ACTOR_ENGINE,
                payload -> payload.put("steps", workflow.steps().size()));
        }

        List<OrchestrationAction> actions = new ArrayList<>();
        for (int stepIndex : group) {
            WorkflowStep step = workflow.steps().get(stepIndex);
            OrchestrationAction action = buildAction(updated, workflow, step, stepIndex, workflow.guardrailsFor(step));
            updated = updated.withDispatched(StepResult.dispatched(step.name(), stepIndex, false, action.actionId()));
            actions.add(action);
        }
        executionRepository.save(updated);
        publish(updated, actions);
    }

    private void dispatchCompensation(WorkflowExecution execution, Workflow workflow) {
        List<OrchestrationAction> actions = new ArrayList<>();
        WorkflowExecution updated = execution;
        for (int i = 0; i < workflow.compensationSteps().size(); i++) {
            WorkflowStep step = workflow.compensationSteps().get(i);
            OrchestrationAction action = buildAction(updated, workflow, step, i, workflow.guardrailsFor(step));
            updated = updated.withDispatched(StepResult.dispatched(step.name(), i, true, action.actionId()));
            actions.add(action);
        }
        executionRepository.save(updated);
        publish(updated, actions);
    }

    private void publish(WorkflowExecution execution, List<OrchestrationAction> actions) {
        for (OrchestrationAction action : actions) {
            // a shed sibling can end the execution while this group is being queued
            if (executionRepository.findById(execution.executionId()).map(WorkflowExecution::isTerminal).orElse(true)) {
                return;
            }
            recordEvent(execution.executionId(), ExecutionEventType.STEP_DISPATCHED, ExecutionEvent.ACTOR_ENGINE, payload -> {
                payload.put("step", action.stepName());
                payload.put("stepIndex", action.stepIndex());
                payload.put("actionId", action.actionId());
                payload.put("actionType", action.actionType().code());
                payload.put("subsystem", action.targetSubsystem());
            });
            log.debug("Dispatching step {} of execution {} as action {}",
                action.stepName(), execution.executionId(), action.actionId());
            publisher.queueAction(action);
        }
    }

    private OrchestrationAction buildAction(
            WorkflowExecution execution, Workflow workflow, WorkflowStep step, int stepIndex, List<String> guardrails) {
        Map<String, Object> parameters = new LinkedHashMap<>(execution.triggerContext());
        parameters.putAll(step.parameters());
        return OrchestrationAction.builder(step.actionType(), step.targetSubsystem())
            .parameters(parameters)
            .priority(workflow.priority())
            .timeout(step.timeout())
            .requiresConfirmation(step.requiresConfirmation())
            .guardrails(guardrails)
            .resource(step.resource())
            .location(GeoLocation.fromRaw(execution.triggerContext().get("location")))
            .workflowId(workflow.id())
            .executionId(execution.executionId())
            .step(step.name(), stepIndex)
            .build();
    }

    // ========== Results ==========

    /**
     * Apply an action outcome to its execution and advance it.
     * Results for unknown or finished executions are ignored.
     */
    @Override
    public void onActionResult(OrchestrationResult result) {
        String executionId = result.executionId();
        if (executionId == null) {
            return;
        }
        Object lock = executionLocks.get(executionId);
        if (lock == null) {
            log.debug("Ignoring result of action {} for finished execution {}", result.actionId(), executionId);
            return;
        }
        boolean withdraw = false;
        synchronized (lock) {
            WorkflowExecution execution = executionRepository.findById(executionId).orElse(null);
            if (execution == null || execution.isTerminal()) {
                log.debug("Ignoring result of action {} for finished execution {}", result.actionId(), executionId);
                return;
            }
            Optional<StepResult> pending = execution.resultFor(result.actionId());
            if (pending.isEmpty() || pending.get().status().isResolved()) {
                return;
            }
            Workflow workflow = runningDefinitions.get(executionId);
            if (workflow == null) {
                log.warn("No definition held for running execution {}", executionId);
                return;
            }
            try (LoggingContext ignored = LoggingContext.forExecution(executionId, workflow.id())) {
                StepResult resolved = resolve(pending.get(), result);
                execution = execution.withResolved(resolved);
                executionRepository.save(execution);
                recordStepEvent(execution, resolved, result);
                withdraw = advance(execution, workflow, resolved);
            }
        }
        if (withdraw) {
            publisher.withdrawActions(executionId);
        }
    }

    /**
     * Decide what happens after a step resolved.
     *
     * @return true if the execution ended and its pending actions must be withdrawn
     */
    private boolean advance(WorkflowExecution execution, Workflow workflow, StepResult resolved) {
        if (execution.compensating()) {
            if (resolved.compensation() && allResolved(execution, true)) {
                recordEvent(execution.executionId(), ExecutionEventType.COMPENSATION_COMPLETED,
                    ExecutionEvent.ACTOR_ENGINE, payload -> payload.put("steps", workflow.compensationSteps().size()));
                finish(execution, ExecutionStatus.FAILED, execution.error(), ExecutionEvent.ACTOR_ENGINE);
            }
            return false;
        }

        if (resolved.status().isFailure()) {
            WorkflowStep step = workflow.steps().get(resolved.stepIndex());
            if (step.required() && workflow.failureStrategy() != FailureStrategy.CONTINUE) {
                String reason = describeFailure(resolved);
                if (workflow.failureStrategy() == FailureStrategy.COMPENSATE && !workflow.compensationSteps().isEmpty()) {
                    startCompensation(execution, workflow, reason);
                    return false;
                }
                finish(execution, ExecutionStatus.FAILED, reason, ExecutionEvent.ACTOR_ENGINE);
                return true;
            }
            log.info("Optional step {} of execution {} ended {}; continuing",
                resolved.stepName(), execution.executionId(), resolved.status());
        }

        if (!allResolved(execution, false)) {
            return false;
        }
        int nextGroup = execution.currentGroup() + 1;
        if (nextGroup < workflow.stepGroups().size()) {
            dispatchGroup(execution, workflow, nextGroup);
        } else {
            finish(execution, ExecutionStatus.COMPLETED, null, ExecutionEvent.ACTOR_ENGINE);
        }
        return false;
    }

    private void startCompensation(WorkflowExecution execution, Workflow workflow, String reason) {
        WorkflowExecution compensating = execution.toBuilder()
            .compensating(true)
            .error(reason)
            .build();
        executionRepository.save(compensating);
        recordEvent(execution.executionId(), ExecutionEventType.COMPENSATION_STARTED, ExecutionEvent.ACTOR_ENGINE, payload -> {
            payload.put("reason", reason);
            payload.put("steps", workflow.compensationSteps().size());
        });
        log.warn("Execution {} compensating after: {}", execution.executionId(), reason);
        // siblings still queued would otherwise run after compensation began
        publisher.withdrawActions(execution.executionId());
        WorkflowExecution latest = executionRepository.findById(execution.executionId()).orElse(compensating);
        dispatchCompensation(latest, workflow);
    }

    private boolean allResolved(WorkflowExecution execution, boolean compensation) {
        return execution.stepResults().stream()
            .filter(r -> r.compensation() == compensation)
            .filter(r -> compensation || execution.currentStepIndices().contains(r.stepIndex()))
            .allMatch(r -> r.status().isResolved());
    }

    private StepResult resolve(StepResult pending, OrchestrationResult result) {
        if (result.success()) {
            return pending.resolve(StepStatus.COMPLETED, null, result.output(), null);
        }
        StepStatus status;
        if (result.status() == ActionStatus.VETOED) {
            status = StepStatus.BLOCKED;
        } else if (result.failureKind() == FailureKind.HANDLER_TIMEOUT) {
            status = StepStatus.TIMED_OUT;
        } else if (result.status() == ActionStatus.CANCELLED) {
            status = StepStatus.CANCELLED;
        } else {
            status = StepStatus.FAILED;
        }
        return pending.resolve(status, result.failureKind(), null, String.join("; ", result.errors()));
    }

    private String describeFailure(StepResult step) {
        return switch (step.status()) {
            case BLOCKED -> "Step '" + step.stepName() + "' blocked by policy: " + step.error();
            case TIMED_OUT -> "Step '" + step.stepName() + "' timed out";
            case CANCELLED -> "Step '" + step.stepName() + "' was cancelled";
            default -> "Step '" + step.stepName() + "' failed: " + step.error();
        };
    }

    private void recordStepEvent(WorkflowExecution execution, StepResult step, OrchestrationResult result) {
        ExecutionEventType type = switch (step.status()) {
            case COMPLETED -> ExecutionEventType.STEP_COMPLETED;
            case BLOCKED -> ExecutionEventType.STEP_BLOCKED;
            case TIMED_OUT -> ExecutionEventType.STEP_TIMED_OUT;
            case CANCELLED -> ExecutionEventType.STEP_CANCELLED;
            default -> ExecutionEventType.STEP_FAILED;
        };
        recordEvent(execution.executionId(), type, ExecutionEvent.ACTOR_KERNEL, payload -> {
            payload.put("step", step.stepName());
            payload.put("stepIndex", step.stepIndex());
            payload.put("compensation", step.compensation());
            payload.put("actionId", step.actionId());
            payload.put("attempts", result.attempts());
            if (step.failureKind() != null) {
                payload.put("failureKind", step.failureKind().name());
            }
            if (step.error() != null) {
                payload.put("error", step.error());
            }
            if (step.status() == StepStatus.BLOCKED) {
                payload.set("blockedBy", objectMapper.valueToTree(result.guardrailChecks().stream()
                    .filter(GuardrailCheck::isBlockingFailure)
                    .map(GuardrailCheck::bindingName)
                    .toList()));
            }
            if (step.output() != null) {
                payload.set("output", step.output());
            }
        });
        if (step.status().isFailure()) {
            log.warn("Step {} of execution {} {}: {}", step.stepName(), execution.executionId(), step.status(), step.error());
        } else {
            log.info("Step {} of execution {} completed", step.stepName(), execution.executionId());
        }
    }

    // ========== State ==========

    private void finish(WorkflowExecution execution, ExecutionStatus target, String reason, String actor) {
        WorkflowExecution finished = transitionState(execution, target, reason);
        ScheduledFuture<?> deadline = deadlines.remove(execution.executionId());
        if (deadline != null) {
            deadline.cancel(false);
        }
        runningDefinitions.remove(execution.executionId());
        executionLocks.remove(execution.executionId());

        ExecutionEventType type = switch (target) {
            case COMPLETED -> ExecutionEventType.EXECUTION_COMPLETED;
            case TIMED_OUT -> ExecutionEventType.EXECUTION_TIMED_OUT;
            case ABORTED -> ExecutionEventType.EXECUTION_ABORTED;
            default -> ExecutionEventType.EXECUTION_FAILED;
        };
        recordEvent(execution.executionId(), type, actor, payload -> {
            payload.put("status", target.name());
            payload.put("durationMs", finished.elapsed().toMillis());
            if (reason != null) {
                payload.put("error", reason);
            }
        });

        switch (target) {
            case COMPLETED -> {
                completedExecutions.incrementAndGet();
                metrics.executionCompleted(execution.workflowId(), finished.elapsed());
                log.info("Execution {} of {} completed in {} ms",
                    execution.executionId(), execution.workflowName(), finished.elapsed().toMillis());
            }
            case TIMED_OUT -> {
                timedOutExecutions.incrementAndGet();
                metrics.executionTimedOut(execution.workflowId());
                log.warn("Execution {} of {} timed out: {}", execution.executionId(), execution.workflowName(), reason);
            }
            case ABORTED -> {
                abortedExecutions.incrementAndGet();
                metrics.executionFailed(execution.workflowId());
                log.info("Execution {} of {} aborted: {}", execution.executionId(), execution.workflowName(), reason);
            }
            default -> {
                failedExecutions.incrementAndGet();
                metrics.executionFailed(execution.workflowId());
                log.warn("Execution {} of {} failed: {}", execution.executionId(), execution.workflowName(), reason);
            }
        }
    }

    private WorkflowExecution transitionState(WorkflowExecution execution, ExecutionStatus target, String reason) {
        WorkflowExecution updated = execution.transitionTo(target, reason);
        executionRepository.save(updated);
        return updated;
    }

    /**
     * Locks exist only for live executions: created by {@code execute}, dropped by {@code finish}.
     * Later callers look them up and treat a missing lock as a finished execution.
     */
    private Object lockFor(String executionId) {
        return executionLocks.computeIfAbsent(executionId, k -> new Object());
    }

    int liveExecutionLockCount() {
        return executionLocks.size();
    }

    private void recordEvent(String executionId, ExecutionEventType type, String actor, PayloadWriter writer) {
        ObjectNode payload = objectMapper.createObjectNode();
        writer.write(payload);
        long sequenceNumber = eventRepository.getNextSequenceNumber(executionId);
        eventRepository.append(ExecutionEvent.create(executionId, sequenceNumber, type, payload, actor));
    }

    @FunctionalInterface
    private interface PayloadWriter {
        void write(ObjectNode payload);
    }

    // ========== Queries ==========

    public WorkflowExecution getExecution(String executionId) {
        return executionRepository.findById(executionId)
            .orElseThrow(() -> new NotFoundException("WorkflowExecution", executionId));
    }

    public List<WorkflowExecution> getActiveExecutions() {
        return executionRepository.findActive();
    }

    /**
     * @param status Filter by status, or null for all
     */
    public List<WorkflowExecution> getExecutionHistory(ExecutionStatus status, int limit) {
        return executionRepository.findRecent(status, limit);
    }

    public List<ExecutionEvent> getExecutionEvents(String executionId) {
        getExecution(executionId);
        return eventRepository.findByExecutionId(executionId);
    }

    public WorkflowStatistics getStatistics() {
        long finished = completedExecutions.get() + failedExecutions.get()
            + timedOutExecutions.get() + abortedExecutions.get();
        return new WorkflowStatistics(
            workflowRepository.findAll().size(),
            totalExecutions.get(),
            completedExecutions.get(),
            failedExecutions.get(),
            timedOutExecutions.get(),
            abortedExecutions.get(),
            executionRepository.findActive().size(),
            finished == 0 ? 0.0 : completedExecutions.get() * 100.0 / finished
        );
    }

    /**
     * Stop schedule triggers and execution timers.
     */
    public void shutdown() {
        schedules.keySet().forEach(this::cancelSchedules);
        scheduler.shutdownNow();
        log.info("Workflow engine stopped ({} executions still active)", runningDefinitions.size());
    }
}
