package com.rtcc.orchestrator.api.rest;

import com.rtcc.orchestrator.core.exception.NotFoundException;
import com.rtcc.orchestrator.core.model.ActionType;
import com.rtcc.orchestrator.core.model.ExecutionEvent;
import com.rtcc.orchestrator.core.model.ExecutionStatus;
import com.rtcc.orchestrator.core.model.FailureStrategy;
import com.rtcc.orchestrator.core.model.ResourceRequirement;
import com.rtcc.orchestrator.core.model.ResourceType;
import com.rtcc.orchestrator.core.model.StepExecutionMode;
import com.rtcc.orchestrator.core.model.TriggerType;
import com.rtcc.orchestrator.core.model.Workflow;
import com.rtcc.orchestrator.core.model.WorkflowExecution;
import com.rtcc.orchestrator.core.model.WorkflowStep;
import com.rtcc.orchestrator.core.model.WorkflowTrigger;
import com.rtcc.orchestrator.engine.history.ExecutionHistoryService;
import com.rtcc.orchestrator.engine.history.ExecutionHistoryService.ExecutionHistory;
import com.rtcc.orchestrator.engine.history.ExecutionHistoryService.ReplayResult;
import com.rtcc.orchestrator.engine.workflow.WorkflowEngine;
import com.rtcc.orchestrator.engine.workflow.WorkflowStatistics;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST API for workflow definitions and executions.
 */
@RestController
@RequestMapping("/api/v1/workflows")
public class WorkflowController {

    private final WorkflowEngine workflowEngine;
    private final ExecutionHistoryService historyService;

    public WorkflowController(WorkflowEngine workflowEngine, ExecutionHistoryService historyService) {
        this.workflowEngine = workflowEngine;
        this.historyService = historyService;
    }

    // ========== Definitions ==========

    /**
     * Register or replace a workflow definition.
     */
    @PostMapping
    public ResponseEntity<Workflow> register(@Valid @RequestBody WorkflowRequest request) {
        Workflow workflow = workflowEngine.registerWorkflow(request.toWorkflow());
        return ResponseEntity.status(HttpStatus.CREATED).body(workflow);
    }

    @GetMapping
    public List<Workflow> list(@RequestParam(required = false) String category) {
        return workflowEngine.listWorkflows(category);
    }

    @GetMapping("/{workflowId}")
    public Workflow get(@PathVariable String workflowId) {
        return workflowEngine.getWorkflow(workflowId);
    }

    @DeleteMapping("/{workflowId}")
    public ResponseEntity<Void> unregister(@PathVariable String workflowId) {
        if (!workflowEngine.unregisterWorkflow(workflowId)) {
            throw new NotFoundException("Workflow", workflowId);
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * Run a workflow on demand. The body, if any, becomes the trigger context.
     */
    @PostMapping("/{workflowId}/execute")
    public ResponseEntity<WorkflowExecution> execute(
            @PathVariable String workflowId,
            @RequestBody(required = false) Map<String, Object> inputs) {
        WorkflowExecution execution = workflowEngine.execute(workflowId, TriggerType.API,
            inputs == null ? Map.of() : inputs);
        return ResponseEntity.status(HttpStatus.CREATED).body(execution);
    }

    @GetMapping("/statistics")
    public WorkflowStatistics statistics() {
        return workflowEngine.getStatistics();
    }

    // ========== Executions ==========

    @GetMapping("/executions")
    public List<WorkflowExecution> executions(
            @RequestParam(required = false) ExecutionStatus status,
            @RequestParam(defaultValue = "100") int limit) {
        return workflowEngine.getExecutionHistory(status, limit);
    }

    @GetMapping("/executions/active")
    public List<WorkflowExecution> activeExecutions() {
        return workflowEngine.getActiveExecutions();
    }

    @GetMapping("/executions/{executionId}")
    public WorkflowExecution execution(@PathVariable String executionId) {
        return workflowEngine.getExecution(executionId);
    }

    @PostMapping("/executions/{executionId}/abort")
    public WorkflowExecution abort(
            @PathVariable String executionId,
            @RequestBody(required = false) AbortRequest request) {
        return workflowEngine.abort(executionId, request != null ? request.reason() : null);
    }

    @GetMapping("/executions/{executionId}/events")
    public List<ExecutionEvent> events(@PathVariable String executionId) {
        return workflowEngine.getExecutionEvents(executionId);
    }

    /**
     * Event history with timeline and per-step breakdown.
     */
    @GetMapping("/executions/{executionId}/history")
    public ExecutionHistory history(@PathVariable String executionId) {
        return historyService.getHistory(executionId);
    }

    /**
     * Reconstruct execution state as of a sequence number.
     */
    @GetMapping("/executions/{executionId}/history/replay")
    public ReplayResult replay(
            @PathVariable String executionId,
            @RequestParam long sequence) {
        return historyService.replayToSequence(executionId, sequence);
    }

    // ========== DTOs ==========

    public record AbortRequest(String reason) {}

    public record WorkflowRequest(
        String id,
        @NotBlank String name,
        String version,
        String category,
        String description,
        List<@Valid TriggerRequest> triggers,
        @NotEmpty List<@Valid StepRequest> steps,
        List<@Valid StepRequest> compensationSteps,
        List<String> guardrails,
        List<String> legalGuardrails,
        List<String> ethicalGuardrails,
        Long timeoutSeconds,
        Integer priority,
        FailureStrategy failureStrategy,
        Boolean enabled
    ) {
        Workflow toWorkflow() {
            Workflow.Builder builder = Workflow.builder()
                .id(id)
                .name(name)
                .category(category)
                .description(description)
                .steps(steps.stream().map(StepRequest::toStep).toList())
                .failureStrategy(failureStrategy);
            if (version != null) {
                builder.version(version);
            }
            if (triggers != null) {
                builder.triggers(triggers.stream().map(TriggerRequest::toTrigger).toList());
            }
            if (compensationSteps != null) {
                builder.compensationSteps(compensationSteps.stream().map(StepRequest::toStep).toList());
            }
            if (guardrails != null) {
                builder.guardrails(guardrails.toArray(String[]::new));
            }
            if (legalGuardrails != null) {
                builder.legalGuardrails(legalGuardrails.toArray(String[]::new));
            }
            if (ethicalGuardrails != null) {
                builder.ethicalGuardrails(ethicalGuardrails.toArray(String[]::new));
            }
            if (timeoutSeconds != null) {
                builder.timeout(Duration.ofSeconds(timeoutSeconds));
            }
            if (priority != null) {
                builder.priority(priority);
            }
            if (enabled != null) {
                builder.enabled(enabled);
            }
            return builder.build();
        }
    }

    public record TriggerRequest(
        @NotNull TriggerType type,
        List<String> eventTypes,
        List<String> eventSources,
        List<String> conditions,
        Long intervalSeconds,
        Boolean enabled
    ) {
        WorkflowTrigger toTrigger() {
            return new WorkflowTrigger(type, eventTypes, eventSources, conditions,
                intervalSeconds == null ? null : Duration.ofSeconds(intervalSeconds),
                enabled == null || enabled);
        }
    }

    public record StepRequest(
        @NotBlank String name,
        @NotNull ActionType actionType,
        @NotBlank String targetSubsystem,
        Map<String, Object> parameters,
        StepExecutionMode mode,
        Long timeoutSeconds,
        List<String> guardrails,
        Boolean required,
        Boolean requiresConfirmation,
        ResourceType resourceType,
        String resourceId,
        Set<String> capabilities
    ) {
        WorkflowStep toStep() {
            WorkflowStep.Builder builder = WorkflowStep.builder(name, actionType, targetSubsystem);
            if (parameters != null) {
                builder.parameters(parameters);
            }
            if (mode != null) {
                builder.mode(mode);
            }
            if (timeoutSeconds != null) {
                builder.timeout(Duration.ofSeconds(timeoutSeconds));
            }
            if (guardrails != null) {
                builder.guardrails(guardrails.toArray(String[]::new));
            }
            if (required != null) {
                builder.required(required);
            }
            if (requiresConfirmation != null) {
                builder.requiresConfirmation(requiresConfirmation);
            }
            if (resourceType != null || resourceId != null) {
                builder.resource(new ResourceRequirement(resourceType, resourceId, capabilities, null));
            }
            return builder.build();
        }
    }
}
