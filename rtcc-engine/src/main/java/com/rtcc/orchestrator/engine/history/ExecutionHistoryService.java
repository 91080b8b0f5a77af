package com.rtcc.orchestrator.engine.history;

import com.fasterxml.jackson.databind.JsonNode;
import com.rtcc.orchestrator.core.exception.NotFoundException;
import com.rtcc.orchestrator.core.model.ExecutionEvent;
import com.rtcc.orchestrator.core.model.ExecutionEventType;
import com.rtcc.orchestrator.core.model.ExecutionStatus;
import com.rtcc.orchestrator.core.model.WorkflowExecution;
import com.rtcc.orchestrator.core.repository.ExecutionEventRepository;
import com.rtcc.orchestrator.core.repository.WorkflowExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Execution history built from the per-execution event log.
 *
 * Provides:
 * - Full event history with a timeline of key events
 * - Per-step history
 * - Status reconstruction up to a sequence number
 */
public class ExecutionHistoryService {

    private static final Logger log = LoggerFactory.getLogger(ExecutionHistoryService.class);
    private static final int SUMMARY_LIMIT = 200;

    private final WorkflowExecutionRepository executionRepository;
    private final ExecutionEventRepository eventRepository;

    public ExecutionHistoryService(WorkflowExecutionRepository executionRepository,
                                   ExecutionEventRepository eventRepository) {
        this.executionRepository = executionRepository;
        this.eventRepository = eventRepository;
    }

    /**
     * Get full history for an execution.
     */
    public ExecutionHistory getHistory(String executionId) {
        WorkflowExecution execution = executionRepository.findById(executionId)
            .orElseThrow(() -> new NotFoundException("WorkflowExecution", executionId));
        List<ExecutionEvent> events = eventRepository.findByExecutionId(executionId);

        return new ExecutionHistory(
            executionId,
            execution.workflowId(),
            execution.workflowName(),
            execution.status(),
            events,
            buildTimeline(events),
            buildStepHistory(events),
            calculateStatistics(events, execution)
        );
    }

    /**
     * Reconstruct execution state as it was after a given event.
     */
    public ReplayResult replayToSequence(String executionId, long targetSequence) {
        log.debug("Replaying execution {} to sequence {}", executionId, targetSequence);
        List<ExecutionEvent> events = eventRepository.findByExecutionId(executionId).stream()
            .filter(e -> e.sequenceNumber() <= targetSequence)
            .toList();
        if (events.isEmpty()) {
            throw new NotFoundException("WorkflowExecution", executionId);
        }
        return reconstruct(executionId, events);
    }

    private ReplayResult reconstruct(String executionId, List<ExecutionEvent> events) {
        ExecutionStatus status = ExecutionStatus.PENDING;
        Set<String> completedSteps = new LinkedHashSet<>();
        Set<String> failedSteps = new LinkedHashSet<>();
        Set<String> blockedSteps = new LinkedHashSet<>();
        Map<String, JsonNode> stepOutputs = new LinkedHashMap<>();
        boolean compensating = false;
        String lastError = null;

        for (ExecutionEvent event : events) {
            String step = text(event.payload(), "step");
            switch (event.type()) {
                case EXECUTION_STARTED -> status = ExecutionStatus.RUNNING;
                case EXECUTION_COMPLETED -> status = ExecutionStatus.COMPLETED;
                case EXECUTION_FAILED -> status = ExecutionStatus.FAILED;
                case EXECUTION_TIMED_OUT -> status = ExecutionStatus.TIMED_OUT;
                case EXECUTION_ABORTED -> status = ExecutionStatus.ABORTED;
                case STEP_COMPLETED -> {
                    completedSteps.add(step);
                    if (event.payload() != null && event.payload().has("output")) {
                        stepOutputs.put(step, event.payload().get("output"));
                    }
                }
                case STEP_FAILED, STEP_TIMED_OUT, STEP_CANCELLED -> failedSteps.add(step);
                case STEP_BLOCKED -> blockedSteps.add(step);
                case COMPENSATION_STARTED -> compensating = true;
                default -> { /* no state change */ }
            }
            String error = text(event.payload(), "error");
            if (error != null) {
                lastError = error;
            }
        }

        ExecutionEvent last = events.get(events.size() - 1);
        return new ReplayResult(
            executionId,
            last.sequenceNumber(),
            last.timestamp(),
            status,
            completedSteps,
            failedSteps,
            blockedSteps,
            stepOutputs,
            compensating,
            lastError,
            events.size()
        );
    }

    private List<TimelineEntry> buildTimeline(List<ExecutionEvent> events) {
        return events.stream()
            .filter(e -> isKeyEvent(e.type()))
            .map(e -> new TimelineEntry(
                e.timestamp(),
                e.sequenceNumber(),
                e.type().name(),
                text(e.payload(), "step"),
                summarize(e.payload())
            ))
            .toList();
    }

    private Map<String, StepHistory> buildStepHistory(List<ExecutionEvent> events) {
        Map<String, List<StepHistoryEntry>> byStep = new LinkedHashMap<>();
        for (ExecutionEvent event : events) {
            String step = text(event.payload(), "step");
            if (step != null && event.isStepEvent()) {
                byStep.computeIfAbsent(step, k -> new ArrayList<>())
                    .add(new StepHistoryEntry(event.timestamp(), event.type().name(), summarize(event.payload())));
            }
        }
        Map<String, StepHistory> history = new LinkedHashMap<>();
        byStep.forEach((step, entries) -> history.put(step, new StepHistory(step, entries, stepDuration(entries))));
        return history;
    }

    private ExecutionStatistics calculateStatistics(List<ExecutionEvent> events, WorkflowExecution execution) {
        return new ExecutionStatistics(
            events.size(),
            count(events, ExecutionEventType.STEP_DISPATCHED),
            count(events, ExecutionEventType.STEP_COMPLETED),
            count(events, ExecutionEventType.STEP_FAILED) + count(events, ExecutionEventType.STEP_TIMED_OUT),
            count(events, ExecutionEventType.STEP_BLOCKED),
            execution.elapsed()
        );
    }

    private static long count(List<ExecutionEvent> events, ExecutionEventType type) {
        return events.stream().filter(e -> e.type() == type).count();
    }

    private boolean isKeyEvent(ExecutionEventType type) {
        return switch (type) {
            case EXECUTION_STARTED, EXECUTION_COMPLETED, EXECUTION_FAILED,
                 EXECUTION_TIMED_OUT, EXECUTION_ABORTED,
                 STEP_DISPATCHED, STEP_COMPLETED, STEP_FAILED, STEP_TIMED_OUT, STEP_BLOCKED,
                 COMPENSATION_STARTED, COMPENSATION_COMPLETED -> true;
            default -> false;
        };
    }

    private static String text(JsonNode payload, String field) {
        if (payload != null && payload.hasNonNull(field)) {
            return payload.get(field).asText();
        }
        return null;
    }

    private static String summarize(JsonNode payload) {
        if (payload == null) {
            return null;
        }
        String str = payload.toString();
        return str.length() > SUMMARY_LIMIT ? str.substring(0, SUMMARY_LIMIT) + "..." : str;
    }

    private static Duration stepDuration(List<StepHistoryEntry> entries) {
        Instant dispatched = null;
        Instant resolved = null;
        for (StepHistoryEntry entry : entries) {
            if (entry.eventType().equals(ExecutionEventType.STEP_DISPATCHED.name())) {
                dispatched = entry.timestamp();
            } else {
                resolved = entry.timestamp();
            }
        }
        if (dispatched != null && resolved != null) {
            return Duration.between(dispatched, resolved);
        }
        return Duration.ZERO;
    }

    // ========== DTOs ==========

    public record ExecutionHistory(
        String executionId,
        String workflowId,
        String workflowName,
        ExecutionStatus currentStatus,
        List<ExecutionEvent> events,
        List<TimelineEntry> timeline,
        Map<String, StepHistory> stepHistory,
        ExecutionStatistics statistics
    ) {}

    public record ReplayResult(
        String executionId,
        long replayedToSequence,
        Instant replayedToTimestamp,
        ExecutionStatus reconstructedStatus,
        Set<String> completedSteps,
        Set<String> failedSteps,
        Set<String> blockedSteps,
        Map<String, JsonNode> stepOutputs,
        boolean compensating,
        String lastError,
        int eventCount
    ) {}

    public record TimelineEntry(
        Instant timestamp,
        long sequenceNumber,
        String eventType,
        String stepName,
        String summary
    ) {}

    public record StepHistory(
        String stepName,
        List<StepHistoryEntry> entries,
        Duration duration
    ) {}

    public record StepHistoryEntry(
        Instant timestamp,
        String eventType,
        String summary
    ) {}

    public record ExecutionStatistics(
        long totalEvents,
        long stepsDispatched,
        long stepsCompleted,
        long stepsFailed,
        long stepsBlocked,
        Duration totalDuration
    ) {}
}
