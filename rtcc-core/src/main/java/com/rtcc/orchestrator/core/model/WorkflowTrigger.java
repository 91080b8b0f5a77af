package com.rtcc.orchestrator.core.model;

import java.time.Duration;
import java.util.List;

/**
 * What starts a workflow.
 * For event triggers, empty event type or source lists mean "any"; conditions are
 * expressions evaluated against the event data. Schedule triggers fire every {@code interval}.
 */
public record WorkflowTrigger(
    TriggerType type,
    List<String> eventTypes,
    List<String> eventSources,
    List<String> conditions,
    Duration interval,
    boolean enabled
) {
    public WorkflowTrigger {
        if (type == null) {
            throw new IllegalArgumentException("Trigger type is required");
        }
        eventTypes = eventTypes == null ? List.of() : List.copyOf(eventTypes);
        eventSources = eventSources == null ? List.of() : List.copyOf(eventSources);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        if (type == TriggerType.SCHEDULE && (interval == null || interval.isZero() || interval.isNegative())) {
            throw new IllegalArgumentException("Schedule trigger needs a positive interval");
        }
    }

    public static WorkflowTrigger onEvent(List<String> eventTypes, List<String> eventSources, String... conditions) {
        return new WorkflowTrigger(TriggerType.EVENT, eventTypes, eventSources, List.of(conditions), null, true);
    }

    public static WorkflowTrigger manual() {
        return new WorkflowTrigger(TriggerType.MANUAL, List.of(), List.of(), List.of(), null, true);
    }

    public static WorkflowTrigger api() {
        return new WorkflowTrigger(TriggerType.API, List.of(), List.of(), List.of(), null, true);
    }

    public static WorkflowTrigger every(Duration interval) {
        return new WorkflowTrigger(TriggerType.SCHEDULE, List.of(), List.of(), List.of(), interval, true);
    }

    /**
     * Check event type and source against this trigger. Conditions are evaluated by the engine.
     */
    public boolean matchesEvent(String eventType, String eventSource) {
        if (!enabled || type != TriggerType.EVENT) {
            return false;
        }
        boolean typeMatches = eventTypes.isEmpty() || eventTypes.contains(eventType);
        boolean sourceMatches = eventSources.isEmpty() || eventSources.contains(eventSource);
        return typeMatches && sourceMatches;
    }

    public WorkflowTrigger disabled() {
        return new WorkflowTrigger(type, eventTypes, eventSources, conditions, interval, false);
    }
}
