package com.rtcc.orchestrator.core.model;

/**
 * Outcome of a single step within an execution.
 */
public enum StepStatus {
    DISPATCHED,
    COMPLETED,
    FAILED,
    TIMED_OUT,
    BLOCKED,
    CANCELLED;

    public boolean isResolved() {
        return this != DISPATCHED;
    }

    public boolean isFailure() {
        return this == FAILED || this == TIMED_OUT || this == BLOCKED || this == CANCELLED;
    }
}
