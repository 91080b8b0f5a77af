package com.rtcc.orchestrator.core.model;

/**
 * Types of facts recorded in an execution's event history.
 */
public enum ExecutionEventType {
    // Execution lifecycle
    EXECUTION_CREATED,
    EXECUTION_STARTED,
    EXECUTION_COMPLETED,
    EXECUTION_FAILED,
    EXECUTION_TIMED_OUT,
    EXECUTION_ABORTED,

    // Step lifecycle
    STEP_DISPATCHED,
    STEP_COMPLETED,
    STEP_FAILED,
    STEP_TIMED_OUT,
    STEP_BLOCKED,
    STEP_CANCELLED,

    // Compensation
    COMPENSATION_STARTED,
    COMPENSATION_COMPLETED
}
