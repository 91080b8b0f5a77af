package com.rtcc.orchestrator.core.model;

/**
 * Why an action did not succeed.
 */
public enum FailureKind {
    SCHEMA_ERROR,
    POLICY_VIOLATION,
    RESOURCE_UNAVAILABLE,
    HANDLER_FAILURE,
    HANDLER_TIMEOUT,
    QUEUE_OVERLOAD,
    UNKNOWN_SUBSYSTEM,
    CONFIRMATION_REJECTED,
    CANCELLED
}
