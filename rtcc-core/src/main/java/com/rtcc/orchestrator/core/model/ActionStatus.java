package com.rtcc.orchestrator.core.model;

/**
 * Position of an action in the kernel's pipeline.
 */
public enum ActionStatus {
    QUEUED,
    AWAITING_CONFIRMATION,
    DISPATCHED,
    SUCCEEDED,
    FAILED,
    VETOED,
    SHED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == VETOED
            || this == SHED || this == CANCELLED;
    }
}
