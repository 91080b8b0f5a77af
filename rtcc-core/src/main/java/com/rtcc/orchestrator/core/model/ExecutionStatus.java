package com.rtcc.orchestrator.core.model;

/**
 * Lifecycle states for a workflow execution.
 * pending -> running -> {completed, failed, timed_out, aborted}. Terminal states are final.
 */
public enum ExecutionStatus {
    /**
     * Created on trigger match, nothing dispatched yet.
     * Transitions: -> RUNNING, FAILED, TIMED_OUT, ABORTED
     */
    PENDING,

    /**
     * At least one step has been dispatched.
     * Transitions: -> COMPLETED, FAILED, TIMED_OUT, ABORTED
     */
    RUNNING,

    /**
     * Every step resolved without a propagating failure. Terminal state.
     */
    COMPLETED,

    /**
     * A required step failed. Terminal state.
     */
    FAILED,

    /**
     * The execution's overall timeout elapsed. Terminal state.
     */
    TIMED_OUT,

    /**
     * Stopped by an operator. Terminal state.
     */
    ABORTED;

    /**
     * Check if this state is terminal (no further transitions possible).
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TIMED_OUT || this == ABORTED;
    }

    /**
     * Check if this state can transition to the target state.
     */
    public boolean canTransitionTo(ExecutionStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING || target == FAILED
                || target == TIMED_OUT || target == ABORTED;
            case RUNNING -> target == COMPLETED || target == FAILED
                || target == TIMED_OUT || target == ABORTED;
            case COMPLETED, FAILED, TIMED_OUT, ABORTED -> false;
        };
    }
}
