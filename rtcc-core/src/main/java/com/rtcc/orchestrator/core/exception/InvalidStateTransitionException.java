package com.rtcc.orchestrator.core.exception;

import com.rtcc.orchestrator.core.model.ExecutionStatus;

/**
 * Thrown when an execution is asked to leave a state it cannot leave.
 */
public class InvalidStateTransitionException extends OrchestratorException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(ExecutionStatus currentState, ExecutionStatus targetState) {
        super(ERROR_CODE, String.format("Cannot transition from %s to %s", currentState, targetState));
    }

    public InvalidStateTransitionException(String entityType, String currentState, String targetState) {
        super(ERROR_CODE, String.format(
            "Cannot transition %s from %s to %s",
            entityType, currentState, targetState
        ));
    }
}
