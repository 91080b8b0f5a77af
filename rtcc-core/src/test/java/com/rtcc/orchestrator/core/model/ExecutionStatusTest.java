package com.rtcc.orchestrator.core.model;

import com.rtcc.orchestrator.core.exception.InvalidStateTransitionException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionStatusTest {

    @Test
    void isTerminal_shouldIdentifyTerminalStates() {
        assertTrue(ExecutionStatus.COMPLETED.isTerminal());
        assertTrue(ExecutionStatus.FAILED.isTerminal());
        assertTrue(ExecutionStatus.TIMED_OUT.isTerminal());
        assertTrue(ExecutionStatus.ABORTED.isTerminal());

        assertFalse(ExecutionStatus.PENDING.isTerminal());
        assertFalse(ExecutionStatus.RUNNING.isTerminal());
    }

    @Test
    void canTransitionTo_fromPending_shouldNotSkipToCompleted() {
        assertTrue(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.RUNNING));
        assertTrue(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.FAILED));
        assertTrue(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.ABORTED));

        assertFalse(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.COMPLETED));
        assertFalse(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.PENDING));
    }

    @Test
    void canTransitionTo_fromRunning_shouldAllowEveryTerminalState() {
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.COMPLETED));
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.FAILED));
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.TIMED_OUT));
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.ABORTED));

        assertFalse(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.PENDING));
    }

    @Test
    void canTransitionTo_fromTerminalStates_shouldNotAllowAny() {
        for (ExecutionStatus terminal : ExecutionStatus.values()) {
            if (!terminal.isTerminal()) {
                continue;
            }
            for (ExecutionStatus target : ExecutionStatus.values()) {
                assertFalse(terminal.canTransitionTo(target), terminal + " -> " + target);
            }
        }
    }

    @Test
    void transitionTo_shouldStampTimesAndRejectIllegalMoves() {
        Workflow workflow = Workflow.builder()
            .name("Gunfire Response")
            .step(WorkflowStep.builder("alert-officers", ActionType.OFFICER_ALERT, "communications").build())
            .build();
        WorkflowExecution pending = WorkflowExecution.create(workflow, TriggerType.MANUAL, null, Map.of());

        WorkflowExecution running = pending.transitionTo(ExecutionStatus.RUNNING, null);
        assertNotNull(running.startedAt());
        assertNull(running.completedAt());

        WorkflowExecution completed = running.transitionTo(ExecutionStatus.COMPLETED, null);
        assertNotNull(completed.completedAt());
        assertTrue(completed.isTerminal());

        assertThrows(InvalidStateTransitionException.class,
            () -> completed.transitionTo(ExecutionStatus.RUNNING, null));
    }
}
