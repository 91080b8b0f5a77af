package com.rtcc.orchestrator.core.repository;

import com.rtcc.orchestrator.core.model.ExecutionStatus;
import com.rtcc.orchestrator.core.model.WorkflowExecution;

import java.util.List;
import java.util.Optional;

/**
 * Storage for workflow executions.
 */
public interface WorkflowExecutionRepository {

    /**
     * Insert or replace an execution.
     */
    void save(WorkflowExecution execution);

    Optional<WorkflowExecution> findById(String executionId);

    /**
     * Executions that have not reached a terminal state.
     */
    List<WorkflowExecution> findActive();

    /**
     * Most recent executions first.
     *
     * @param status Filter by status, or null for all
     * @param limit Maximum number of results
     */
    List<WorkflowExecution> findRecent(ExecutionStatus status, int limit);

    long count();
}
