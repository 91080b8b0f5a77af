package com.rtcc.orchestrator.core.repository;

import com.rtcc.orchestrator.core.model.ExecutionEvent;

import java.util.List;

/**
 * Append-only event log per execution.
 */
public interface ExecutionEventRepository {

    /**
     * Append an event. Events are never modified after append.
     */
    void append(ExecutionEvent event);

    /**
     * All events for an execution ordered by sequence number.
     */
    List<ExecutionEvent> findByExecutionId(String executionId);

    /**
     * Next sequence number for an execution, starting at 1.
     */
    long getNextSequenceNumber(String executionId);

    /**
     * Drop an execution's events and its sequence counter.
     */
    void deleteByExecutionId(String executionId);
}
