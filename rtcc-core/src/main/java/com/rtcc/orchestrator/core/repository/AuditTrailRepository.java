package com.rtcc.orchestrator.core.repository;

import com.rtcc.orchestrator.core.model.ActionType;
import com.rtcc.orchestrator.core.model.OrchestrationResult;

import java.util.List;

/**
 * Append-only trail of action outcomes.
 * Only the kernel appends.
 */
public interface AuditTrailRepository {

    void append(OrchestrationResult result);

    /**
     * Most recent results first.
     *
     * @param executionId Filter by owning execution, or null for all
     * @param actionType Filter by action type, or null for all
     * @param limit Maximum number of results
     */
    List<OrchestrationResult> findRecent(String executionId, ActionType actionType, int limit);

    long count();
}
