package com.rtcc.orchestrator.engine.persistence;

import com.rtcc.orchestrator.core.model.ActionType;
import com.rtcc.orchestrator.core.model.OrchestrationResult;
import com.rtcc.orchestrator.core.repository.AuditTrailRepository;

import java.util.List;

/**
 * In-memory implementation of AuditTrailRepository.
 * Long-term retention belongs to an external audit sink.
 */
public class InMemoryAuditTrailRepository implements AuditTrailRepository {

    private final BoundedHistory<OrchestrationResult> trail;

    public InMemoryAuditTrailRepository() {
        this(10_000);
    }

    public InMemoryAuditTrailRepository(int historyLimit) {
        this.trail = new BoundedHistory<>(historyLimit);
    }

    @Override
    public void append(OrchestrationResult result) {
        trail.append(result);
    }

    @Override
    public List<OrchestrationResult> findRecent(String executionId, ActionType actionType, int limit) {
        return trail.recent(r -> (executionId == null || executionId.equals(r.executionId()))
            && (actionType == null || actionType == r.actionType()), limit);
    }

    @Override
    public long count() {
        return trail.appendedCount();
    }
}
