package com.rtcc.orchestrator.engine.persistence;

import com.rtcc.orchestrator.core.model.GuardrailCheck;
import com.rtcc.orchestrator.core.model.PolicyType;
import com.rtcc.orchestrator.core.repository.GuardrailCheckRepository;

import java.util.List;

/**
 * In-memory implementation of GuardrailCheckRepository.
 */
public class InMemoryGuardrailCheckRepository implements GuardrailCheckRepository {

    private final BoundedHistory<GuardrailCheck> checks;

    public InMemoryGuardrailCheckRepository() {
        this(10_000);
    }

    public InMemoryGuardrailCheckRepository(int historyLimit) {
        this.checks = new BoundedHistory<>(historyLimit);
    }

    @Override
    public void append(GuardrailCheck check) {
        checks.append(check);
    }

    @Override
    public List<GuardrailCheck> findRecent(PolicyType policyType, int limit) {
        return checks.recent(c -> policyType == null || c.policyType() == policyType, limit);
    }

    @Override
    public List<GuardrailCheck> findAll() {
        return checks.snapshot();
    }
}
