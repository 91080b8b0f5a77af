package com.rtcc.orchestrator.core.repository;

import com.rtcc.orchestrator.core.model.GuardrailCheck;
import com.rtcc.orchestrator.core.model.PolicyType;

import java.util.List;

/**
 * Append-only history of guardrail checks.
 */
public interface GuardrailCheckRepository {

    void append(GuardrailCheck check);

    /**
     * Most recent checks first.
     *
     * @param policyType Filter by policy type, or null for all
     * @param limit Maximum number of results
     */
    List<GuardrailCheck> findRecent(PolicyType policyType, int limit);

    /**
     * All retained checks in append order.
     */
    List<GuardrailCheck> findAll();
}
