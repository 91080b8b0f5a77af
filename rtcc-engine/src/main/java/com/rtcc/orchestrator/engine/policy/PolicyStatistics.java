package com.rtcc.orchestrator.engine.policy;

import com.rtcc.orchestrator.core.model.PolicyType;

import java.util.Map;

/**
 * Point-in-time policy engine counters.
 */
public record PolicyStatistics(
    long totalChecks,
    long passedChecks,
    long failedChecks,
    long blocksIssued,
    long warningsIssued,
    long checkerErrors,
    int totalBindings,
    int enabledBindings,
    Map<PolicyType, Long> bindingsByType
) {}
