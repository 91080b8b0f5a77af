package com.rtcc.orchestrator.engine.policy;

import com.rtcc.orchestrator.core.model.PolicyType;

import java.util.Map;

/**
 * Compliance over a window of recent checks, grouped by policy type.
 *
 * @param window Number of checks the summary covers
 * @param byType Per policy type figures
 */
public record ComplianceSummary(int window, Map<PolicyType, Compliance> byType) {

    /**
     * @param complianceRate Passed checks as a percentage of total
     * @param averageScore Mean check score
     */
    public record Compliance(long total, long passed, long failed, double complianceRate, double averageScore) {}
}
