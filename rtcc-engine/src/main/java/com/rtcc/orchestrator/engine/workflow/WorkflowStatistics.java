package com.rtcc.orchestrator.engine.workflow;

/**
 * Point-in-time workflow engine counters.
 */
public record WorkflowStatistics(
    int registeredWorkflows,
    long totalExecutions,
    long completedExecutions,
    long failedExecutions,
    long timedOutExecutions,
    long abortedExecutions,
    int activeExecutions,
    double successRate
) {}
