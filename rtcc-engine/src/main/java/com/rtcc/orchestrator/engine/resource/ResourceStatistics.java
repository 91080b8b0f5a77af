package com.rtcc.orchestrator.engine.resource;

/**
 * Allocation counters since startup.
 */
public record ResourceStatistics(
    int totalResources,
    long totalAllocations,
    int activeAllocations,
    long completedAllocations,
    long failedAllocations
) {}
