package com.rtcc.orchestrator.engine.routing;

import java.util.Map;

/**
 * Point-in-time router counters.
 */
public record RouterStatistics(
    long eventsReceived,
    long eventsRouted,
    long eventsDropped,
    long schemaErrors,
    long pipelineFailures,
    Map<String, Long> eventsByChannel,
    Map<String, Long> eventsByCategory,
    Map<String, Long> matchesByRule,
    int rules,
    int pipelines,
    int schemas
) {}
