package com.rtcc.orchestrator.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Exclusive hold of one resource on behalf of a workflow.
 * Active until {@code releasedAt} is set.
 */
public record ResourceAllocation(
    String allocationId,
    String resourceId,
    ResourceType resourceType,
    String workflowId,
    String requester,
    int priority,
    String purpose,
    Instant startTime,
    Duration duration,
    Instant releasedAt
) {
    public static ResourceAllocation create(
            Resource resource,
            String workflowId,
            String requester,
            int priority,
            String purpose,
            Duration duration) {
        return new ResourceAllocation(
            UUID.randomUUID().toString(),
            resource.resourceId(),
            resource.type(),
            workflowId,
            requester,
            priority,
            purpose,
            Instant.now(),
            duration,
            null
        );
    }

    public boolean isActive() {
        return releasedAt == null;
    }

    /**
     * Expected end of the allocation, or null for open-ended holds.
     */
    public Instant expectedEnd() {
        return duration == null ? null : startTime.plus(duration);
    }

    public ResourceAllocation released() {
        return new ResourceAllocation(allocationId, resourceId, resourceType, workflowId,
            requester, priority, purpose, startTime, duration, Instant.now());
    }
}
