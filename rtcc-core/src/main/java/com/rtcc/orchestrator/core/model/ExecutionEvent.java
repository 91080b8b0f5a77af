package com.rtcc.orchestrator.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of something that happened to an execution.
 *
 * Invariants:
 * - sequenceNumber is contiguous within an execution
 * - events are never modified
 */
public record ExecutionEvent(
    UUID eventId,
    String executionId,
    long sequenceNumber,
    ExecutionEventType type,
    Instant timestamp,
    JsonNode payload,
    String actorType
) {
    public static final String ACTOR_ENGINE = "ENGINE";
    public static final String ACTOR_KERNEL = "KERNEL";
    public static final String ACTOR_OPERATOR = "OPERATOR";

    public static ExecutionEvent create(
            String executionId,
            long sequenceNumber,
            ExecutionEventType type,
            JsonNode payload,
            String actorType) {
        return new ExecutionEvent(UUID.randomUUID(), executionId, sequenceNumber, type,
            Instant.now(), payload, actorType);
    }

    public boolean isStepEvent() {
        return type.name().startsWith("STEP_");
    }
}
