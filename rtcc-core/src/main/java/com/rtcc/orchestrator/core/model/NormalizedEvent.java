package com.rtcc.orchestrator.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical shape of an ingested event.
 * Immutable once created; {@code routedTo} is filled in on a copy after routing.
 *
 * Invariants:
 * - eventId is generated here and never equals the originating system's id
 * - priority is always one of the five levels
 */
public record NormalizedEvent(
    String eventId,
    String sourceEventId,
    String sourceChannel,
    String eventType,
    EventCategory category,
    EventPriority priority,
    Instant timestamp,
    GeoLocation location,
    Map<String, Object> data,
    Map<String, Object> metadata,
    List<String> routedTo
) {
    public NormalizedEvent {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        routedTo = routedTo == null ? List.of() : List.copyOf(routedTo);
    }

    /**
     * Create a copy recording which pipelines received the event.
     */
    public NormalizedEvent withRoutedTo(List<String> pipelines) {
        return new NormalizedEvent(eventId, sourceEventId, sourceChannel, eventType, category,
            priority, timestamp, location, data, metadata, pipelines);
    }
}
