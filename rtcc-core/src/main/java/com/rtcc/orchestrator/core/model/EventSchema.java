package com.rtcc.orchestrator.core.model;

import java.util.Set;

/**
 * Per-channel contract for raw events.
 * Required fields must be present (non-null) in the raw payload; defaults
 * apply when the payload does not override them.
 */
public record EventSchema(
    String channel,
    Set<String> requiredFields,
    Set<String> optionalFields,
    String defaultEventType,
    EventCategory defaultCategory,
    EventPriority defaultPriority
) {
    public EventSchema {
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("Schema channel cannot be empty");
        }
        requiredFields = requiredFields == null ? Set.of() : Set.copyOf(requiredFields);
        optionalFields = optionalFields == null ? Set.of() : Set.copyOf(optionalFields);
        if (defaultPriority == null) {
            defaultPriority = EventPriority.MEDIUM;
        }
    }

    public static Builder builder(String channel) {
        return new Builder(channel);
    }

    public static class Builder {
        private final String channel;
        private Set<String> requiredFields = Set.of();
        private Set<String> optionalFields = Set.of();
        private String defaultEventType;
        private EventCategory defaultCategory;
        private EventPriority defaultPriority = EventPriority.MEDIUM;

        private Builder(String channel) {
            this.channel = channel;
        }

        public Builder requiredFields(String... fields) {
            this.requiredFields = Set.of(fields);
            return this;
        }

        public Builder optionalFields(String... fields) {
            this.optionalFields = Set.of(fields);
            return this;
        }

        public Builder defaultEventType(String eventType) {
            this.defaultEventType = eventType;
            return this;
        }

        public Builder defaultCategory(EventCategory category) {
            this.defaultCategory = category;
            return this;
        }

        public Builder defaultPriority(EventPriority priority) {
            this.defaultPriority = priority;
            return this;
        }

        public EventSchema build() {
            return new EventSchema(channel, requiredFields, optionalFields,
                defaultEventType, defaultCategory, defaultPriority);
        }
    }
}
