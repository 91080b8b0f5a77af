package com.rtcc.orchestrator.core.model;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Routes normalized events to named pipelines.
 * Empty channel or category sets mean "any". The priority threshold is a ceiling:
 * an event matches only if its level is numerically at or below it.
 * Conditions are expressions such as {@code confidence >= 0.8} evaluated against event data.
 */
public record RoutingRule(
    String ruleId,
    String name,
    Set<String> sourceChannels,
    Set<EventCategory> categories,
    EventPriority priorityThreshold,
    List<String> conditions,
    List<String> targetPipelines,
    boolean enabled
) {
    public RoutingRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Routing rule name cannot be empty");
        }
        if (ruleId == null) {
            ruleId = UUID.randomUUID().toString();
        }
        sourceChannels = sourceChannels == null ? Set.of() : Set.copyOf(sourceChannels);
        categories = categories == null ? Set.of() : Set.copyOf(categories);
        if (priorityThreshold == null) {
            priorityThreshold = EventPriority.INFO;
        }
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        targetPipelines = targetPipelines == null ? List.of() : List.copyOf(targetPipelines);
    }

    /**
     * Check channel, category and priority filters. Conditions are evaluated by the router.
     */
    public boolean matchesEnvelope(NormalizedEvent event) {
        if (!enabled) {
            return false;
        }
        if (!sourceChannels.isEmpty() && !sourceChannels.contains(event.sourceChannel())) {
            return false;
        }
        if (!categories.isEmpty() && !categories.contains(event.category())) {
            return false;
        }
        return event.priority().isWithin(priorityThreshold);
    }

    public RoutingRule withEnabled(boolean enabled) {
        return new RoutingRule(ruleId, name, sourceChannels, categories, priorityThreshold,
            conditions, targetPipelines, enabled);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private String ruleId;
        private final String name;
        private Set<String> sourceChannels = Set.of();
        private Set<EventCategory> categories = Set.of();
        private EventPriority priorityThreshold = EventPriority.INFO;
        private List<String> conditions = List.of();
        private List<String> targetPipelines = List.of();
        private boolean enabled = true;

        private Builder(String name) {
            this.name = name;
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder sourceChannels(String... channels) {
            this.sourceChannels = Set.of(channels);
            return this;
        }

        public Builder categories(EventCategory... categories) {
            this.categories = Set.of(categories);
            return this;
        }

        public Builder priorityThreshold(EventPriority threshold) {
            this.priorityThreshold = threshold;
            return this;
        }

        public Builder conditions(String... conditions) {
            this.conditions = List.of(conditions);
            return this;
        }

        public Builder targetPipelines(String... pipelines) {
            this.targetPipelines = List.of(pipelines);
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public RoutingRule build() {
            return new RoutingRule(ruleId, name, sourceChannels, categories, priorityThreshold,
                conditions, targetPipelines, enabled);
        }
    }
}
