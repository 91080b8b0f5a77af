package com.rtcc.orchestrator.engine.routing;

import com.rtcc.orchestrator.core.exception.NotFoundException;
import com.rtcc.orchestrator.core.exception.SchemaValidationException;
import com.rtcc.orchestrator.core.model.EventCategory;
import com.rtcc.orchestrator.core.model.EventPriority;
import com.rtcc.orchestrator.core.model.EventSchema;
import com.rtcc.orchestrator.core.model.GeoLocation;
import com.rtcc.orchestrator.core.model.NormalizedEvent;
import com.rtcc.orchestrator.core.model.RoutingRule;
import com.rtcc.orchestrator.engine.condition.ConditionEvaluator;
import com.rtcc.orchestrator.engine.logging.LoggingContext;
import com.rtcc.orchestrator.engine.metrics.OrchestrationMetrics;
import com.rtcc.orchestrator.engine.persistence.BoundedHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Normalizes raw channel events and forwards them to pipelines selected by routing rules.
 *
 * Rules are evaluated in registration order; every matching rule's pipelines receive
 * the event once. Delivery to each pipeline is isolated: a failure is logged and
 * counted and the remaining pipelines are still served.
 */
public class EventRouter {

    private static final Logger log = LoggerFactory.getLogger(EventRouter.class);

    private static final Map<String, EventCategory> CHANNEL_CATEGORIES = Map.ofEntries(
        Map.entry("alerts", EventCategory.ALERT),
        Map.entry("incidents", EventCategory.INCIDENT),
        Map.entry("tactical", EventCategory.TACTICAL),
        Map.entry("officer_safety", EventCategory.OFFICER),
        Map.entry("drone_telemetry", EventCategory.DRONE),
        Map.entry("robot_telemetry", EventCategory.ROBOT),
        Map.entry("investigations", EventCategory.INVESTIGATION),
        Map.entry("threats", EventCategory.THREAT),
        Map.entry("emergency", EventCategory.EMERGENCY),
        Map.entry("compliance", EventCategory.COMPLIANCE),
        Map.entry("sensor_data", EventCategory.SENSOR),
        Map.entry("city_brain", EventCategory.CITY),
        Map.entry("human_stability", EventCategory.HUMAN_STABILITY),
        Map.entry("predictive", EventCategory.PREDICTIVE),
        Map.entry("fusion_cloud", EventCategory.FUSION),
        Map.entry("cyber_intel", EventCategory.CYBER),
        Map.entry("governance", EventCategory.GOVERNANCE)
    );

    private final ConditionEvaluator conditionEvaluator;
    private final OrchestrationMetrics metrics;

    private final Map<String, EventSchema> schemas = new ConcurrentHashMap<>();
    private final List<RoutingRule> rules = new CopyOnWriteArrayList<>();
    private final Map<String, EventPipeline> pipelines = new ConcurrentHashMap<>();
    private final Set<String> channels = ConcurrentHashMap.newKeySet();
    private final BoundedHistory<NormalizedEvent> history;

    // Statistics
    private final AtomicLong received = new AtomicLong();
    private final AtomicLong routed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong schemaErrors = new AtomicLong();
    private final AtomicLong pipelineFailures = new AtomicLong();
    private final Map<String, AtomicLong> byChannel = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> byCategory = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> byRule = new ConcurrentHashMap<>();

    public EventRouter(ConditionEvaluator conditionEvaluator, OrchestrationMetrics metrics, int historyLimit) {
        this.conditionEvaluator = conditionEvaluator;
        this.metrics = metrics;
        this.history = new BoundedHistory<>(historyLimit);
        this.channels.addAll(CHANNEL_CATEGORIES.keySet());
    }

    // ========== Registration ==========

    /**
     * Register or replace the schema for a channel.
     */
    public void registerSchema(EventSchema schema) {
        schemas.put(schema.channel(), schema);
        channels.add(schema.channel());
        log.info("Registered event schema for channel {} (required: {})", schema.channel(), schema.requiredFields());
    }

    public Optional<EventSchema> getSchema(String channel) {
        return Optional.ofNullable(schemas.get(channel));
    }

    public List<EventSchema> listSchemas() {
        return List.copyOf(schemas.values());
    }

    public void registerChannel(String channel) {
        channels.add(channel);
    }

    public Set<String> listChannels() {
        return Collections.unmodifiableSet(new TreeSet<>(channels));
    }

    /**
     * Append a routing rule. A rule with the same id is replaced in place.
     */
    public RoutingRule addRule(RoutingRule rule) {
        synchronized (rules) {
            for (int i = 0; i < rules.size(); i++) {
                if (rules.get(i).ruleId().equals(rule.ruleId())) {
                    rules.set(i, rule);
                    log.info("Replaced routing rule {} ({})", rule.name(), rule.ruleId());
                    return rule;
                }
            }
            rules.add(rule);
        }
        log.info("Added routing rule {} -> {}", rule.name(), rule.targetPipelines());
        return rule;
    }

    public boolean removeRule(String ruleId) {
        boolean removed = rules.removeIf(r -> r.ruleId().equals(ruleId));
        if (removed) {
            log.info("Removed routing rule {}", ruleId);
        }
        return removed;
    }

    /**
     * Enable or disable a rule.
     *
     * @throws NotFoundException if no rule has the given id
     */
    public RoutingRule setRuleEnabled(String ruleId, boolean enabled) {
        synchronized (rules) {
            for (int i = 0; i < rules.size(); i++) {
                RoutingRule rule = rules.get(i);
                if (rule.ruleId().equals(ruleId)) {
                    RoutingRule updated = rule.withEnabled(enabled);
                    rules.set(i, updated);
                    return updated;
                }
            }
        }
        throw new NotFoundException("RoutingRule", ruleId);
    }

    public List<RoutingRule> listRules() {
        return List.copyOf(rules);
    }

    public void registerPipeline(String name, EventPipeline pipeline) {
        pipelines.put(name, pipeline);
        log.info("Registered pipeline {}", name);
    }

    public boolean unregisterPipeline(String name) {
        return pipelines.remove(name) != null;
    }

    public Set<String> listPipelines() {
        return Collections.unmodifiableSet(new TreeSet<>(pipelines.keySet()));
    }

    // ========== Normalization ==========

    /**
     * Validate a raw event against its channel schema and map it into canonical shape.
     * Channels without a schema accept any payload.
     *
     * @throws SchemaValidationException if required fields are missing
     */
    public NormalizedEvent normalize(String channel, Map<String, Object> rawEvent) {
        if (channel == null || channel.isBlank()) {
            throw new SchemaValidationException(String.valueOf(channel), "channel is required");
        }
        if (rawEvent == null) {
            throw new SchemaValidationException(channel, "event payload is empty");
        }
        EventSchema schema = schemas.get(channel);
        if (schema != null) {
            List<String> missing = schema.requiredFields().stream()
                .filter(f -> rawEvent.get(f) == null)
                .sorted()
                .toList();
            if (!missing.isEmpty()) {
                throw new SchemaValidationException(channel, missing);
            }
        }

        String eventType = firstText(rawEvent, "event_type", "type");
        if (eventType == null) {
            eventType = schema != null && schema.defaultEventType() != null ? schema.defaultEventType() : channel;
        }

        return new NormalizedEvent(
            "evt-" + UUID.randomUUID(),
            firstText(rawEvent, "event_id", "id"),
            channel,
            eventType,
            determineCategory(rawEvent, channel, schema),
            determinePriority(rawEvent, schema),
            parseTimestamp(rawEvent.get("timestamp")),
            GeoLocation.fromRaw(rawEvent.containsKey("location") ? rawEvent.get("location") : rawEvent.get("geolocation")),
            extractData(rawEvent),
            extractMetadata(rawEvent),
            List.of()
        );
    }

    private EventCategory determineCategory(Map<String, Object> raw, String channel, EventSchema schema) {
        Object rawCategory = raw.get("category");
        if (rawCategory != null) {
            try {
                return EventCategory.fromCode(rawCategory.toString());
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring unknown category '{}' on channel {}", rawCategory, channel);
            }
        }
        if (schema != null && schema.defaultCategory() != null) {
            return schema.defaultCategory();
        }
        return CHANNEL_CATEGORIES.getOrDefault(channel, EventCategory.SYSTEM);
    }

    private EventPriority determinePriority(Map<String, Object> raw, EventSchema schema) {
        EventPriority priority = EventPriority.parse(raw.containsKey("priority") ? raw.get("priority") : raw.get("severity"));
        if (priority != null) {
            return priority;
        }
        return schema != null ? schema.defaultPriority() : EventPriority.MEDIUM;
    }

    private Instant parseTimestamp(Object raw) {
        if (raw instanceof Number epochMillis) {
            return Instant.ofEpochMilli(epochMillis.longValue());
        }
        if (raw instanceof String text) {
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException e) {
                log.debug("Unparseable timestamp '{}', using receive time", text);
            }
        }
        return Instant.now();
    }

    private Map<String, Object> extractData(Map<String, Object> raw) {
        Map<String, Object> data = new LinkedHashMap<>(raw);
        data.remove("metadata");
        for (String nested : new String[]{"details", "data"}) {
            if (raw.get(nested) instanceof Map<?, ?> map) {
                map.forEach((k, v) -> data.putIfAbsent(String.valueOf(k), v));
            }
        }
        return data;
    }

    private Map<String, Object> extractMetadata(Map<String, Object> raw) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (raw.get("metadata") instanceof Map<?, ?> map) {
            map.forEach((k, v) -> metadata.put(String.valueOf(k), v));
        }
        metadata.put("received_at", Instant.now().toString());
        return metadata;
    }

    private static String firstText(Map<String, Object> raw, String... keys) {
        for (String key : keys) {
            Object value = raw.get(key);
            if (value != null && !value.toString().isBlank()) {
                return value.toString();
            }
        }
        return null;
    }

    // ========== Routing ==========

    /**
     * Normalize a raw event and deliver it to every pipeline selected by a matching rule.
     *
     * @return the normalized event with the pipelines it reached
     * @throws SchemaValidationException if the event fails its channel schema; it is dropped
     */
    public NormalizedEvent route(String channel, Map<String, Object> rawEvent) {
        try (var ctx = LoggingContext.forChannel(channel)) {
            received.incrementAndGet();
            increment(byChannel, String.valueOf(channel));
            metrics.eventReceived(channel);

            NormalizedEvent event;
            try {
                event = normalize(channel, rawEvent);
            } catch (SchemaValidationException e) {
                schemaErrors.incrementAndGet();
                dropped.incrementAndGet();
                metrics.eventDropped(channel, "schema_error");
                log.warn("Dropped event on channel {}: {}", channel, e.getMessage());
                throw e;
            }
            channels.add(channel);
            increment(byCategory, event.category().code());

            LinkedHashSet<String> targets = new LinkedHashSet<>();
            for (RoutingRule rule : rules) {
                if (rule.matchesEnvelope(event) && conditionEvaluator.evaluateAll(rule.conditions(), event.data())) {
                    increment(byRule, rule.name());
                    targets.addAll(rule.targetPipelines());
                    log.debug("Event {} matched rule {}", event.eventId(), rule.name());
                }
            }

            List<String> delivered = new ArrayList<>();
            for (String target : targets) {
                if (deliver(target, event)) {
                    delivered.add(target);
                }
            }

            NormalizedEvent result = event.withRoutedTo(delivered);
            history.append(result);
            if (targets.isEmpty()) {
                dropped.incrementAndGet();
                metrics.eventDropped(channel, "no_matching_rule");
                log.debug("Event {} ({}) matched no routing rule", event.eventId(), event.eventType());
            } else {
                routed.incrementAndGet();
                metrics.eventRouted(channel, delivered.size());
                log.info("Routed event {} ({}, priority {}) to {}", event.eventId(), event.eventType(),
                    event.priority().level(), delivered);
            }
            return result;
        }
    }

    private boolean deliver(String pipelineName, NormalizedEvent event) {
        EventPipeline pipeline = pipelines.get(pipelineName);
        if (pipeline == null) {
            log.debug("No handler registered for pipeline {}", pipelineName);
            return false;
        }
        try {
            pipeline.deliver(event);
            return true;
        } catch (Exception e) {
            pipelineFailures.incrementAndGet();
            log.error("Pipeline {} failed on event {}", pipelineName, event.eventId(), e);
            return false;
        }
    }

    // ========== Queries ==========

    /**
     * Recently routed events, newest first.
     *
     * @param category Filter by category, or null for all
     */
    public List<NormalizedEvent> getEventHistory(EventCategory category, int limit) {
        return history.recent(e -> category == null || e.category() == category, limit);
    }

    public RouterStatistics getStatistics() {
        return new RouterStatistics(
            received.get(),
            routed.get(),
            dropped.get(),
            schemaErrors.get(),
            pipelineFailures.get(),
            snapshot(byChannel),
            snapshot(byCategory),
            snapshot(byRule),
            rules.size(),
            pipelines.size(),
            schemas.size()
        );
    }

    private static void increment(Map<String, AtomicLong> counters, String key) {
        counters.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
    }

    private static Map<String, Long> snapshot(Map<String, AtomicLong> counters) {
        Map<String, Long> copy = new TreeMap<>();
        counters.forEach((k, v) -> copy.put(k, v.get()));
        return Collections.unmodifiableMap(copy);
    }
}
