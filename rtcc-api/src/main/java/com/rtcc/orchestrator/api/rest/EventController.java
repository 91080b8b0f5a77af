package com.rtcc.orchestrator.api.rest;

import com.rtcc.orchestrator.core.exception.NotFoundException;
import com.rtcc.orchestrator.core.model.EventCategory;
import com.rtcc.orchestrator.core.model.EventPriority;
import com.rtcc.orchestrator.core.model.EventSchema;
import com.rtcc.orchestrator.core.model.NormalizedEvent;
import com.rtcc.orchestrator.core.model.RoutingRule;
import com.rtcc.orchestrator.engine.kernel.OrchestrationKernel;
import com.rtcc.orchestrator.engine.routing.EventRouter;
import com.rtcc.orchestrator.engine.routing.RouterStatistics;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST API for event ingestion and routing configuration.
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final OrchestrationKernel kernel;
    private final EventRouter router;

    public EventController(OrchestrationKernel kernel, EventRouter router) {
        this.kernel = kernel;
        this.router = router;
    }

    /**
     * Ingest a raw event from a channel.
     */
    @PostMapping("/{channel}")
    public ResponseEntity<NormalizedEvent> ingest(
            @PathVariable String channel,
            @RequestBody Map<String, Object> rawEvent) {
        NormalizedEvent event = kernel.ingest(channel, rawEvent);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(event);
    }

    // ========== Rules ==========

    @GetMapping("/rules")
    public List<RoutingRule> listRules() {
        return router.listRules();
    }

    @PostMapping("/rules")
    public ResponseEntity<RoutingRule> addRule(@Valid @RequestBody RoutingRuleRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(router.addRule(request.toRule()));
    }

    @DeleteMapping("/rules/{ruleId}")
    public ResponseEntity<Void> removeRule(@PathVariable String ruleId) {
        if (!router.removeRule(ruleId)) {
            throw new NotFoundException("RoutingRule", ruleId);
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/rules/{ruleId}/enable")
    public RoutingRule enableRule(@PathVariable String ruleId) {
        return router.setRuleEnabled(ruleId, true);
    }

    @PostMapping("/rules/{ruleId}/disable")
    public RoutingRule disableRule(@PathVariable String ruleId) {
        return router.setRuleEnabled(ruleId, false);
    }

    // ========== Schemas, channels and pipelines ==========

    @GetMapping("/schemas")
    public List<EventSchema> listSchemas() {
        return router.listSchemas();
    }

    @PostMapping("/schemas")
    public ResponseEntity<EventSchema> registerSchema(@Valid @RequestBody EventSchemaRequest request) {
        EventSchema schema = request.toSchema();
        router.registerSchema(schema);
        return ResponseEntity.status(HttpStatus.CREATED).body(schema);
    }

    @GetMapping("/channels")
    public Set<String> listChannels() {
        return router.listChannels();
    }

    @GetMapping("/pipelines")
    public Set<String> listPipelines() {
        return router.listPipelines();
    }

    // ========== Queries ==========

    @GetMapping("/history")
    public List<NormalizedEvent> history(
            @RequestParam(required = false) String category,
            @RequestParam(defaultValue = "100") int limit) {
        return router.getEventHistory(category == null ? null : EventCategory.fromCode(category), limit);
    }

    @GetMapping("/statistics")
    public RouterStatistics statistics() {
        return router.getStatistics();
    }

    // ========== DTOs ==========

    public record RoutingRuleRequest(
        String ruleId,
        @NotBlank String name,
        List<String> sourceChannels,
        List<EventCategory> categories,
        Object priorityThreshold,
        List<String> conditions,
        @NotEmpty List<String> targetPipelines,
        Boolean enabled
    ) {
        RoutingRule toRule() {
            RoutingRule.Builder builder = RoutingRule.builder(name)
                .targetPipelines(targetPipelines.toArray(String[]::new));
            if (ruleId != null) {
                builder.ruleId(ruleId);
            }
            if (sourceChannels != null) {
                builder.sourceChannels(sourceChannels.toArray(String[]::new));
            }
            if (categories != null) {
                builder.categories(categories.toArray(EventCategory[]::new));
            }
            if (priorityThreshold != null) {
                EventPriority threshold = EventPriority.parse(priorityThreshold);
                if (threshold == null) {
                    throw new IllegalArgumentException("Unknown priority: " + priorityThreshold);
                }
                builder.priorityThreshold(threshold);
            }
            if (conditions != null) {
                builder.conditions(conditions.toArray(String[]::new));
            }
            if (enabled != null) {
                builder.enabled(enabled);
            }
            return builder.build();
        }
    }

    public record EventSchemaRequest(
        @NotBlank String channel,
        List<String> requiredFields,
        List<String> optionalFields,
        String defaultEventType,
        EventCategory defaultCategory,
        Object defaultPriority
    ) {
        EventSchema toSchema() {
            EventSchema.Builder builder = EventSchema.builder(channel);
            if (requiredFields != null) {
                builder.requiredFields(requiredFields.toArray(String[]::new));
            }
            if (optionalFields != null) {
                builder.optionalFields(optionalFields.toArray(String[]::new));
            }
            if (defaultEventType != null) {
                builder.defaultEventType(defaultEventType);
            }
            if (defaultCategory != null) {
                builder.defaultCategory(defaultCategory);
            }
            if (defaultPriority != null) {
                builder.defaultPriority(EventPriority.parse(defaultPriority));
            }
            return builder.build();
        }
    }
}
