package com.rtcc.orchestrator.engine.routing;

import com.rtcc.orchestrator.core.exception.NotFoundException;
import com.rtcc.orchestrator.core.exception.SchemaValidationException;
import com.rtcc.orchestrator.core.model.EventCategory;
import com.rtcc.orchestrator.core.model.EventPriority;
import com.rtcc.orchestrator.core.model.EventSchema;
import com.rtcc.orchestrator.core.model.NormalizedEvent;
import com.rtcc.orchestrator.core.model.RoutingRule;
import com.rtcc.orchestrator.engine.condition.ConditionEvaluator;
import com.rtcc.orchestrator.engine.metrics.OrchestrationMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventRouterTest {

    private EventRouter router;
    private final List<String> deliveries = new ArrayList<>();

    @BeforeEach
    void setUp() {
        router = new EventRouter(new ConditionEvaluator(), OrchestrationMetrics.standalone(), 100);
        router.registerSchema(EventSchema.builder("gunshot_detection")
            .requiredFields("location", "timestamp", "confidence")
            .defaultEventType("gunshot_detected")
            .defaultCategory(EventCategory.ALERT)
            .defaultPriority(EventPriority.CRITICAL)
            .build());
    }

    private static Map<String, Object> gunshot(double confidence) {
        Map<String, Object> raw = new HashMap<>();
        raw.put("event_id", "sst-1001");
        raw.put("location", Map.of("latitude", 26.7753, "longitude", -80.0589));
        raw.put("timestamp", "2026-03-01T02:15:00Z");
        raw.put("confidence", confidence);
        return raw;
    }

    private void recordingPipeline(String name) {
        router.registerPipeline(name, event -> deliveries.add(name + ":" + event.eventType()));
    }

    // ========== Normalization ==========

    @Nested
    class Normalization {

        @Test
        @DisplayName("Schema defaults fill type, category and priority")
        void schemaDefaults() {
            NormalizedEvent event = router.normalize("gunshot_detection", gunshot(0.9));

            assertThat(event.eventType()).isEqualTo("gunshot_detected");
            assertThat(event.category()).isEqualTo(EventCategory.ALERT);
            assertThat(event.priority()).isEqualTo(EventPriority.CRITICAL);
            assertThat(event.sourceEventId()).isEqualTo("sst-1001");
            assertThat(event.eventId()).startsWith("evt-").isNotEqualTo("sst-1001");
            assertThat(event.location()).isNotNull();
            assertThat(event.location().latitude()).isEqualTo(26.7753);
            assertThat(event.timestamp()).hasToString("2026-03-01T02:15:00Z");
            assertThat(event.metadata()).containsKey("received_at");
        }

        @Test
        @DisplayName("Explicit fields override schema defaults")
        void explicitFieldsWin() {
            Map<String, Object> raw = gunshot(0.9);
            raw.put("type", "shots_fired_unverified");
            raw.put("priority", "high");
            raw.put("category", "tactical");

            NormalizedEvent event = router.normalize("gunshot_detection", raw);

            assertThat(event.eventType()).isEqualTo("shots_fired_unverified");
            assertThat(event.priority()).isEqualTo(EventPriority.HIGH);
            assertThat(event.category()).isEqualTo(EventCategory.TACTICAL);
        }

        @Test
        @DisplayName("Channels without a schema accept any payload and infer their category")
        void schemalessChannel() {
            NormalizedEvent event = router.normalize("officer_safety", Map.of("officer_id", "B-12"));

            assertThat(event.category()).isEqualTo(EventCategory.OFFICER);
            assertThat(event.priority()).isEqualTo(EventPriority.MEDIUM);
            assertThat(event.eventType()).isEqualTo("officer_safety");
            assertThat(event.timestamp()).isNotNull();
        }

        @Test
        @DisplayName("Nested details are flattened into data without overwriting top-level fields")
        void detailsFlattened() {
            Map<String, Object> raw = gunshot(0.9);
            raw.put("details", Map.of("rounds", 3, "confidence", 0.1));

            NormalizedEvent event = router.normalize("gunshot_detection", raw);

            assertThat(event.data()).containsEntry("rounds", 3).containsEntry("confidence", 0.9);
        }

        @Test
        @DisplayName("Missing required fields raise a schema error naming them")
        void missingRequiredFields() {
            assertThatThrownBy(() -> router.normalize("gunshot_detection", Map.of("timestamp", "now")))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageContaining("confidence")
                .hasMessageContaining("location");
        }
    }

    // ========== Routing ==========

    @Nested
    class Routing {

        @Test
        @DisplayName("Every matching rule's pipelines receive the event exactly once")
        void fanOutWithoutDuplicates() {
            recordingPipeline("emergency_response");
            recordingPipeline("command_center");
            router.addRule(RoutingRule.builder("Critical Alerts")
                .categories(EventCategory.ALERT)
                .priorityThreshold(EventPriority.CRITICAL)
                .targetPipelines("emergency_response", "command_center")
                .build());
            router.addRule(RoutingRule.builder("Everything")
                .targetPipelines("command_center")
                .build());

            NormalizedEvent routed = router.route("gunshot_detection", gunshot(0.9));

            assertThat(routed.routedTo()).containsExactly("emergency_response", "command_center");
            assertThat(deliveries).containsExactly(
                "emergency_response:gunshot_detected", "command_center:gunshot_detected");
            assertThat(router.getStatistics().matchesByRule())
                .containsEntry("Critical Alerts", 1L)
                .containsEntry("Everything", 1L);
        }

        @Test
        @DisplayName("Priority threshold is a ceiling on urgency")
        void priorityThreshold() {
            recordingPipeline("tactical_analytics");
            router.addRule(RoutingRule.builder("High Only")
                .priorityThreshold(EventPriority.HIGH)
                .targetPipelines("tactical_analytics")
                .build());

            NormalizedEvent low = router.route("incidents", Map.of("priority", 4));
            NormalizedEvent critical = router.route("incidents", Map.of("priority", 1));

            assertThat(low.routedTo()).isEmpty();
            assertThat(critical.routedTo()).containsExactly("tactical_analytics");
            assertThat(router.getStatistics().eventsDropped()).isEqualTo(1);
            assertThat(router.getStatistics().eventsRouted()).isEqualTo(1);
        }

        @Test
        @DisplayName("Rule conditions are evaluated against event data")
        void conditions() {
            recordingPipeline("emergency_response");
            router.addRule(RoutingRule.builder("Confident Gunfire")
                .sourceChannels("gunshot_detection")
                .conditions("confidence >= 0.8")
                .targetPipelines("emergency_response")
                .build());

            assertThat(router.route("gunshot_detection", gunshot(0.5)).routedTo()).isEmpty();
            assertThat(router.route("gunshot_detection", gunshot(0.85)).routedTo()).containsExactly("emergency_response");
        }

        @Test
        @DisplayName("A failing pipeline does not prevent delivery to the others")
        void pipelineIsolation() {
            router.registerPipeline("broken", event -> {
                throw new IllegalStateException("downstream unavailable");
            });
            recordingPipeline("healthy");
            router.addRule(RoutingRule.builder("Both").targetPipelines("broken", "healthy").build());

            NormalizedEvent routed = router.route("alerts", Map.of("type", "panic_button"));

            assertThat(routed.routedTo()).containsExactly("healthy");
            assertThat(deliveries).containsExactly("healthy:panic_button");
            assertThat(router.getStatistics().pipelineFailures()).isEqualTo(1);
        }

        @Test
        @DisplayName("Schema errors are counted and the event is not forwarded")
        void schemaErrorDropsEvent() {
            recordingPipeline("emergency_response");
            router.addRule(RoutingRule.builder("All").targetPipelines("emergency_response").build());

            assertThatThrownBy(() -> router.route("gunshot_detection", Map.of("confidence", 0.9)))
                .isInstanceOf(SchemaValidationException.class);

            RouterStatistics stats = router.getStatistics();
            assertThat(stats.schemaErrors()).isEqualTo(1);
            assertThat(stats.eventsDropped()).isEqualTo(1);
            assertThat(deliveries).isEmpty();
            assertThat(router.getEventHistory(null, 10)).isEmpty();
        }

        @Test
        @DisplayName("Disabled rules are skipped; unknown rule ids are reported")
        void disableRule() {
            recordingPipeline("dispatch");
            RoutingRule rule = router.addRule(RoutingRule.builder("Officer").ruleId("officer")
                .targetPipelines("dispatch").build());

            router.setRuleEnabled(rule.ruleId(), false);

            assertThat(router.route("officer_safety", Map.of()).routedTo()).isEmpty();
            assertThatThrownBy(() -> router.setRuleEnabled("missing", true)).isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("Adding a rule with an existing id replaces it in place")
        void replaceRule() {
            router.addRule(RoutingRule.builder("First").ruleId("r1").targetPipelines("a").build());
            router.addRule(RoutingRule.builder("Second").ruleId("r2").targetPipelines("b").build());
            router.addRule(RoutingRule.builder("First v2").ruleId("r1").targetPipelines("c").build());

            assertThat(router.listRules()).extracting(RoutingRule::name).containsExactly("First v2", "Second");
        }

        @Test
        @DisplayName("History is newest first and filterable by category")
        void history() {
            router.route("officer_safety", Map.of("n", 1));
            router.route("gunshot_detection", gunshot(0.9));

            assertThat(router.getEventHistory(null, 10)).extracting(NormalizedEvent::sourceChannel)
                .containsExactly("gunshot_detection", "officer_safety");
            assertThat(router.getEventHistory(EventCategory.OFFICER, 10)).hasSize(1);
        }
    }
}
