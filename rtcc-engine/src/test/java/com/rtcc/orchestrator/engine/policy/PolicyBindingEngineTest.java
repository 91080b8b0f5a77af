package com.rtcc.orchestrator.engine.policy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.rtcc.orchestrator.core.exception.NotFoundException;
import com.rtcc.orchestrator.core.model.ActionType;
import com.rtcc.orchestrator.core.model.GuardrailCheck;
import com.rtcc.orchestrator.core.model.GuardrailSeverity;
import com.rtcc.orchestrator.core.model.OrchestrationAction;
import com.rtcc.orchestrator.core.model.PolicyBinding;
import com.rtcc.orchestrator.core.model.PolicyType;
import com.rtcc.orchestrator.engine.condition.ConditionEvaluator;
import com.rtcc.orchestrator.engine.metrics.OrchestrationMetrics;
import com.rtcc.orchestrator.engine.persistence.InMemoryGuardrailCheckRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PolicyBindingEngineTest {

    private PolicyBindingEngine engine;
    private LoggingReviewChannel reviewChannel;

    private static final Map<String, Object> ATTESTED = Map.of(
        StandardPolicyChecker.SATISFIED_REQUIREMENTS, List.of("proportionality", "necessity"));

    @BeforeEach
    void setUp() {
        reviewChannel = new LoggingReviewChannel();
        engine = new PolicyBindingEngine(new InMemoryGuardrailCheckRepository(100), new ConditionEvaluator(),
            reviewChannel, OrchestrationMetrics.standalone());
    }

    private PolicyBinding useOfForce() {
        return engine.registerBinding(PolicyBinding.builder("Use of Force Policy", PolicyType.USE_OF_FORCE)
            .bindingId("use-of-force")
            .severity(GuardrailSeverity.BLOCKING)
            .actions(ActionType.DRONE_DISPATCH, ActionType.ROBOT_DISPATCH)
            .requirements("proportionality", "necessity")
            .build());
    }

    private PolicyBinding privacy() {
        return engine.registerBinding(PolicyBinding.builder("Privacy Protection", PolicyType.PRIVACY)
            .bindingId("privacy")
            .severity(GuardrailSeverity.WARNING)
            .requirements("data_minimization")
            .prohibitions("bulk_retention")
            .build());
    }

    // ========== Applicability ==========

    @Nested
    class Applicability {

        @Test
        @DisplayName("Action filters select bindings by action type")
        void actionFilter() {
            useOfForce();
            privacy();

            assertThat(engine.getApplicableBindings("gunfire-response", ActionType.DRONE_DISPATCH, Map.of()))
                .extracting(PolicyBinding::name).containsExactly("Use of Force Policy", "Privacy Protection");
            assertThat(engine.getApplicableBindings("gunfire-response", ActionType.AUDIT_LOG, Map.of()))
                .extracting(PolicyBinding::name).containsExactly("Privacy Protection");
        }

        @Test
        @DisplayName("Workflow filters match by slug or prefix")
        void workflowFilter() {
            engine.registerBinding(PolicyBinding.builder("Emergency Protocol", PolicyType.EMERGENCY_PROTOCOL)
                .workflows("Gunfire Response", "crisis-*")
                .build());

            assertThat(engine.getApplicableBindings("gunfire-response", ActionType.AUDIT_LOG, Map.of())).hasSize(1);
            assertThat(engine.getApplicableBindings("crisis-negotiation", ActionType.AUDIT_LOG, Map.of())).hasSize(1);
            assertThat(engine.getApplicableBindings("traffic-stop", ActionType.AUDIT_LOG, Map.of())).isEmpty();
            assertThat(engine.getApplicableBindings(null, ActionType.AUDIT_LOG, Map.of())).isEmpty();
        }

        @Test
        @DisplayName("Conditions are evaluated against action parameters")
        void conditions() {
            engine.registerBinding(PolicyBinding.builder("Night Operations", PolicyType.DEPARTMENT_SOP)
                .conditions("altitude_ft > 400")
                .build());

            assertThat(engine.getApplicableBindings("wf", ActionType.DRONE_DISPATCH, Map.of("altitude_ft", 500))).hasSize(1);
            assertThat(engine.getApplicableBindings("wf", ActionType.DRONE_DISPATCH, Map.of("altitude_ft", 200))).isEmpty();
        }

        @Test
        @DisplayName("Guardrails named on an action apply regardless of filters")
        void explicitGuardrails() {
            useOfForce();
            OrchestrationAction action = OrchestrationAction.builder(ActionType.AUDIT_LOG, "communications")
                .guardrails(List.of("use of force policy"))
                .build();

            PolicyVerdict verdict = engine.checkAction(action);

            assertThat(verdict.checks()).extracting(GuardrailCheck::bindingName).containsExactly("Use of Force Policy");
            assertThat(verdict.allowed()).isFalse();
        }

        @Test
        @DisplayName("Disabled bindings never apply, even when named")
        void disabledBindings() {
            useOfForce();
            engine.disableBinding("use-of-force");
            OrchestrationAction action = OrchestrationAction.builder(ActionType.DRONE_DISPATCH, "drone_ops")
                .guardrails(List.of("Use of Force Policy"))
                .build();

            assertThat(engine.checkAction(action).checks()).isEmpty();
            assertThat(engine.enableBinding("use-of-force").enabled()).isTrue();
            assertThatThrownBy(() -> engine.disableBinding("nope")).isInstanceOf(NotFoundException.class);
        }
    }

    // ========== Evaluation ==========

    @Nested
    class Evaluation {

        @Test
        @DisplayName("Every applicable binding is checked even after a blocking failure")
        void noShortCircuit() {
            useOfForce();
            privacy();
            engine.registerBinding(PolicyBinding.builder("Drone SOP", PolicyType.DEPARTMENT_SOP)
                .severity(GuardrailSeverity.BLOCKING)
                .actions(ActionType.DRONE_DISPATCH)
                .requirements("airspace_clearance")
                .build());

            List<GuardrailCheck> checks = engine.checkPolicy("wf", ActionType.DRONE_DISPATCH, Map.of());

            assertThat(checks).hasSize(3);
            PolicyVerdict verdict = new PolicyVerdict(checks);
            assertThat(verdict.vetoedBy()).containsExactly("Use of Force Policy", "Drone SOP");
        }

        @Test
        @DisplayName("Attested requirements let a blocking binding pass")
        void attestedAllowed() {
            useOfForce();

            PolicyVerdict verdict = engine.evaluate(PolicyContext.of("wf", ActionType.DRONE_DISPATCH, ATTESTED));

            assertThat(verdict.allowed()).isTrue();
            assertThat(verdict.checks()).singleElement().satisfies(c -> assertThat(c.score()).isEqualTo(100.0));
        }

        @Test
        @DisplayName("Failed warnings are flagged for review but do not veto")
        void warningsFlagged() {
            privacy();

            PolicyVerdict verdict = engine.evaluate(PolicyContext.of("wf", ActionType.LPR_SWEEP,
                Map.of(StandardPolicyChecker.DETECTED_VIOLATIONS, "bulk_retention")));

            assertThat(verdict.allowed()).isTrue();
            assertThat(verdict.warnings()).hasSize(1);
            assertThat(reviewChannel.flaggedCount()).isEqualTo(1);
            assertThat(engine.getStatistics().warningsIssued()).isEqualTo(1);
        }

        @Test
        @DisplayName("Custom checkers resolve by binding name before policy type")
        void checkerResolution() {
            useOfForce();
            privacy();
            engine.registerChecker(PolicyType.USE_OF_FORCE, (binding, ctx) ->
                GuardrailCheck.of(binding, ctx.workflowId(), ctx.actionId(), ctx.actionType(),
                    true, "type checker", List.of(), List.of(), 90));
            engine.registerChecker("Use of Force Policy", (binding, ctx) ->
                GuardrailCheck.of(binding, ctx.workflowId(), ctx.actionId(), ctx.actionType(),
                    true, "named checker", List.of(), List.of(), 95));

            List<GuardrailCheck> checks = engine.checkPolicy("wf", ActionType.DRONE_DISPATCH, Map.of());

            assertThat(checks).extracting(GuardrailCheck::message)
                .containsExactly("named checker", "Policy check passed");
        }

        @Test
        @DisplayName("A throwing checker fails closed")
        void checkerErrorFailsClosed() {
            useOfForce();
            engine.registerChecker(PolicyType.USE_OF_FORCE, (binding, ctx) -> {
                throw new IllegalStateException("rules service down");
            });

            PolicyVerdict verdict = engine.evaluate(PolicyContext.of("wf", ActionType.DRONE_DISPATCH, ATTESTED));

            assertThat(verdict.allowed()).isFalse();
            assertThat(verdict.blockingFailures()).singleElement()
                .satisfies(c -> assertThat(c.message()).contains("rules service down"));
            assertThat(engine.getStatistics().checkerErrors()).isEqualTo(1);
            assertThat(engine.getStatistics().blocksIssued()).isEqualTo(1);
        }

        @Test
        @DisplayName("Veto log lines name the action id before its type")
        void vetoLogLine() {
            useOfForce();
            Logger logger = (Logger) LoggerFactory.getLogger(PolicyBindingEngine.class);
            ListAppender<ILoggingEvent> appender = new ListAppender<>();
            appender.start();
            logger.addAppender(appender);
            try {
                engine.evaluate(new PolicyContext("gunfire-response", "act-7", ActionType.DRONE_DISPATCH,
                    Map.of(), List.of()));
            } finally {
                logger.detachAppender(appender);
            }

            assertThat(appender.list)
                .filteredOn(e -> e.getLevel() == Level.WARN)
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly("Action act-7 (DRONE_DISPATCH) in workflow gunfire-response blocked by [Use of Force Policy]");
        }
    }

    // ========== Reporting ==========

    @Nested
    class Reporting {

        @Test
        @DisplayName("Statistics and compliance summarize recorded checks")
        void statisticsAndCompliance() {
            useOfForce();
            privacy();
            engine.checkPolicy("wf", ActionType.DRONE_DISPATCH, ATTESTED);
            engine.checkPolicy("wf", ActionType.DRONE_DISPATCH, Map.of());

            PolicyStatistics stats = engine.getStatistics();
            assertThat(stats.totalChecks()).isEqualTo(4);
            assertThat(stats.passedChecks()).isEqualTo(3);
            assertThat(stats.failedChecks()).isEqualTo(1);
            assertThat(stats.totalBindings()).isEqualTo(2);
            assertThat(stats.bindingsByType()).containsEntry(PolicyType.PRIVACY, 1L);

            ComplianceSummary summary = engine.getComplianceSummary();
            assertThat(summary.window()).isEqualTo(4);
            ComplianceSummary.Compliance force = summary.byType().get(PolicyType.USE_OF_FORCE);
            assertThat(force.total()).isEqualTo(2);
            assertThat(force.complianceRate()).isEqualTo(50.0);
            assertThat(force.averageScore()).isCloseTo(75.0, within(0.001));

            assertThat(engine.getCheckHistory(PolicyType.PRIVACY, 10)).hasSize(2);
        }

        @Test
        @DisplayName("Bindings are looked up by id or case-insensitive name, and replaced by id")
        void lookupAndReplace() {
            useOfForce();
            engine.registerBinding(PolicyBinding.builder("Use of Force Policy v2", PolicyType.USE_OF_FORCE)
                .bindingId("use-of-force").build());

            assertThat(engine.listBindings(null)).hasSize(1);
            assertThat(engine.getBinding("use of force policy v2")).isPresent();
            assertThat(engine.getBinding("use-of-force")).get()
                .extracting(PolicyBinding::name).isEqualTo("Use of Force Policy v2");
            assertThat(engine.removeBinding("use-of-force")).isTrue();
            assertThat(engine.getBinding("use-of-force")).isEmpty();
        }
    }
}
