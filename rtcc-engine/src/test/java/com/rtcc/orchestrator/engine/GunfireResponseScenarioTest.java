package com.rtcc.orchestrator.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rtcc.orchestrator.core.model.ActionType;
import com.rtcc.orchestrator.core.model.ExecutionStatus;
import com.rtcc.orchestrator.core.model.GuardrailCheck;
import com.rtcc.orchestrator.core.model.NormalizedEvent;
import com.rtcc.orchestrator.core.model.OrchestrationResult;
import com.rtcc.orchestrator.core.model.ResourceRequirement;
import com.rtcc.orchestrator.core.model.ResourceStatus;
import com.rtcc.orchestrator.core.model.ResourceType;
import com.rtcc.orchestrator.core.model.StepResult;
import com.rtcc.orchestrator.core.model.StepStatus;
import com.rtcc.orchestrator.core.model.Workflow;
import com.rtcc.orchestrator.core.model.WorkflowExecution;
import com.rtcc.orchestrator.core.model.WorkflowStep;
import com.rtcc.orchestrator.core.model.WorkflowTrigger;
import com.rtcc.orchestrator.engine.catalog.StandardCatalog;
import com.rtcc.orchestrator.engine.condition.ConditionEvaluator;
import com.rtcc.orchestrator.engine.kernel.KernelSettings;
import com.rtcc.orchestrator.engine.kernel.OrchestrationKernel;
import com.rtcc.orchestrator.engine.metrics.OrchestrationMetrics;
import com.rtcc.orchestrator.engine.persistence.InMemoryAuditTrailRepository;
import com.rtcc.orchestrator.engine.persistence.InMemoryExecutionEventRepository;
import com.rtcc.orchestrator.engine.persistence.InMemoryGuardrailCheckRepository;
import com.rtcc.orchestrator.engine.persistence.InMemoryWorkflowExecutionRepository;
import com.rtcc.orchestrator.engine.persistence.InMemoryWorkflowRepository;
import com.rtcc.orchestrator.engine.policy.LoggingReviewChannel;
import com.rtcc.orchestrator.engine.policy.PolicyBindingEngine;
import com.rtcc.orchestrator.engine.policy.StandardPolicyChecker;
import com.rtcc.orchestrator.engine.resource.ResourceManager;
import com.rtcc.orchestrator.engine.routing.EventRouter;
import com.rtcc.orchestrator.engine.workflow.WorkflowEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Gunshot detection through routing, workflow triggering, policy checks and
 * subsystem dispatch, with every component wired as in a deployment.
 */
class GunfireResponseScenarioTest {

    private static final List<String> RIGHTS = List.of(
        "fourth_amendment_compliance", "due_process", "non_discrimination", "equal_protection");
    private static final List<String> FORCE = List.of("proportionality", "necessity", "de_escalation_attempted");
    private static final List<String> DRONE_SOP = List.of("airspace_clearance", "operator_certification", "mission_logging");

    private final ConditionEvaluator conditions = new ConditionEvaluator();
    private final OrchestrationMetrics metrics = OrchestrationMetrics.standalone();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final EventRouter router = new EventRouter(conditions, metrics, 100);
    private final PolicyBindingEngine policyEngine = new PolicyBindingEngine(
        new InMemoryGuardrailCheckRepository(100), conditions, new LoggingReviewChannel(), metrics);
    private final ResourceManager resourceManager = new ResourceManager(metrics, 100);
    private final List<String> droneDispatches = new CopyOnWriteArrayList<>();
    private final List<OrchestrationResult> results = new CopyOnWriteArrayList<>();

    private OrchestrationKernel kernel;
    private WorkflowEngine workflowEngine;

    @BeforeEach
    void setUp() {
        StandardCatalog.loadInto(router, policyEngine, resourceManager);
        kernel = new OrchestrationKernel(router, policyEngine, resourceManager,
            new InMemoryAuditTrailRepository(100), metrics, objectMapper,
            KernelSettings.builder().handlerThreads(2).shutdownTimeout(Duration.ofSeconds(2)).build());
        workflowEngine = new WorkflowEngine(new InMemoryWorkflowRepository(), new InMemoryWorkflowExecutionRepository(),
            new InMemoryExecutionEventRepository(), conditions, kernel, metrics, objectMapper);
        kernel.bindWorkflowEngine(workflowEngine);
        kernel.addResultListener(results::add);

        kernel.registerSubsystem("communications", ctx -> ctx.newOutput().put("delivered", true));
        kernel.registerSubsystem("drone_ops", ctx -> {
            String droneId = ctx.getResource().orElseThrow().resourceId();
            droneDispatches.add(droneId);
            return ctx.newOutput().put("drone", droneId).put("eta_seconds", 90);
        });
        kernel.start();
    }

    @AfterEach
    void tearDown() {
        kernel.stop();
        workflowEngine.shutdown();
    }

    private static List<String> attest(List<String> first, List<String> second) {
        List<String> all = new ArrayList<>(RIGHTS);
        all.addAll(first);
        all.addAll(second);
        return all;
    }

    private void registerGunfireResponse(List<String> droneAttestations) {
        workflowEngine.registerWorkflow(Workflow.builder()
            .name("Gunfire Response")
            .category("emergency")
            .priority(1)
            .trigger(WorkflowTrigger.onEvent(List.of("gunshot_detected"), List.of("gunshot_detection"),
                "confidence >= 0.8"))
            .step(WorkflowStep.builder("alert-officers", ActionType.NOTIFICATION_SEND, "communications")
                .parallel()
                .parameters(Map.of(StandardPolicyChecker.SATISFIED_REQUIREMENTS, RIGHTS))
                .build())
            .step(WorkflowStep.builder("dispatch-drone", ActionType.DRONE_DISPATCH, "drone_ops")
                .parallel()
                .resource(ResourceRequirement.ofType(ResourceType.DRONE))
                .parameters(Map.of(StandardPolicyChecker.SATISFIED_REQUIREMENTS, droneAttestations))
                .build())
            .step(WorkflowStep.builder("log-incident", ActionType.AUDIT_LOG, "communications")
                .parameters(Map.of(StandardPolicyChecker.SATISFIED_REQUIREMENTS, RIGHTS))
                .build())
            .build());
    }

    private WorkflowExecution ingestGunshot() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("event_id", "sst-2041");
        raw.put("location", Map.of("latitude", 26.7753, "longitude", -80.0589));
        raw.put("timestamp", "2026-03-01T02:15:00Z");
        raw.put("confidence", 0.95);
        raw.put("rounds", 4);

        NormalizedEvent routed = kernel.ingest("gunshot_detection", raw);
        assertThat(routed.routedTo()).contains(OrchestrationKernel.WORKFLOW_TRIGGERS_PIPELINE);

        List<WorkflowExecution> started = workflowEngine.getExecutionHistory(null, 10);
        assertThat(started).hasSize(1);
        String executionId = started.get(0).executionId();
        await().atMost(Duration.ofSeconds(10))
            .until(() -> workflowEngine.getExecution(executionId).isTerminal());
        return workflowEngine.getExecution(executionId);
    }

    @Test
    @DisplayName("With every requirement attested the response completes and the drone is returned")
    void completesWhenAttested() {
        registerGunfireResponse(attest(FORCE, DRONE_SOP));

        WorkflowExecution execution = ingestGunshot();

        assertThat(execution.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(execution.stepResults()).extracting(StepResult::status).containsOnly(StepStatus.COMPLETED);
        assertThat(droneDispatches).hasSize(1).allMatch(id -> id.startsWith("drone-sentinel-"));
        assertThat(resourceManager.getResource(droneDispatches.get(0)).orElseThrow().status())
            .isEqualTo(ResourceStatus.AVAILABLE);

        OrchestrationResult drone = results.stream()
            .filter(r -> r.actionType() == ActionType.DRONE_DISPATCH)
            .findFirst().orElseThrow();
        assertThat(drone.success()).isTrue();
        assertThat(drone.guardrailChecks()).allMatch(GuardrailCheck::passed);
        assertThat(drone.guardrailChecks()).extracting(GuardrailCheck::bindingId)
            .contains("constitutional-rights", "civil-rights", "use-of-force", "sop-drone");
    }

    @Test
    @DisplayName("A missing drone procedure vetoes the dispatch and fails the response")
    void vetoedDroneFailsExecution() {
        registerGunfireResponse(attest(FORCE, List.of("operator_certification", "mission_logging")));

        WorkflowExecution execution = ingestGunshot();

        assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(execution.error()).startsWith("Step 'dispatch-drone' blocked by policy");
        assertThat(droneDispatches).isEmpty();
        assertThat(execution.stepResults()).extracting(StepResult::stepName).doesNotContain("log-incident");
        assertThat(resourceManager.getAvailableResources(ResourceType.DRONE)).hasSize(3);

        GuardrailCheck veto = results.stream()
            .filter(r -> r.actionType() == ActionType.DRONE_DISPATCH)
            .flatMap(r -> r.guardrailChecks().stream())
            .filter(GuardrailCheck::isBlockingFailure)
            .findFirst().orElseThrow();
        assertThat(veto.bindingId()).isEqualTo("sop-drone");
        assertThat(veto.violations()).containsExactly("Missing requirement: airspace_clearance");
    }

    @Test
    @DisplayName("Low-confidence detections start no response")
    void lowConfidenceIgnored() {
        registerGunfireResponse(attest(FORCE, DRONE_SOP));

        kernel.ingest("gunshot_detection", Map.of(
            "location", Map.of("latitude", 26.7753, "longitude", -80.0589),
            "timestamp", "2026-03-01T02:15:00Z",
            "confidence", 0.4));

        assertThat(workflowEngine.getExecutionHistory(null, 10)).isEmpty();
    }
}
