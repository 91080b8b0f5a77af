package com.rtcc.orchestrator.examples.gunfire;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rtcc.orchestrator.core.model.GuardrailCheck;
import com.rtcc.orchestrator.core.model.NormalizedEvent;
import com.rtcc.orchestrator.core.model.OrchestrationResult;
import com.rtcc.orchestrator.core.model.StepResult;
import com.rtcc.orchestrator.core.model.WorkflowExecution;
import com.rtcc.orchestrator.engine.catalog.StandardCatalog;
import com.rtcc.orchestrator.engine.condition.ConditionEvaluator;
import com.rtcc.orchestrator.engine.history.ExecutionHistoryService;
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
import com.rtcc.orchestrator.engine.resource.ResourceManager;
import com.rtcc.orchestrator.engine.routing.EventRouter;
import com.rtcc.orchestrator.engine.workflow.WorkflowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Demonstration runner for the Gunfire Response Workflow.
 *
 * Wires every component in-process, without Spring, and shows:
 * 1. A fully attested response that completes
 * 2. A drone dispatch vetoed by the drone SOP, followed by compensation
 * 3. A drone that fails pre-flight, followed by compensation
 * 4. A low-confidence detection that starts nothing
 */
public class GunfireResponseDemo implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GunfireResponseDemo.class);
    private static final Duration RESPONSE_TIMEOUT = Duration.ofSeconds(15);

    private final ResourceManager resourceManager;
    private final PolicyBindingEngine policyEngine;
    private final OrchestrationKernel kernel;
    private final WorkflowEngine workflowEngine;
    private final ExecutionHistoryService historyService;
    private final ResponseSubsystemHandlers handlers = new ResponseSubsystemHandlers();

    public GunfireResponseDemo() {
        ObjectMapper objectMapper = new ObjectMapper();
        ConditionEvaluator conditions = new ConditionEvaluator();
        OrchestrationMetrics metrics = OrchestrationMetrics.standalone();

        EventRouter router = new EventRouter(conditions, metrics, 1_000);
        policyEngine = new PolicyBindingEngine(new InMemoryGuardrailCheckRepository(1_000), conditions,
            new LoggingReviewChannel(), metrics);
        resourceManager = new ResourceManager(metrics, 1_000);
        StandardCatalog.loadInto(router, policyEngine, resourceManager);

        kernel = new OrchestrationKernel(router, policyEngine, resourceManager,
            new InMemoryAuditTrailRepository(1_000), metrics, objectMapper,
            KernelSettings.builder().handlerThreads(4).shutdownTimeout(Duration.ofSeconds(5)).build());

        InMemoryExecutionEventRepository events = new InMemoryExecutionEventRepository();
        InMemoryWorkflowExecutionRepository executions = InMemoryWorkflowExecutionRepository.withEventLog(1_000, events);
        workflowEngine = new WorkflowEngine(new InMemoryWorkflowRepository(), executions, events,
            conditions, kernel, metrics, objectMapper);
        historyService = new ExecutionHistoryService(executions, events);

        kernel.bindWorkflowEngine(workflowEngine);
        handlers.registerWith(kernel);
        kernel.start();
    }

    public static void main(String[] args) {
        try (GunfireResponseDemo demo = new GunfireResponseDemo()) {
            log.info("==================================================================");
            log.info("  RTCC ORCHESTRATOR - GUNFIRE RESPONSE DEMONSTRATION");
            log.info("==================================================================");

            demo.runScenario1_AttestedResponse();
            demo.runScenario2_AirspaceNotCleared();
            demo.runScenario3_DronePreflightFailure();
            demo.runScenario4_LowConfidence();

            log.info("==================================================================");
            log.info("  ALL DEMONSTRATIONS COMPLETE: {}", demo.workflowEngine.getStatistics());
            log.info("==================================================================");
        }
    }

    /**
     * SCENARIO 1: every requirement attested, all responders dispatched.
     */
    public WorkflowExecution runScenario1_AttestedResponse() {
        banner("SCENARIO 1: Fully Attested Response");
        workflowEngine.registerWorkflow(GunfireResponseWorkflow.createDefinition(true));

        WorkflowExecution execution = respond(0.95).orElseThrow();
        report(execution);
        log.info("Drones launched: {}, units dispatched: {}",
            handlers.getLaunchedDrones(), handlers.getDispatchedUnits());
        return execution;
    }

    /**
     * SCENARIO 2: the drone step lacks airspace clearance and the drone SOP vetoes it.
     */
    public WorkflowExecution runScenario2_AirspaceNotCleared() {
        banner("SCENARIO 2: Drone Dispatch Vetoed by Policy");
        workflowEngine.registerWorkflow(GunfireResponseWorkflow.createDefinition(false));

        WorkflowExecution execution = respond(0.91).orElseThrow();
        report(execution);
        vetoes(execution).forEach(check ->
            log.info("Vetoed by {}: {}", check.bindingName(), check.violations()));

        ExecutionHistoryService.ExecutionHistory history = historyService.getHistory(execution.executionId());
        history.timeline().forEach(entry ->
            log.info("  #{} {} {}", entry.sequenceNumber(), entry.eventType(), entry.summary()));
        return execution;
    }

    /**
     * SCENARIO 3: policy allows the launch but the drone fails its pre-flight checks.
     */
    public WorkflowExecution runScenario3_DronePreflightFailure() {
        banner("SCENARIO 3: Drone Pre-flight Failure");
        workflowEngine.registerWorkflow(GunfireResponseWorkflow.createDefinition(true));
        handlers.failNextDroneLaunches(1);

        WorkflowExecution execution = respond(0.88).orElseThrow();
        report(execution);
        return execution;
    }

    /**
     * SCENARIO 4: the detection is below the trigger's confidence threshold.
     */
    public Optional<WorkflowExecution> runScenario4_LowConfidence() {
        banner("SCENARIO 4: Low-Confidence Detection");
        workflowEngine.registerWorkflow(GunfireResponseWorkflow.createDefinition(true));
        Optional<WorkflowExecution> execution = respond(0.42);
        log.info("Response started: {}", execution.isPresent());
        return execution;
    }

    /**
     * Ingest a detection and wait for the response it triggered, if any, to finish.
     */
    public Optional<WorkflowExecution> respond(double confidence) {
        Set<String> known = workflowEngine.getExecutionHistory(null, Integer.MAX_VALUE).stream()
            .map(WorkflowExecution::executionId)
            .collect(Collectors.toSet());

        String sensorEventId = "SST-" + UUID.randomUUID().toString().substring(0, 8);
        NormalizedEvent event = kernel.ingest(GunfireResponseWorkflow.CHANNEL,
            GunfireResponseWorkflow.createDetection(sensorEventId, confidence, 3));
        log.info("Detection {} routed to {}", event.eventId(), event.routedTo());

        Optional<WorkflowExecution> started = workflowEngine.getExecutionHistory(null, Integer.MAX_VALUE).stream()
            .filter(e -> !known.contains(e.executionId()))
            .findFirst();
        return started.map(e -> awaitTerminal(e.executionId()));
    }

    private WorkflowExecution awaitTerminal(String executionId) {
        Instant deadline = Instant.now().plus(RESPONSE_TIMEOUT);
        WorkflowExecution execution = workflowEngine.getExecution(executionId);
        while (!execution.isTerminal() && Instant.now().isBefore(deadline)) {
            try {
                Thread.sleep(25);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            execution = workflowEngine.getExecution(executionId);
        }
        return execution;
    }

    public List<GuardrailCheck> vetoes(WorkflowExecution execution) {
        return kernel.getAuditTrail(execution.executionId(), null, 100).stream()
            .map(OrchestrationResult::guardrailChecks)
            .flatMap(List::stream)
            .filter(GuardrailCheck::isBlockingFailure)
            .collect(Collectors.toList());
    }

    public ResponseSubsystemHandlers getHandlers() {
        return handlers;
    }

    public ResourceManager getResourceManager() {
        return resourceManager;
    }

    public WorkflowEngine getWorkflowEngine() {
        return workflowEngine;
    }

    private void report(WorkflowExecution execution) {
        log.info("Execution {} ended {}{}", execution.executionId(), execution.status(),
            execution.error() != null ? " (" + execution.error() + ")" : "");
        for (StepResult step : execution.stepResults()) {
            log.info("  {}{} -> {}", step.compensation() ? "[compensation] " : "", step.stepName(), step.status());
        }
        log.info("Policy checks so far: {} ({} blocked)",
            policyEngine.getStatistics().totalChecks(), policyEngine.getStatistics().blocksIssued());
    }

    private static void banner(String title) {
        log.info("");
        log.info("------------------------------------------------------------------");
        log.info(title);
        log.info("------------------------------------------------------------------");
    }

    @Override
    public void close() {
        kernel.stop();
        workflowEngine.shutdown();
    }
}
