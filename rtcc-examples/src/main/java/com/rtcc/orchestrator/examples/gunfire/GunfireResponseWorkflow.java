package com.rtcc.orchestrator.examples.gunfire;

import com.rtcc.orchestrator.core.model.ActionType;
import com.rtcc.orchestrator.core.model.FailureStrategy;
import com.rtcc.orchestrator.core.model.ResourceRequirement;
import com.rtcc.orchestrator.core.model.ResourceType;
import com.rtcc.orchestrator.core.model.Workflow;
import com.rtcc.orchestrator.core.model.WorkflowStep;
import com.rtcc.orchestrator.core.model.WorkflowTrigger;
import com.rtcc.orchestrator.engine.policy.StandardPolicyChecker;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gunfire Response Workflow Example.
 *
 * Triggered by a gunshot detection with confidence of at least 0.8.
 *
 * Workflow Steps:
 * 1. alert-officers - Alert patrol officers near the detection (parallel)
 * 2. dispatch-drone - Launch the nearest thermal-capable drone (parallel)
 * 3. dispatch-unit - Send the nearest patrol unit through CAD (parallel)
 * 4. log-incident - Record the incident for audit
 *
 * Compensation:
 * - If any required step fails or is vetoed, recall-units stands down the responders
 */
public final class GunfireResponseWorkflow {

    public static final String WORKFLOW_NAME = "Gunfire Response";
    public static final String WORKFLOW_ID = Workflow.slugOf(WORKFLOW_NAME);
    public static final String CATEGORY = "emergency";

    public static final String CHANNEL = "gunshot_detection";
    public static final String EVENT_TYPE = "gunshot_detected";

    // Step names
    public static final String STEP_ALERT_OFFICERS = "alert-officers";
    public static final String STEP_DISPATCH_DRONE = "dispatch-drone";
    public static final String STEP_DISPATCH_UNIT = "dispatch-unit";
    public static final String STEP_LOG_INCIDENT = "log-incident";
    public static final String STEP_RECALL_UNITS = "recall-units";

    // Subsystems
    public static final String COMMUNICATIONS = "communications";
    public static final String DRONE_OPS = "drone_ops";
    public static final String CAD = "cad";

    // Attestations
    public static final List<String> RIGHTS = List.of(
        "fourth_amendment_compliance", "due_process", "non_discrimination", "equal_protection");
    public static final List<String> USE_OF_FORCE = List.of(
        "proportionality", "necessity", "de_escalation_attempted");
    public static final List<String> DRONE_SOP = List.of(
        "airspace_clearance", "operator_certification", "mission_logging");
    public static final List<String> DATA_GOVERNANCE = List.of(
        "data_classification", "retention_policy", "access_control");

    private GunfireResponseWorkflow() {
    }

    /**
     * Creates the workflow definition.
     *
     * @param airspaceCleared Whether the drone step attests airspace clearance
     */
    public static Workflow createDefinition(boolean airspaceCleared) {
        List<String> droneAttestations = new ArrayList<>(RIGHTS);
        droneAttestations.addAll(USE_OF_FORCE);
        DRONE_SOP.stream()
            .filter(requirement -> airspaceCleared || !requirement.equals("airspace_clearance"))
            .forEach(droneAttestations::add);

        List<String> logAttestations = new ArrayList<>(RIGHTS);
        logAttestations.addAll(DATA_GOVERNANCE);

        return Workflow.builder()
            .name(WORKFLOW_NAME)
            .category(CATEGORY)
            .description("Coordinated officer, drone and patrol response to a detected gunshot")
            .priority(1)
            .timeout(Duration.ofMinutes(10))
            .failureStrategy(FailureStrategy.COMPENSATE)
            .trigger(WorkflowTrigger.onEvent(List.of(EVENT_TYPE), List.of(CHANNEL), "confidence >= 0.8"))
            .step(WorkflowStep.builder(STEP_ALERT_OFFICERS, ActionType.OFFICER_ALERT, COMMUNICATIONS)
                .parallel()
                .parameters(attested(RIGHTS, Map.of("radius_m", 800)))
                .timeout(Duration.ofSeconds(15))
                .build())
            .step(WorkflowStep.builder(STEP_DISPATCH_DRONE, ActionType.DRONE_DISPATCH, DRONE_OPS)
                .parallel()
                .resource(ResourceRequirement.ofType(ResourceType.DRONE, "thermal"))
                .parameters(attested(droneAttestations, Map.of("mission", "overwatch")))
                .timeout(Duration.ofSeconds(30))
                .build())
            .step(WorkflowStep.builder(STEP_DISPATCH_UNIT, ActionType.CAD_UPDATE, CAD)
                .parallel()
                .resource(ResourceRequirement.ofType(ResourceType.DISPATCH_UNIT, "response"))
                .parameters(attested(RIGHTS, Map.of("call_type", "shots_fired")))
                .build())
            .step(WorkflowStep.builder(STEP_LOG_INCIDENT, ActionType.AUDIT_LOG, COMMUNICATIONS)
                .parameters(attested(logAttestations, Map.of()))
                .required(false)
                .build())
            .compensationStep(WorkflowStep.builder(STEP_RECALL_UNITS, ActionType.NOTIFICATION_SEND, COMMUNICATIONS)
                .parameters(attested(RIGHTS, Map.of("message", "Stand down: gunfire response cancelled")))
                .build())
            .build();
    }

    private static Map<String, Object> attested(List<String> requirements, Map<String, Object> parameters) {
        Map<String, Object> merged = new LinkedHashMap<>(parameters);
        merged.put(StandardPolicyChecker.SATISFIED_REQUIREMENTS, List.copyOf(requirements));
        return merged;
    }

    /**
     * Creates a raw acoustic sensor report as it arrives on the detection channel.
     */
    public static Map<String, Object> createDetection(String sensorEventId, double confidence, int rounds) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("event_id", sensorEventId);
        raw.put("location", Map.of("latitude", 26.7751, "longitude", -80.0592));
        raw.put("timestamp", Instant.now().toString());
        raw.put("confidence", confidence);
        raw.put("rounds", rounds);
        raw.put("sensor_id", "sensor-gunshot-grid");
        raw.put("address", "500 Clematis St");
        return raw;
    }
}
