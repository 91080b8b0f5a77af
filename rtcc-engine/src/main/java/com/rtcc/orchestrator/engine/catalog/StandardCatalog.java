package com.rtcc.orchestrator.engine.catalog;

import com.rtcc.orchestrator.core.model.ActionType;
import com.rtcc.orchestrator.core.model.EventCategory;
import com.rtcc.orchestrator.core.model.EventPriority;
import com.rtcc.orchestrator.core.model.EventSchema;
import com.rtcc.orchestrator.core.model.GuardrailSeverity;
import com.rtcc.orchestrator.core.model.PolicyBinding;
import com.rtcc.orchestrator.core.model.PolicyType;
import com.rtcc.orchestrator.core.model.Resource;
import com.rtcc.orchestrator.core.model.ResourceType;
import com.rtcc.orchestrator.core.model.RoutingRule;
import com.rtcc.orchestrator.engine.policy.PolicyBindingEngine;
import com.rtcc.orchestrator.engine.resource.ResourceManager;
import com.rtcc.orchestrator.engine.routing.EventRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Default event schemas, routing rules, policy bindings and resources of a
 * real-time crime center deployment.
 *
 * Ids are fixed so loading the catalog twice replaces rather than duplicates.
 */
public final class StandardCatalog {

    private static final Logger log = LoggerFactory.getLogger(StandardCatalog.class);

    private StandardCatalog() {
    }

    /**
     * Register the whole catalog with the given components.
     */
    public static void loadInto(EventRouter router, PolicyBindingEngine policyEngine, ResourceManager resourceManager) {
        schemas().forEach(router::registerSchema);
        routingRules().forEach(router::addRule);
        policyBindings().forEach(policyEngine::registerBinding);
        resources().forEach(resourceManager::registerResource);
        log.info("Loaded standard catalog: {} schemas, {} routing rules, {} policy bindings, {} resources",
            schemas().size(), routingRules().size(), policyBindings().size(), resources().size());
    }

    // ========== Schemas ==========

    public static List<EventSchema> schemas() {
        return List.of(
            EventSchema.builder("gunshot_detection")
                .requiredFields("location", "timestamp", "confidence")
                .optionalFields("rounds", "caliber", "sensor_id", "address")
                .defaultEventType("gunshot_detected")
                .defaultCategory(EventCategory.ALERT)
                .defaultPriority(EventPriority.CRITICAL)
                .build(),
            EventSchema.builder("standard")
                .requiredFields("event_id", "timestamp", "source")
                .optionalFields("title", "summary", "details", "geolocation")
                .build(),
            EventSchema.builder("officer_safety")
                .requiredFields("officer_id", "timestamp")
                .optionalFields("location", "status", "details")
                .defaultEventType("officer_status")
                .defaultCategory(EventCategory.OFFICER)
                .defaultPriority(EventPriority.HIGH)
                .build()
        );
    }

    // ========== Routing ==========

    public static List<RoutingRule> routingRules() {
        return List.of(
            rule("critical-alerts", "Critical Alerts", EventPriority.CRITICAL,
                List.of(EventCategory.ALERT, EventCategory.EMERGENCY), "emergency_response", "command_center"),
            rule("officer-safety", "Officer Safety", EventPriority.HIGH,
                List.of(EventCategory.OFFICER), "officer_safety", "dispatch"),
            rule("tactical-events", "Tactical Events", EventPriority.MEDIUM,
                List.of(EventCategory.TACTICAL, EventCategory.INCIDENT), "tactical_analytics", "predictive_intel"),
            rule("drone-operations", "Drone Operations", EventPriority.LOW,
                List.of(EventCategory.DRONE), "drone_ops", "digital_twin"),
            rule("robot-operations", "Robot Operations", EventPriority.LOW,
                List.of(EventCategory.ROBOT), "robotics", "digital_twin"),
            rule("investigations", "Investigations", EventPriority.MEDIUM,
                List.of(EventCategory.INVESTIGATION), "investigations", "case_management"),
            rule("threat-intelligence", "Threat Intelligence", EventPriority.HIGH,
                List.of(EventCategory.THREAT, EventCategory.CYBER), "threat_intel", "fusion_cloud"),
            rule("human-stability", "Human Stability", EventPriority.MEDIUM,
                List.of(EventCategory.HUMAN_STABILITY), "human_stability", "crisis_response"),
            rule("compliance-events", "Compliance Events", EventPriority.LOW,
                List.of(EventCategory.COMPLIANCE, EventCategory.GOVERNANCE), "compliance", "audit"),
            rule("city-operations", "City Operations", EventPriority.MEDIUM,
                List.of(EventCategory.CITY), "city_brain", "city_autonomy")
        );
    }

    private static RoutingRule rule(String id, String name, EventPriority threshold,
                                    List<EventCategory> categories, String... pipelines) {
        return RoutingRule.builder(name)
            .ruleId(id)
            .categories(categories.toArray(new EventCategory[0]))
            .priorityThreshold(threshold)
            .targetPipelines(pipelines)
            .build();
    }

    // ========== Policy ==========

    public static List<PolicyBinding> policyBindings() {
        return List.of(
            PolicyBinding.builder("Constitutional Rights Protection", PolicyType.CONSTITUTIONAL)
                .bindingId("constitutional-rights")
                .description("Ensures all actions respect constitutional rights")
                .severity(GuardrailSeverity.BLOCKING)
                .requirements("fourth_amendment_compliance", "due_process")
                .build(),
            PolicyBinding.builder("Use of Force Policy", PolicyType.USE_OF_FORCE)
                .bindingId("use-of-force")
                .description("Governs use of force decisions")
                .severity(GuardrailSeverity.BLOCKING)
                .actions(ActionType.DRONE_DISPATCH, ActionType.ROBOT_DISPATCH, ActionType.LOCKDOWN_INITIATE)
                .requirements("proportionality", "necessity", "de_escalation_attempted")
                .build(),
            PolicyBinding.builder("Privacy Protection", PolicyType.PRIVACY)
                .bindingId("privacy-protection")
                .description("Protects citizen privacy")
                .severity(GuardrailSeverity.WARNING)
                .actions(ActionType.LPR_SWEEP, ActionType.SENSOR_ACTIVATE, ActionType.EVIDENCE_COLLECTION)
                .requirements("data_minimization", "purpose_limitation")
                .build(),
            PolicyBinding.builder("Civil Rights Compliance", PolicyType.CIVIL_RIGHTS)
                .bindingId("civil-rights")
                .description("Ensures civil rights are protected")
                .severity(GuardrailSeverity.BLOCKING)
                .requirements("non_discrimination", "equal_protection")
                .prohibitions("racial_profiling", "bias_based_targeting")
                .build(),
            PolicyBinding.builder("Moral Compass Alignment", PolicyType.MORAL_COMPASS)
                .bindingId("moral-compass")
                .description("Ensures actions align with ethical AI principles")
                .severity(GuardrailSeverity.WARNING)
                .requirements("ethical_alignment", "fairness", "transparency")
                .build(),
            PolicyBinding.builder("Public Safety Guardian Transparency", PolicyType.PUBLIC_SAFETY_GUARDIAN)
                .bindingId("public-transparency")
                .description("Ensures public transparency requirements")
                .severity(GuardrailSeverity.ADVISORY)
                .requirements("audit_trail", "public_accountability")
                .build(),
            PolicyBinding.builder("Emergency Protocol Compliance", PolicyType.EMERGENCY_PROTOCOL)
                .bindingId("emergency-protocol")
                .description("Governs emergency response actions")
                .severity(GuardrailSeverity.BLOCKING)
                .workflows("emergency_response", "crisis_response")
                .actions(ActionType.EMERGENCY_BROADCAST, ActionType.LOCKDOWN_INITIATE)
                .requirements("authorization_level", "notification_chain")
                .build(),
            PolicyBinding.builder("Data Governance Policy", PolicyType.DATA_GOVERNANCE)
                .bindingId("data-governance")
                .description("Governs data handling and retention")
                .severity(GuardrailSeverity.WARNING)
                .actions(ActionType.EVIDENCE_COLLECTION, ActionType.CASE_GENERATION, ActionType.AUDIT_LOG)
                .requirements("data_classification", "retention_policy", "access_control")
                .build(),
            PolicyBinding.builder("Drone Operations SOP", PolicyType.DEPARTMENT_SOP)
                .bindingId("sop-drone")
                .description("Standard operating procedure for drone deployment")
                .severity(GuardrailSeverity.BLOCKING)
                .actions(ActionType.DRONE_DISPATCH)
                .requirements("airspace_clearance", "operator_certification", "mission_logging")
                .build(),
            PolicyBinding.builder("Robot Operations SOP", PolicyType.DEPARTMENT_SOP)
                .bindingId("sop-robot")
                .description("Standard operating procedure for robot deployment")
                .severity(GuardrailSeverity.BLOCKING)
                .actions(ActionType.ROBOT_DISPATCH)
                .requirements("safety_perimeter", "operator_control", "mission_logging")
                .build(),
            PolicyBinding.builder("City Governance Resource Allocation", PolicyType.CITY_GOVERNANCE)
                .bindingId("city-resource-allocation")
                .description("Governs allocation of city resources")
                .severity(GuardrailSeverity.WARNING)
                .actions(ActionType.RESOURCE_ALLOCATE, ActionType.PATROL_REROUTE)
                .requirements("budget_compliance", "equity_consideration")
                .build(),
            PolicyBinding.builder("Legal Surveillance Guardrail", PolicyType.LEGAL_GUARDRAIL)
                .bindingId("legal-surveillance")
                .description("Legal limits on surveillance activities")
                .severity(GuardrailSeverity.BLOCKING)
                .actions(ActionType.SENSOR_ACTIVATE, ActionType.LPR_SWEEP, ActionType.GRID_SEARCH)
                .requirements("warrant_or_exception", "scope_limitation", "documentation")
                .build()
        );
    }

    // ========== Resources ==========

    public static List<Resource> resources() {
        return List.of(
            Resource.builder(ResourceType.DRONE, "Sentinel-1").resourceId("drone-sentinel-1")
                .capabilities("surveillance", "thermal", "spotlight", "speaker")
                .location(26.7753, -80.0589).build(),
            Resource.builder(ResourceType.DRONE, "Sentinel-2").resourceId("drone-sentinel-2")
                .capabilities("surveillance", "thermal", "spotlight")
                .location(26.7800, -80.0550).build(),
            Resource.builder(ResourceType.DRONE, "Sentinel-3").resourceId("drone-sentinel-3")
                .capabilities("surveillance", "zoom", "night_vision")
                .location(26.7700, -80.0620).build(),
            Resource.builder(ResourceType.ROBOT, "Guardian-1").resourceId("robot-guardian-1")
                .capabilities("patrol", "communication", "sensor_array")
                .location(26.7753, -80.0589).build(),
            Resource.builder(ResourceType.ROBOT, "Guardian-2").resourceId("robot-guardian-2")
                .capabilities("patrol", "communication", "hazmat_detection")
                .location(26.7780, -80.0560).build(),
            Resource.builder(ResourceType.DISPATCH_UNIT, "Unit-101").resourceId("unit-101")
                .capabilities("patrol", "response", "traffic")
                .location(26.7760, -80.0580).build(),
            Resource.builder(ResourceType.DISPATCH_UNIT, "Unit-102").resourceId("unit-102")
                .capabilities("patrol", "response", "k9")
                .location(26.7740, -80.0600).build(),
            Resource.builder(ResourceType.DISPATCH_UNIT, "Unit-103").resourceId("unit-103")
                .capabilities("patrol", "response", "tactical")
                .location(26.7720, -80.0570).build(),
            Resource.builder(ResourceType.AI_COMPUTE, "AI-Cluster-Primary").resourceId("ai-cluster-primary")
                .capabilities("inference", "training", "analytics").build(),
            Resource.builder(ResourceType.AI_COMPUTE, "AI-Cluster-Secondary").resourceId("ai-cluster-secondary")
                .capabilities("inference", "analytics").build(),
            Resource.builder(ResourceType.SENSOR, "Gunshot-Detector-Grid").resourceId("sensor-gunshot-grid")
                .capabilities("gunshot_detection", "triangulation")
                .location(26.7753, -80.0589).build(),
            Resource.builder(ResourceType.SENSOR, "LPR-Network").resourceId("sensor-lpr-network")
                .capabilities("plate_recognition", "hot_list_alert").build(),
            Resource.builder(ResourceType.CAMERA, "CCTV-Network").resourceId("camera-cctv-network")
                .capabilities("video_surveillance", "analytics").build()
        );
    }
}
