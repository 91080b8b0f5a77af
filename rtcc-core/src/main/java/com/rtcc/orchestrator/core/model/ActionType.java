package com.rtcc.orchestrator.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of action kinds a workflow step can emit.
 * The target subsystem, not the type, decides which handler runs the action.
 */
public enum ActionType {
    DRONE_DISPATCH,
    ROBOT_DISPATCH,
    OFFICER_ALERT,
    SUPERVISOR_ALERT,
    CAD_UPDATE,
    INVESTIGATION_CREATE,
    INVESTIGATION_UPDATE,
    THREAT_BROADCAST,
    BOLO_ISSUE,
    PATROL_REROUTE,
    LOCKDOWN_INITIATE,
    RESOURCE_ALLOCATE,
    SENSOR_ACTIVATE,
    DIGITAL_TWIN_UPDATE,
    PREDICTIVE_ALERT,
    HUMAN_STABILITY_ALERT,
    MORAL_COMPASS_CHECK,
    POLICY_VALIDATION,
    AUDIT_LOG,
    NOTIFICATION_SEND,
    FUSION_CLOUD_SYNC,
    EMERGENCY_BROADCAST,
    CO_RESPONDER_DISPATCH,
    CASE_GENERATION,
    EVIDENCE_COLLECTION,
    LPR_SWEEP,
    GRID_SEARCH;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse an action type code. Accepts "drone_dispatch", "drone-dispatch" or "DRONE_DISPATCH".
     */
    @JsonCreator
    public static ActionType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Action type cannot be empty");
        }
        return valueOf(code.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
