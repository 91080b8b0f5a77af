package com.rtcc.orchestrator.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Canonical category assigned to every normalized event.
 */
public enum EventCategory {
    INCIDENT,
    ALERT,
    TACTICAL,
    OFFICER,
    DRONE,
    ROBOT,
    INVESTIGATION,
    THREAT,
    EMERGENCY,
    COMPLIANCE,
    SYSTEM,
    SENSOR,
    CITY,
    HUMAN_STABILITY,
    PREDICTIVE,
    FUSION,
    CYBER,
    GOVERNANCE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EventCategory fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Event category cannot be empty");
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
