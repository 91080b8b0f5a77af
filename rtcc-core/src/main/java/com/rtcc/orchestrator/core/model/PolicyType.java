package com.rtcc.orchestrator.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Family a policy binding belongs to.
 */
public enum PolicyType {
    CONSTITUTIONAL,
    LEGAL_GUARDRAIL,
    ETHICAL_GUARDRAIL,
    DEPARTMENT_SOP,
    USE_OF_FORCE,
    PRIVACY,
    CITY_GOVERNANCE,
    MORAL_COMPASS,
    CIVIL_RIGHTS,
    DATA_GOVERNANCE,
    EMERGENCY_PROTOCOL,
    PUBLIC_SAFETY_GUARDIAN;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PolicyType fromCode(String code) {
        return valueOf(code.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
