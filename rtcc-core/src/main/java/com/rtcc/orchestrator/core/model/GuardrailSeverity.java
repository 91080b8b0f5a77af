package com.rtcc.orchestrator.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a failed guardrail check is enforced.
 */
public enum GuardrailSeverity {
    /**
     * Failure vetoes the action. It must not be dispatched.
     */
    BLOCKING,

    /**
     * Failure is recorded and flagged for human review. Dispatch proceeds.
     */
    WARNING,

    /**
     * Failure is recorded. Dispatch proceeds.
     */
    ADVISORY,

    /**
     * Failure is recorded. Dispatch proceeds.
     */
    INFORMATIONAL;

    public boolean isBlocking() {
        return this == BLOCKING;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static GuardrailSeverity fromCode(String code) {
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
