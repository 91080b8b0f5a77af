package com.rtcc.orchestrator.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Execution mode of a workflow step.
 * Consecutive PARALLEL steps form one group that is dispatched together
 * and joined before the execution advances.
 */
public enum StepExecutionMode {
    SEQUENTIAL,
    PARALLEL;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StepExecutionMode fromCode(String code) {
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
