package com.rtcc.orchestrator.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Availability of a resource.
 * Only the resource manager moves a resource between these states.
 */
public enum ResourceStatus {
    AVAILABLE,
    ALLOCATED,
    IN_USE,
    MAINTENANCE,
    OFFLINE;

    /**
     * Check if the resource is held by an allocation.
     */
    public boolean isHeld() {
        return this == ALLOCATED || this == IN_USE;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ResourceStatus fromCode(String code) {
        return valueOf(code.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
