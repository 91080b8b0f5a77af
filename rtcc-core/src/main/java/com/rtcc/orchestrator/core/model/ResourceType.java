package com.rtcc.orchestrator.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of physical or logical assets the resource manager tracks.
 */
public enum ResourceType {
    DRONE,
    ROBOT,
    DISPATCH_UNIT,
    OFFICER,
    VEHICLE,
    SENSOR,
    CAMERA,
    HELICOPTER,
    AI_COMPUTE,
    COMMUNICATION_CHANNEL;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ResourceType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Resource type cannot be empty");
        }
        return valueOf(code.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
