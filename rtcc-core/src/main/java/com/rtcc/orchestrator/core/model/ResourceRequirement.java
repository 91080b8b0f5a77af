package com.rtcc.orchestrator.core.model;

import java.time.Duration;
import java.util.Set;

/**
 * Physical resource a workflow step needs before its handler may run.
 * Either names a specific resource or asks for the nearest allocatable one of a type.
 */
public record ResourceRequirement(
    ResourceType type,
    String resourceId,
    Set<String> capabilities,
    Duration duration
) {
    public ResourceRequirement {
        if (type == null && (resourceId == null || resourceId.isBlank())) {
            throw new IllegalArgumentException("Resource requirement needs a type or a resource id");
        }
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }

    public static ResourceRequirement ofType(ResourceType type, String... capabilities) {
        return new ResourceRequirement(type, null, Set.of(capabilities), null);
    }

    public static ResourceRequirement specific(String resourceId) {
        return new ResourceRequirement(null, resourceId, Set.of(), null);
    }

    public boolean isSpecific() {
        return resourceId != null && !resourceId.isBlank();
    }
}
