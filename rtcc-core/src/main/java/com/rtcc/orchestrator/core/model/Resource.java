package com.rtcc.orchestrator.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * A finite, typed, locatable asset.
 *
 * Invariants:
 * - healthScore in [0, 100]
 * - currentAllocationId is non-null exactly when status is held
 */
public record Resource(
    String resourceId,
    ResourceType type,
    String name,
    ResourceStatus status,
    GeoLocation location,
    Set<String> capabilities,
    double healthScore,
    String currentAllocationId,
    Map<String, Object> metadata,
    Instant registeredAt,
    Instant lastUpdated
) {
    /**
     * Minimum health score for a resource to be handed out.
     */
    public static final double MIN_ALLOCATABLE_HEALTH = 50.0;

    public Resource {
        if (type == null) {
            throw new IllegalArgumentException("Resource type is required");
        }
        if (resourceId == null || resourceId.isBlank()) {
            resourceId = UUID.randomUUID().toString();
        }
        if (status == null) {
            status = ResourceStatus.AVAILABLE;
        }
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        healthScore = Math.min(Math.max(healthScore, 0.0), 100.0);
        if (registeredAt == null) {
            registeredAt = Instant.now();
        }
        if (lastUpdated == null) {
            lastUpdated = registeredAt;
        }
    }

    /**
     * Check if the resource can be allocated right now.
     */
    public boolean isAllocatable() {
        return status == ResourceStatus.AVAILABLE && healthScore > MIN_ALLOCATABLE_HEALTH;
    }

    public boolean hasCapabilities(Set<String> required) {
        return required == null || capabilities.containsAll(required);
    }

    public Resource withStatus(ResourceStatus newStatus, String allocationId) {
        return new Resource(resourceId, type, name, newStatus, location, capabilities,
            healthScore, allocationId, metadata, registeredAt, Instant.now());
    }

    public Resource withLocation(GeoLocation newLocation) {
        return new Resource(resourceId, type, name, status, newLocation, capabilities,
            healthScore, currentAllocationId, metadata, registeredAt, Instant.now());
    }

    public Resource withHealthScore(double newHealthScore) {
        return new Resource(resourceId, type, name, status, location, capabilities,
            newHealthScore, currentAllocationId, metadata, registeredAt, Instant.now());
    }

    public static Builder builder(ResourceType type, String name) {
        return new Builder(type, name);
    }

    public static class Builder {
        private String resourceId;
        private final ResourceType type;
        private final String name;
        private ResourceStatus status = ResourceStatus.AVAILABLE;
        private GeoLocation location;
        private Set<String> capabilities = Set.of();
        private double healthScore = 100.0;
        private Map<String, Object> metadata = Map.of();

        private Builder(ResourceType type, String name) {
            this.type = type;
            this.name = name;
        }

        public Builder resourceId(String resourceId) {
            this.resourceId = resourceId;
            return this;
        }

        public Builder status(ResourceStatus status) {
            this.status = status;
            return this;
        }

        public Builder location(double latitude, double longitude) {
            this.location = new GeoLocation(latitude, longitude);
            return this;
        }

        public Builder location(GeoLocation location) {
            this.location = location;
            return this;
        }

        public Builder capabilities(String... capabilities) {
            this.capabilities = Set.of(capabilities);
            return this;
        }

        public Builder healthScore(double healthScore) {
            this.healthScore = healthScore;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Resource build() {
            return new Resource(resourceId, type, name, status, location, capabilities,
                healthScore, null, metadata, null, null);
        }
    }
}
