package com.rtcc.orchestrator.api.rest;

import com.rtcc.orchestrator.core.exception.NotFoundException;
import com.rtcc.orchestrator.core.exception.OrchestratorException;
import com.rtcc.orchestrator.core.model.GeoLocation;
import com.rtcc.orchestrator.core.model.Resource;
import com.rtcc.orchestrator.core.model.ResourceAllocation;
import com.rtcc.orchestrator.core.model.ResourceRequirement;
import com.rtcc.orchestrator.core.model.ResourceStatus;
import com.rtcc.orchestrator.core.model.ResourceType;
import com.rtcc.orchestrator.engine.resource.ResourceManager;
import com.rtcc.orchestrator.engine.resource.ResourceStatistics;
import com.rtcc.orchestrator.engine.resource.ResourceUtilization;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST API for the resource registry and allocations.
 */
@RestController
@RequestMapping("/api/v1/resources")
public class ResourceController {

    static final String RESOURCE_CONFLICT = "RESOURCE_CONFLICT";

    private final ResourceManager resourceManager;

    public ResourceController(ResourceManager resourceManager) {
        this.resourceManager = resourceManager;
    }

    // ========== Registry ==========

    @PostMapping
    public ResponseEntity<Resource> register(@Valid @RequestBody ResourceRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(resourceManager.registerResource(request.toResource()));
    }

    @GetMapping
    public List<Resource> list(
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String status) {
        return resourceManager.listResources(
            type == null ? null : ResourceType.fromCode(type),
            status == null ? null : ResourceStatus.fromCode(status));
    }

    @GetMapping("/{resourceId}")
    public Resource get(@PathVariable String resourceId) {
        return resourceManager.getResource(resourceId)
            .orElseThrow(() -> new NotFoundException("Resource", resourceId));
    }

    @DeleteMapping("/{resourceId}")
    public ResponseEntity<Void> unregister(@PathVariable String resourceId) {
        get(resourceId);
        if (!resourceManager.unregisterResource(resourceId)) {
            throw new OrchestratorException(RESOURCE_CONFLICT, "Resource " + resourceId + " is allocated");
        }
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{resourceId}/status")
    public Resource updateStatus(@PathVariable String resourceId, @Valid @RequestBody StatusUpdate update) {
        if (!resourceManager.updateStatus(resourceId, update.status())) {
            throw new OrchestratorException(RESOURCE_CONFLICT,
                "Resource " + resourceId + " cannot be set to " + update.status().code());
        }
        return get(resourceId);
    }

    @PutMapping("/{resourceId}/location")
    public Resource updateLocation(@PathVariable String resourceId, @RequestBody LocationUpdate update) {
        return resourceManager.updateLocation(resourceId, new GeoLocation(update.latitude(), update.longitude()));
    }

    @PutMapping("/{resourceId}/health")
    public Resource updateHealth(@PathVariable String resourceId, @RequestBody HealthUpdate update) {
        return resourceManager.updateHealth(resourceId, update.healthScore());
    }

    // ========== Allocation ==========

    /**
     * Allocate a named resource, or the nearest allocatable one of a type.
     */
    @PostMapping("/allocate")
    public ResponseEntity<ResourceAllocation> allocate(@Valid @RequestBody AllocationRequest request) {
        ResourceRequirement requirement = new ResourceRequirement(request.type(), request.resourceId(),
            request.capabilities(), request.durationSeconds() == null ? null : Duration.ofSeconds(request.durationSeconds()));
        GeoLocation near = request.latitude() != null && request.longitude() != null
            ? new GeoLocation(request.latitude(), request.longitude())
            : null;
        ResourceAllocation allocation = resourceManager.allocateFor(requirement, near, request.workflowId(),
                request.requester(), request.priority() == null ? 5 : request.priority(), request.purpose())
            .orElseThrow(() -> new OrchestratorException(RESOURCE_CONFLICT, "No resource available for request"));
        return ResponseEntity.status(HttpStatus.CREATED).body(allocation);
    }

    @PostMapping("/{resourceId}/release")
    public Map<String, Object> release(@PathVariable String resourceId) {
        get(resourceId);
        if (!resourceManager.release(resourceId)) {
            throw new OrchestratorException(RESOURCE_CONFLICT, "Resource " + resourceId + " is not allocated");
        }
        return Map.of("resourceId", resourceId, "released", true);
    }

    @GetMapping("/allocations")
    public List<ResourceAllocation> activeAllocations() {
        return resourceManager.getActiveAllocations();
    }

    @GetMapping("/allocations/history")
    public List<ResourceAllocation> allocationHistory(@RequestParam(defaultValue = "100") int limit) {
        return resourceManager.getAllocationHistory(limit);
    }

    // ========== Queries ==========

    @GetMapping("/available")
    public List<Resource> available(
            @RequestParam String type,
            @RequestParam(required = false) Set<String> capabilities) {
        return resourceManager.getAvailableResources(ResourceType.fromCode(type), capabilities);
    }

    @GetMapping("/nearest")
    public Resource nearest(
            @RequestParam String type,
            @RequestParam double latitude,
            @RequestParam double longitude,
            @RequestParam(required = false) Set<String> capabilities) {
        return resourceManager.getNearestResource(ResourceType.fromCode(type), latitude, longitude, capabilities)
            .orElseThrow(() -> new NotFoundException("Available " + type, latitude + "," + longitude));
    }

    @GetMapping("/utilization")
    public Map<ResourceType, ResourceUtilization> utilization() {
        return resourceManager.getUtilization();
    }

    @GetMapping("/statistics")
    public ResourceStatistics statistics() {
        return resourceManager.getStatistics();
    }

    // ========== DTOs ==========

    public record ResourceRequest(
        String resourceId,
        @NotNull ResourceType type,
        @NotBlank String name,
        ResourceStatus status,
        Double latitude,
        Double longitude,
        List<String> capabilities,
        Double healthScore,
        Map<String, Object> metadata
    ) {
        Resource toResource() {
            Resource.Builder builder = Resource.builder(type, name);
            if (resourceId != null) {
                builder.resourceId(resourceId);
            }
            if (status != null) {
                builder.status(status);
            }
            if (latitude != null && longitude != null) {
                builder.location(latitude, longitude);
            }
            if (capabilities != null) {
                builder.capabilities(capabilities.toArray(String[]::new));
            }
            if (healthScore != null) {
                builder.healthScore(healthScore);
            }
            if (metadata != null) {
                builder.metadata(metadata);
            }
            return builder.build();
        }
    }

    public record AllocationRequest(
        String resourceId,
        ResourceType type,
        Set<String> capabilities,
        Double latitude,
        Double longitude,
        String workflowId,
        @NotBlank String requester,
        Integer priority,
        String purpose,
        Long durationSeconds
    ) {}

    public record StatusUpdate(@NotNull ResourceStatus status) {}

    public record LocationUpdate(double latitude, double longitude) {}

    public record HealthUpdate(double healthScore) {}
}
