package com.rtcc.orchestrator.engine.resource;

import com.rtcc.orchestrator.core.exception.NotFoundException;
import com.rtcc.orchestrator.core.model.GeoLocation;
import com.rtcc.orchestrator.core.model.Resource;
import com.rtcc.orchestrator.core.model.ResourceAllocation;
import com.rtcc.orchestrator.core.model.ResourceRequirement;
import com.rtcc.orchestrator.core.model.ResourceStatus;
import com.rtcc.orchestrator.core.model.ResourceType;
import com.rtcc.orchestrator.engine.metrics.OrchestrationMetrics;
import com.rtcc.orchestrator.engine.persistence.BoundedHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Registry of typed, located resources with exclusive allocation.
 *
 * Every state change of a resource happens while holding that resource's own
 * monitor, so allocate/release on one resource never serialize callers working
 * on another. At most one active allocation exists per resource at any time.
 */
public class ResourceManager {

    private static final Logger log = LoggerFactory.getLogger(ResourceManager.class);

    private final Map<String, Slot> slots = new ConcurrentHashMap<>();
    private final Map<String, ResourceAllocation> activeAllocations = new ConcurrentHashMap<>();
    private final BoundedHistory<ResourceAllocation> allocationHistory;
    private final OrchestrationMetrics metrics;
    private final AtomicLong registrationOrder = new AtomicLong();

    private final AtomicLong totalAllocations = new AtomicLong();
    private final AtomicLong completedAllocations = new AtomicLong();
    private final AtomicLong failedAllocations = new AtomicLong();

    public ResourceManager(OrchestrationMetrics metrics, int historyLimit) {
        this.metrics = metrics;
        this.allocationHistory = new BoundedHistory<>(historyLimit);
    }

    /**
     * Per-resource state guarded by the slot's monitor.
     */
    private static final class Slot {
        private final long order;
        private Resource resource;
        private ResourceAllocation allocation;

        private Slot(long order, Resource resource) {
            this.order = order;
            this.resource = resource;
        }
    }

    // ========== Registry ==========

    /**
     * Add a resource. Registering an id that is already known leaves the existing entry untouched.
     *
     * @return the registered resource
     */
    public Resource registerResource(Resource resource) {
        Slot slot = slots.computeIfAbsent(resource.resourceId(), id -> {
            Resource initial = resource.status().isHeld()
                ? resource.withStatus(ResourceStatus.AVAILABLE, null)
                : resource;
            log.info("Registered {} resource {} ({})", initial.type().code(), initial.name(), initial.resourceId());
            return new Slot(registrationOrder.incrementAndGet(), initial);
        });
        synchronized (slot) {
            return slot.resource;
        }
    }

    /**
     * Remove a resource. Refused while the resource is allocated.
     */
    public boolean unregisterResource(String resourceId) {
        Slot slot = slots.get(resourceId);
        if (slot == null) {
            return false;
        }
        synchronized (slot) {
            if (slot.allocation != null) {
                log.warn("Refusing to unregister allocated resource {}", resourceId);
                return false;
            }
            slots.remove(resourceId);
        }
        log.info("Unregistered resource {}", resourceId);
        return true;
    }

    public Optional<Resource> getResource(String resourceId) {
        Slot slot = slots.get(resourceId);
        if (slot == null) {
            return Optional.empty();
        }
        synchronized (slot) {
            return Optional.of(slot.resource);
        }
    }

    /**
     * Resources in registration order.
     *
     * @param type Filter by type, or null for all
     * @param status Filter by status, or null for all
     */
    public List<Resource> listResources(ResourceType type, ResourceStatus status) {
        return snapshot(r -> (type == null || r.type() == type) && (status == null || r.status() == status));
    }

    /**
     * Set an operational status. Held statuses are only reached through allocation,
     * and an allocated resource keeps its status until released.
     *
     * @return false if the change was refused
     * @throws NotFoundException if the resource is unknown
     */
    public boolean updateStatus(String resourceId, ResourceStatus status) {
        Slot slot = requireSlot(resourceId);
        if (status.isHeld()) {
            return false;
        }
        synchronized (slot) {
            if (slot.allocation != null) {
                return false;
            }
            slot.resource = slot.resource.withStatus(status, null);
        }
        log.info("Resource {} is now {}", resourceId, status.code());
        return true;
    }

    public Resource updateLocation(String resourceId, GeoLocation location) {
        Slot slot = requireSlot(resourceId);
        synchronized (slot) {
            slot.resource = slot.resource.withLocation(location);
            return slot.resource;
        }
    }

    public Resource updateHealth(String resourceId, double healthScore) {
        Slot slot = requireSlot(resourceId);
        synchronized (slot) {
            slot.resource = slot.resource.withHealthScore(healthScore);
            return slot.resource;
        }
    }

    // ========== Allocation ==========

    /**
     * Atomically allocate a resource. Fails if the resource is unknown, not allocatable,
     * or already the subject of an active allocation.
     *
     * @return the allocation, or empty if the request cannot be satisfied now
     */
    public Optional<ResourceAllocation> allocate(
            String resourceId,
            String workflowId,
            String requester,
            int priority,
            String purpose,
            Duration duration) {
        Slot slot = slots.get(resourceId);
        if (slot == null) {
            failedAllocations.incrementAndGet();
            log.debug("Allocation of unknown resource {} refused", resourceId);
            return Optional.empty();
        }

        ResourceAllocation allocation;
        synchronized (slot) {
            if (slot.allocation != null || !slot.resource.isAllocatable() || !slots.containsKey(resourceId)) {
                failedAllocations.incrementAndGet();
                metrics.resourceAllocated(slot.resource.type().code(), false);
                return Optional.empty();
            }
            allocation = ResourceAllocation.create(slot.resource, workflowId, requester, priority, purpose, duration);
            slot.allocation = allocation;
            slot.resource = slot.resource.withStatus(ResourceStatus.ALLOCATED, allocation.allocationId());
            activeAllocations.put(allocation.allocationId(), allocation);
        }

        totalAllocations.incrementAndGet();
        metrics.resourceAllocated(allocation.resourceType().code(), true);
        log.info("Allocated resource {} to {} for {} (allocation {})",
            resourceId, requester, purpose, allocation.allocationId());
        return Optional.of(allocation);
    }

    /**
     * Satisfy a requirement: the named resource, or else the nearest allocatable
     * resource of the type to {@code near}, trying the next candidate if another caller wins the race.
     */
    public Optional<ResourceAllocation> allocateFor(
            ResourceRequirement requirement,
            GeoLocation near,
            String workflowId,
            String requester,
            int priority,
            String purpose) {
        if (requirement.isSpecific()) {
            return allocate(requirement.resourceId(), workflowId, requester, priority, purpose, requirement.duration());
        }
        List<Resource> candidates = rankByDistance(requirement.type(), requirement.capabilities(), near);
        for (Resource candidate : candidates) {
            Optional<ResourceAllocation> allocation = allocate(candidate.resourceId(), workflowId,
                requester, priority, purpose, requirement.duration());
            if (allocation.isPresent()) {
                return allocation;
            }
        }
        if (candidates.isEmpty()) {
            failedAllocations.incrementAndGet();
            metrics.resourceAllocated(requirement.type().code(), false);
        }
        return Optional.empty();
    }

    /**
     * Move an allocated resource to in-use.
     */
    public boolean markInUse(String resourceId) {
        Slot slot = slots.get(resourceId);
        if (slot == null) {
            return false;
        }
        synchronized (slot) {
            if (slot.allocation == null || slot.resource.status() != ResourceStatus.ALLOCATED) {
                return false;
            }
            slot.resource = slot.resource.withStatus(ResourceStatus.IN_USE, slot.allocation.allocationId());
            return true;
        }
    }

    /**
     * Release the active allocation on a resource and return it to available.
     *
     * @return false if there was no active allocation
     */
    public boolean release(String resourceId) {
        Slot slot = slots.get(resourceId);
        if (slot == null) {
            return false;
        }
        ResourceAllocation released;
        synchronized (slot) {
            if (slot.allocation == null) {
                return false;
            }
            released = slot.allocation.released();
            activeAllocations.remove(released.allocationId());
            slot.allocation = null;
            slot.resource = slot.resource.withStatus(ResourceStatus.AVAILABLE, null);
        }
        allocationHistory.append(released);
        completedAllocations.incrementAndGet();
        log.info("Released resource {} (allocation {})", resourceId, released.allocationId());
        return true;
    }

    // ========== Queries ==========

    /**
     * Allocatable resources of a type in registration order.
     *
     * @param capabilities Required capability tags, or null/empty for none
     */
    public List<Resource> getAvailableResources(ResourceType type, Set<String> capabilities) {
        return snapshot(r -> r.type() == type && r.isAllocatable() && r.hasCapabilities(capabilities));
    }

    public List<Resource> getAvailableResources(ResourceType type) {
        return getAvailableResources(type, Set.of());
    }

    /**
     * Nearest allocatable resource of a type by great-circle distance.
     * Ties go to the earlier registration; resources without a location rank last.
     */
    public Optional<Resource> getNearestResource(ResourceType type, double latitude, double longitude, Set<String> capabilities) {
        return rankByDistance(type, capabilities, new GeoLocation(latitude, longitude)).stream().findFirst();
    }

    public Optional<Resource> getNearestResource(ResourceType type, double latitude, double longitude) {
        return getNearestResource(type, latitude, longitude, Set.of());
    }

    private List<Resource> rankByDistance(ResourceType type, Set<String> capabilities, GeoLocation near) {
        List<Slot> candidates = slots.values().stream()
            .sorted(Comparator.comparingLong(s -> s.order))
            .collect(Collectors.toList());
        record Ranked(Resource resource, double distance, long order) {}
        return candidates.stream()
            .map(slot -> {
                synchronized (slot) {
                    Resource r = slot.resource;
                    double distance = near == null || r.location() == null
                        ? Double.POSITIVE_INFINITY
                        : near.distanceKm(r.location());
                    return new Ranked(r, distance, slot.order);
                }
            })
            .filter(ranked -> ranked.resource().type() == type
                && ranked.resource().isAllocatable()
                && ranked.resource().hasCapabilities(capabilities))
            .sorted(Comparator.comparingDouble(Ranked::distance).thenComparingLong(Ranked::order))
            .map(Ranked::resource)
            .collect(Collectors.toList());
    }

    public List<ResourceAllocation> getActiveAllocations() {
        return activeAllocations.values().stream()
            .sorted(Comparator.comparing(ResourceAllocation::startTime))
            .collect(Collectors.toList());
    }

    public Optional<ResourceAllocation> getActiveAllocation(String resourceId) {
        Slot slot = slots.get(resourceId);
        if (slot == null) {
            return Optional.empty();
        }
        synchronized (slot) {
            return Optional.ofNullable(slot.allocation);
        }
    }

    /**
     * Released allocations, newest first.
     */
    public List<ResourceAllocation> getAllocationHistory(int limit) {
        return allocationHistory.recent(a -> true, limit);
    }

    public Map<ResourceType, ResourceUtilization> getUtilization() {
        Map<ResourceType, int[]> counts = new EnumMap<>(ResourceType.class);
        for (Resource r : snapshot(r -> true)) {
            int[] c = counts.computeIfAbsent(r.type(), t -> new int[5]);
            c[0]++;
            switch (r.status()) {
                case AVAILABLE -> c[1]++;
                case ALLOCATED -> c[2]++;
                case IN_USE -> c[3]++;
                case MAINTENANCE, OFFLINE -> c[4]++;
            }
        }
        Map<ResourceType, ResourceUtilization> result = new EnumMap<>(ResourceType.class);
        counts.forEach((type, c) -> result.put(type, ResourceUtilization.of(c[0], c[1], c[2], c[3], c[4])));
        return result;
    }

    public ResourceStatistics getStatistics() {
        return new ResourceStatistics(
            slots.size(),
            totalAllocations.get(),
            activeAllocations.size(),
            completedAllocations.get(),
            failedAllocations.get()
        );
    }

    private List<Resource> snapshot(Predicate<Resource> filter) {
        return slots.values().stream()
            .sorted(Comparator.comparingLong(s -> s.order))
            .map(slot -> {
                synchronized (slot) {
                    return slot.resource;
                }
            })
            .filter(filter)
            .collect(Collectors.toList());
    }

    private Slot requireSlot(String resourceId) {
        Slot slot = slots.get(resourceId);
        if (slot == null) {
            throw new NotFoundException("Resource", resourceId);
        }
        return slot;
    }
}
