package com.rtcc.orchestrator.engine.resource;

import com.rtcc.orchestrator.core.exception.NotFoundException;
import com.rtcc.orchestrator.core.model.GeoLocation;
import com.rtcc.orchestrator.core.model.Resource;
import com.rtcc.orchestrator.core.model.ResourceAllocation;
import com.rtcc.orchestrator.core.model.ResourceRequirement;
import com.rtcc.orchestrator.core.model.ResourceStatus;
import com.rtcc.orchestrator.core.model.ResourceType;
import com.rtcc.orchestrator.engine.metrics.OrchestrationMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourceManagerTest {

    private ResourceManager manager;

    @BeforeEach
    void setUp() {
        manager = new ResourceManager(OrchestrationMetrics.standalone(), 100);
        manager.registerResource(Resource.builder(ResourceType.DRONE, "Sentinel-1").resourceId("drone-1")
            .capabilities("surveillance", "thermal").location(26.7753, -80.0589).build());
        manager.registerResource(Resource.builder(ResourceType.DRONE, "Sentinel-2").resourceId("drone-2")
            .capabilities("surveillance").location(26.7800, -80.0550).build());
        manager.registerResource(Resource.builder(ResourceType.DISPATCH_UNIT, "Unit-101").resourceId("unit-101")
            .location(26.7760, -80.0580).build());
    }

    private Optional<ResourceAllocation> allocate(String resourceId) {
        return manager.allocate(resourceId, "gunfire-response", "test", 1, "respond", Duration.ofMinutes(5));
    }

    // ========== Registry ==========

    @Nested
    class Registry {

        @Test
        @DisplayName("Re-registering a known id keeps the existing entry")
        void duplicateRegistration() {
            Resource again = manager.registerResource(Resource.builder(ResourceType.DRONE, "Imposter")
                .resourceId("drone-1").build());

            assertThat(again.name()).isEqualTo("Sentinel-1");
            assertThat(manager.listResources(ResourceType.DRONE, null)).hasSize(2);
        }

        @Test
        @DisplayName("Resources registered as held start available")
        void heldStatusNormalized() {
            Resource registered = manager.registerResource(Resource.builder(ResourceType.ROBOT, "Guardian-1")
                .resourceId("robot-1").status(ResourceStatus.IN_USE).build());

            assertThat(registered.status()).isEqualTo(ResourceStatus.AVAILABLE);
        }

        @Test
        @DisplayName("Held statuses cannot be set directly and allocated resources keep theirs")
        void statusUpdates() {
            assertThat(manager.updateStatus("drone-1", ResourceStatus.ALLOCATED)).isFalse();
            assertThat(manager.updateStatus("drone-1", ResourceStatus.MAINTENANCE)).isTrue();
            assertThat(manager.getResource("drone-1")).get()
                .extracting(Resource::status).isEqualTo(ResourceStatus.MAINTENANCE);

            allocate("drone-2");
            assertThat(manager.updateStatus("drone-2", ResourceStatus.OFFLINE)).isFalse();
            assertThatThrownBy(() -> manager.updateStatus("ghost", ResourceStatus.OFFLINE))
                .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("Allocated resources cannot be unregistered")
        void unregisterRefusedWhileAllocated() {
            allocate("unit-101");

            assertThat(manager.unregisterResource("unit-101")).isFalse();
            manager.release("unit-101");
            assertThat(manager.unregisterResource("unit-101")).isTrue();
            assertThat(manager.getResource("unit-101")).isEmpty();
        }
    }

    // ========== Allocation ==========

    @Nested
    class Allocation {

        @Test
        @DisplayName("Allocate, mark in use and release walk the resource through its states")
        void lifecycle() {
            ResourceAllocation allocation = allocate("drone-1").orElseThrow();

            assertThat(manager.getResource("drone-1").orElseThrow().status()).isEqualTo(ResourceStatus.ALLOCATED);
            assertThat(manager.getResource("drone-1").orElseThrow().currentAllocationId())
                .isEqualTo(allocation.allocationId());
            assertThat(manager.markInUse("drone-1")).isTrue();
            assertThat(manager.getResource("drone-1").orElseThrow().status()).isEqualTo(ResourceStatus.IN_USE);

            assertThat(manager.release("drone-1")).isTrue();
            assertThat(manager.release("drone-1")).isFalse();
            assertThat(manager.getResource("drone-1").orElseThrow().status()).isEqualTo(ResourceStatus.AVAILABLE);
            assertThat(manager.getAllocationHistory(10)).singleElement()
                .satisfies(a -> assertThat(a.isActive()).isFalse());
        }

        @Test
        @DisplayName("A held resource cannot be allocated twice")
        void noDoubleAllocation() {
            assertThat(allocate("drone-1")).isPresent();
            assertThat(allocate("drone-1")).isEmpty();
            assertThat(allocate("unknown")).isEmpty();
            assertThat(manager.getStatistics().failedAllocations()).isEqualTo(2);
        }

        @Test
        @DisplayName("Resources below the health floor are not allocatable")
        void unhealthyResource() {
            manager.updateHealth("drone-1", 20.0);

            assertThat(allocate("drone-1")).isEmpty();
            assertThat(manager.getAvailableResources(ResourceType.DRONE))
                .extracting(Resource::resourceId).containsExactly("drone-2");
        }

        @Test
        @DisplayName("Concurrent requests for one resource yield exactly one allocation")
        void concurrentMutualExclusion() throws Exception {
            int contenders = 16;
            ExecutorService pool = Executors.newFixedThreadPool(contenders);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Optional<ResourceAllocation>>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < contenders; i++) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        return allocate("drone-1");
                    }));
                }
                start.countDown();

                int winners = 0;
                for (Future<Optional<ResourceAllocation>> future : futures) {
                    if (future.get(5, TimeUnit.SECONDS).isPresent()) {
                        winners++;
                    }
                }
                assertThat(winners).isEqualTo(1);
                assertThat(manager.getActiveAllocations()).hasSize(1);
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("Typed requirements fall through to the next nearest candidate")
        void allocateForNearest() {
            GeoLocation scene = GeoLocation.of(26.7752, -80.0590);
            ResourceRequirement anyDrone = ResourceRequirement.ofType(ResourceType.DRONE, "surveillance");

            ResourceAllocation first = manager.allocateFor(anyDrone, scene, "wf", "test", 1, "overwatch").orElseThrow();
            ResourceAllocation second = manager.allocateFor(anyDrone, scene, "wf", "test", 1, "overwatch").orElseThrow();

            assertThat(first.resourceId()).isEqualTo("drone-1");
            assertThat(second.resourceId()).isEqualTo("drone-2");
            assertThat(manager.allocateFor(anyDrone, scene, "wf", "test", 1, "overwatch")).isEmpty();
        }

        @Test
        @DisplayName("Capability filters exclude resources lacking a tag")
        void capabilityFilter() {
            ResourceRequirement thermal = ResourceRequirement.ofType(ResourceType.DRONE, "thermal");
            allocate("drone-1");

            assertThat(manager.allocateFor(thermal, null, "wf", "test", 1, "search")).isEmpty();
        }
    }

    // ========== Queries ==========

    @Nested
    class Queries {

        @Test
        @DisplayName("Nearest resource uses great-circle distance")
        void nearest() {
            assertThat(manager.getNearestResource(ResourceType.DRONE, 26.7801, -80.0551))
                .get().extracting(Resource::resourceId).isEqualTo("drone-2");
            assertThat(manager.getNearestResource(ResourceType.DRONE, 26.7801, -80.0551, Set.of("thermal")))
                .get().extracting(Resource::resourceId).isEqualTo("drone-1");
            assertThat(manager.getNearestResource(ResourceType.ROBOT, 26.7801, -80.0551)).isEmpty();
        }

        @Test
        @DisplayName("Utilization counts held resources against those in service")
        void utilization() {
            allocate("drone-1");
            manager.updateStatus("drone-2", ResourceStatus.MAINTENANCE);

            ResourceUtilization drones = manager.getUtilization().get(ResourceType.DRONE);

            assertThat(drones.total()).isEqualTo(2);
            assertThat(drones.allocated()).isEqualTo(1);
            assertThat(drones.outOfService()).isEqualTo(1);
            assertThat(drones.utilizationRate()).isEqualTo(1.0);
            assertThat(manager.getUtilization().get(ResourceType.DISPATCH_UNIT).utilizationRate()).isZero();
        }
    }
}
