package com.rtcc.orchestrator.api.health;

import com.rtcc.orchestrator.core.model.KernelStatus;
import com.rtcc.orchestrator.engine.kernel.OrchestrationKernel;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports kernel status with queue depth and in-flight count.
 */
@Component("kernel")
public class KernelHealthIndicator implements HealthIndicator {

    private final OrchestrationKernel kernel;

    public KernelHealthIndicator(OrchestrationKernel kernel) {
        this.kernel = kernel;
    }

    @Override
    public Health health() {
        KernelStatus status = kernel.getStatus();
        Health.Builder builder = switch (status) {
            case RUNNING -> Health.up();
            case PAUSED -> Health.outOfService();
            default -> Health.down();
        };
        return builder
            .withDetail("status", status.name())
            .withDetail("queueDepth", kernel.getQueueDepth())
            .withDetail("inFlight", kernel.getInFlightCount())
            .withDetail("subsystems", kernel.listSubsystems().size())
            .build();
    }
}
