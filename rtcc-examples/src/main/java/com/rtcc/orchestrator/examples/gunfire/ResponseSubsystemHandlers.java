package com.rtcc.orchestrator.examples.gunfire;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rtcc.orchestrator.core.model.Resource;
import com.rtcc.orchestrator.engine.kernel.OrchestrationKernel;
import com.rtcc.orchestrator.engine.subsystem.HandlerContext;
import com.rtcc.orchestrator.engine.subsystem.HandlerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Simulated field subsystems for the gunfire response.
 *
 * Each handler sleeps briefly to stand in for the remote call and records what it did,
 * so a demo run or a test can inspect the dispatches afterwards.
 */
public class ResponseSubsystemHandlers {

    private static final Logger log = LoggerFactory.getLogger(ResponseSubsystemHandlers.class);

    private final Random random = new Random();
    private final List<String> notifications = new CopyOnWriteArrayList<>();
    private final List<String> launchedDrones = new CopyOnWriteArrayList<>();
    private final List<String> dispatchedUnits = new CopyOnWriteArrayList<>();

    // Failure simulation
    private final AtomicInteger droneFaultsRemaining = new AtomicInteger();

    public void registerWith(OrchestrationKernel kernel) {
        kernel.registerSubsystem(GunfireResponseWorkflow.COMMUNICATIONS, this::communications);
        kernel.registerSubsystem(GunfireResponseWorkflow.DRONE_OPS, this::droneOps);
        kernel.registerSubsystem(GunfireResponseWorkflow.CAD, this::cad);
    }

    /**
     * Officer alerts, notifications and audit records.
     */
    JsonNode communications(HandlerContext context) {
        String messageId = "MSG-" + UUID.randomUUID().toString().substring(0, 8);
        log.info("[{}] {} via communications: {}", messageId, context.getActionType(), context.getParameters()
            .getOrDefault("message", context.getParameters().getOrDefault("radius_m", "-")));
        sleep(20 + random.nextInt(30));

        notifications.add(context.getAction().stepName() != null ? context.getAction().stepName() : messageId);
        ObjectNode output = context.newOutput();
        output.put("messageId", messageId);
        output.put("sentAt", Instant.now().toString());
        return output;
    }

    /**
     * Drone launch. Fails while simulated faults remain.
     */
    JsonNode droneOps(HandlerContext context) throws HandlerException {
        Resource drone = context.getResource()
            .orElseThrow(() -> HandlerException.permanent("NO_DRONE", "Drone dispatch without an allocated drone"));

        if (droneFaultsRemaining.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            log.warn("SIMULATED FAILURE: {} failed pre-flight checks", drone.name());
            throw HandlerException.transientFailure("PREFLIGHT_FAILED", drone.name() + " failed pre-flight checks");
        }

        sleep(50 + random.nextInt(50));
        launchedDrones.add(drone.resourceId());
        log.info("Drone {} launched on {} mission", drone.name(), context.getParameter("mission", String.class));

        ObjectNode output = context.newOutput();
        output.put("droneId", drone.resourceId());
        output.put("etaSeconds", 60 + random.nextInt(60));
        return output;
    }

    /**
     * Computer-aided dispatch of a patrol unit.
     */
    JsonNode cad(HandlerContext context) throws HandlerException {
        Resource unit = context.getResource()
            .orElseThrow(() -> HandlerException.permanent("NO_UNIT", "CAD dispatch without an allocated unit"));
        sleep(20 + random.nextInt(30));
        dispatchedUnits.add(unit.resourceId());
        log.info("Unit {} dispatched as {}", unit.name(), context.getParameter("call_type", String.class));

        ObjectNode output = context.newOutput();
        output.put("unitId", unit.resourceId());
        output.put("incidentNumber", "CAD-" + (100_000 + random.nextInt(900_000)));
        return output;
    }

    public void failNextDroneLaunches(int count) {
        droneFaultsRemaining.set(count);
    }

    public List<String> getNotifications() {
        return List.copyOf(notifications);
    }

    public List<String> getLaunchedDrones() {
        return List.copyOf(launchedDrones);
    }

    public List<String> getDispatchedUnits() {
        return List.copyOf(dispatchedUnits);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
