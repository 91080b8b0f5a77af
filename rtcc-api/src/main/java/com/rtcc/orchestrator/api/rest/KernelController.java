package com.rtcc.orchestrator.api.rest;

import com.rtcc.orchestrator.core.model.ActionType;
import com.rtcc.orchestrator.core.model.GeoLocation;
import com.rtcc.orchestrator.core.model.KernelStatus;
import com.rtcc.orchestrator.core.model.OrchestrationAction;
import com.rtcc.orchestrator.core.model.OrchestrationResult;
import com.rtcc.orchestrator.core.model.ResourceRequirement;
import com.rtcc.orchestrator.core.model.ResourceType;
import com.rtcc.orchestrator.engine.kernel.KernelStatistics;
import com.rtcc.orchestrator.engine.kernel.OrchestrationKernel;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST API for kernel lifecycle, the action queue and operator confirmations.
 */
@RestController
@RequestMapping("/api/v1/kernel")
public class KernelController {

    private final OrchestrationKernel kernel;

    public KernelController(OrchestrationKernel kernel) {
        this.kernel = kernel;
    }

    // ========== Lifecycle ==========

    @GetMapping("/status")
    public KernelStatusResponse status() {
        return KernelStatusResponse.of(kernel);
    }

    @PostMapping("/start")
    public KernelStatusResponse start() {
        kernel.start();
        return KernelStatusResponse.of(kernel);
    }

    @PostMapping("/stop")
    public KernelStatusResponse stop() {
        kernel.stop();
        return KernelStatusResponse.of(kernel);
    }

    @PostMapping("/pause")
    public KernelStatusResponse pause() {
        kernel.pause();
        return KernelStatusResponse.of(kernel);
    }

    @PostMapping("/resume")
    public KernelStatusResponse resume() {
        kernel.resume();
        return KernelStatusResponse.of(kernel);
    }

    // ========== Actions ==========

    /**
     * Queue a standalone action outside any workflow.
     */
    @PostMapping("/actions")
    public ResponseEntity<OrchestrationAction> queue(@Valid @RequestBody ActionRequest request) {
        OrchestrationAction action = request.toAction();
        kernel.queueAction(action);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(action);
    }

    @GetMapping("/queue")
    public List<OrchestrationAction> queue() {
        return kernel.getQueueSnapshot();
    }

    @GetMapping("/confirmations")
    public List<OrchestrationAction> awaitingConfirmation() {
        return kernel.getAwaitingConfirmation();
    }

    @PostMapping("/confirmations/{actionId}/confirm")
    public OrchestrationAction confirm(@PathVariable String actionId) {
        return kernel.confirmAction(actionId);
    }

    @PostMapping("/confirmations/{actionId}/reject")
    public OrchestrationResult reject(
            @PathVariable String actionId,
            @RequestBody(required = false) RejectRequest request) {
        return kernel.rejectAction(actionId, request != null ? request.reason() : null);
    }

    @GetMapping("/subsystems")
    public Set<String> subsystems() {
        return kernel.listSubsystems();
    }

    @GetMapping("/audit")
    public List<OrchestrationResult> audit(
            @RequestParam(required = false) String executionId,
            @RequestParam(required = false) String actionType,
            @RequestParam(defaultValue = "100") int limit) {
        return kernel.getAuditTrail(executionId, actionType == null ? null : ActionType.fromCode(actionType), limit);
    }

    @GetMapping("/statistics")
    public KernelStatistics statistics() {
        return kernel.getStatistics();
    }

    // ========== DTOs ==========

    public record KernelStatusResponse(KernelStatus status, int queueDepth, int inFlight) {
        static KernelStatusResponse of(OrchestrationKernel kernel) {
            return new KernelStatusResponse(kernel.getStatus(), kernel.getQueueDepth(), kernel.getInFlightCount());
        }
    }

    public record RejectRequest(String reason) {}

    public record ActionRequest(
        @NotNull ActionType actionType,
        @NotBlank String targetSubsystem,
        Map<String, Object> parameters,
        Integer priority,
        Long timeoutSeconds,
        Boolean requiresConfirmation,
        List<String> guardrails,
        ResourceType resourceType,
        String resourceId,
        Set<String> capabilities,
        Double latitude,
        Double longitude
    ) {
        OrchestrationAction toAction() {
            OrchestrationAction.Builder builder = OrchestrationAction.builder(actionType, targetSubsystem);
            if (parameters != null) {
                builder.parameters(parameters);
            }
            if (priority != null) {
                builder.priority(priority);
            }
            if (timeoutSeconds != null) {
                builder.timeout(Duration.ofSeconds(timeoutSeconds));
            }
            if (requiresConfirmation != null) {
                builder.requiresConfirmation(requiresConfirmation);
            }
            if (guardrails != null) {
                builder.guardrails(guardrails);
            }
            if (resourceType != null || resourceId != null) {
                builder.resource(new ResourceRequirement(resourceType, resourceId, capabilities, null));
            }
            if (latitude != null && longitude != null) {
                builder.location(new GeoLocation(latitude, longitude));
            }
            return builder.build();
        }
    }
}
