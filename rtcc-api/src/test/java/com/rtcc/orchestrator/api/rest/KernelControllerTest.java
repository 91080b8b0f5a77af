package com.rtcc.orchestrator.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rtcc.orchestrator.engine.condition.ConditionEvaluator;
import com.rtcc.orchestrator.engine.kernel.KernelSettings;
import com.rtcc.orchestrator.engine.kernel.OrchestrationKernel;
import com.rtcc.orchestrator.engine.metrics.OrchestrationMetrics;
import com.rtcc.orchestrator.engine.persistence.InMemoryAuditTrailRepository;
import com.rtcc.orchestrator.engine.persistence.InMemoryGuardrailCheckRepository;
import com.rtcc.orchestrator.engine.policy.LoggingReviewChannel;
import com.rtcc.orchestrator.engine.policy.PolicyBindingEngine;
import com.rtcc.orchestrator.engine.resource.ResourceManager;
import com.rtcc.orchestrator.engine.routing.EventRouter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class KernelControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private OrchestrationKernel kernel;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ConditionEvaluator conditions = new ConditionEvaluator();
        OrchestrationMetrics metrics = OrchestrationMetrics.standalone();
        kernel = new OrchestrationKernel(
            new EventRouter(conditions, metrics, 100),
            new PolicyBindingEngine(new InMemoryGuardrailCheckRepository(100), conditions,
                new LoggingReviewChannel(), metrics),
            new ResourceManager(metrics, 100),
            new InMemoryAuditTrailRepository(100),
            metrics,
            objectMapper,
            KernelSettings.builder().handlerThreads(2).shutdownTimeout(Duration.ofSeconds(2)).build());
        kernel.registerSubsystem("communications", ctx -> ctx.newOutput().put("notified", 4));

        mockMvc = MockMvcBuilders
            .standaloneSetup(new KernelController(kernel))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @AfterEach
    void tearDown() {
        kernel.stop();
    }

    private JsonNode queueNotification(boolean requiresConfirmation) throws Exception {
        String body = objectMapper.writeValueAsString(Map.of(
            "actionType", "notification_send",
            "targetSubsystem", "communications",
            "parameters", Map.of("message", "Shots fired near 5th and Main"),
            "priority", 2,
            "requiresConfirmation", requiresConfirmation));
        String response = mockMvc.perform(post("/api/v1/kernel/actions")
                .contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isAccepted())
            .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(response);
    }

    @Test
    @DisplayName("A stopped kernel refuses to pause")
    void pauseWhileStopped() throws Exception {
        mockMvc.perform(get("/api/v1/kernel/status"))
            .andExpect(jsonPath("$.status").value("STOPPED"));
        mockMvc.perform(post("/api/v1/kernel/pause"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.errorCode").value("KERNEL_STATE_CONFLICT"));
    }

    @Test
    @DisplayName("Actions queued while stopped are dispatched once the kernel starts")
    void queuedBeforeStart() throws Exception {
        JsonNode queued = queueNotification(false);
        mockMvc.perform(get("/api/v1/kernel/status"))
            .andExpect(jsonPath("$.queueDepth").value(1));

        mockMvc.perform(post("/api/v1/kernel/start"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("RUNNING"));

        await().atMost(Duration.ofSeconds(5))
            .until(() -> kernel.getAuditTrail(null, null, 10).size() == 1);
        mockMvc.perform(get("/api/v1/kernel/audit"))
            .andExpect(jsonPath("$[0].actionId").value(queued.get("actionId").asText()))
            .andExpect(jsonPath("$[0].status").value("SUCCEEDED"))
            .andExpect(jsonPath("$[0].output.notified").value(4));
    }

    @Test
    @DisplayName("Actions needing confirmation are held until an operator rejects them")
    void rejectHeldAction() throws Exception {
        mockMvc.perform(post("/api/v1/kernel/start")).andExpect(status().isOk());
        String actionId = queueNotification(true).get("actionId").asText();

        await().atMost(Duration.ofSeconds(5))
            .until(() -> kernel.getAwaitingConfirmation().size() == 1);
        mockMvc.perform(get("/api/v1/kernel/confirmations"))
            .andExpect(jsonPath("$[0].actionId").value(actionId));

        mockMvc.perform(post("/api/v1/kernel/confirmations/{id}/reject", actionId)
                .contentType(MediaType.APPLICATION_JSON).content("{\"reason\":\"Officers already on scene\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.failureKind").value("CONFIRMATION_REJECTED"))
            .andExpect(jsonPath("$.errors[0]").value("Rejected by operator: Officers already on scene"));

        assertThat(kernel.getStatistics().actionsSucceeded()).isZero();
    }

    @Test
    @DisplayName("Rejecting an unknown confirmation returns 404")
    void rejectUnknown() throws Exception {
        mockMvc.perform(post("/api/v1/kernel/confirmations/{id}/reject", "missing"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Registered subsystems are listed")
    void subsystems() throws Exception {
        mockMvc.perform(get("/api/v1/kernel/subsystems"))
            .andExpect(jsonPath("$[0]").value("communications"));
    }
}
