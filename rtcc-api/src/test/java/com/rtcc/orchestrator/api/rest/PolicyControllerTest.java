package com.rtcc.orchestrator.api.rest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rtcc.orchestrator.engine.condition.ConditionEvaluator;
import com.rtcc.orchestrator.engine.metrics.OrchestrationMetrics;
import com.rtcc.orchestrator.engine.persistence.InMemoryGuardrailCheckRepository;
import com.rtcc.orchestrator.engine.policy.LoggingReviewChannel;
import com.rtcc.orchestrator.engine.policy.PolicyBindingEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class PolicyControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() throws Exception {
        PolicyBindingEngine policyEngine = new PolicyBindingEngine(new InMemoryGuardrailCheckRepository(100),
            new ConditionEvaluator(), new LoggingReviewChannel(), OrchestrationMetrics.standalone());
        mockMvc = MockMvcBuilders
            .standaloneSetup(new PolicyController(policyEngine))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();

        String binding = objectMapper.writeValueAsString(Map.of(
            "bindingId", "night-flight",
            "name", "Night Flight Waiver",
            "policyType", "department_sop",
            "severity", "blocking",
            "actions", List.of("drone_dispatch"),
            "requirements", List.of("night_waiver")));
        mockMvc.perform(post("/api/v1/policies").contentType(MediaType.APPLICATION_JSON).content(binding))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.bindingId").value("night-flight"))
            .andExpect(jsonPath("$.policyType").value("department_sop"));
    }

    @Test
    @DisplayName("A drone dispatch without the waiver fails the blocking binding")
    void checkWithoutAttestation() throws Exception {
        String request = objectMapper.writeValueAsString(Map.of(
            "workflowId", "gunfire-response",
            "actionType", "drone_dispatch",
            "parameters", Map.of()));

        mockMvc.perform(post("/api/v1/policies/check").contentType(MediaType.APPLICATION_JSON).content(request))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].passed").value(false))
            .andExpect(jsonPath("$[0].violations[0]").value("Missing requirement: night_waiver"));

        mockMvc.perform(get("/api/v1/policies/statistics"))
            .andExpect(jsonPath("$.totalChecks").value(1))
            .andExpect(jsonPath("$.failedChecks").value(1));
    }

    @Test
    @DisplayName("Attested requirements pass the check")
    void checkWithAttestation() throws Exception {
        String request = objectMapper.writeValueAsString(Map.of(
            "actionType", "drone_dispatch",
            "parameters", Map.of("satisfied_requirements", "night_waiver")));

        mockMvc.perform(post("/api/v1/policies/check").contentType(MediaType.APPLICATION_JSON).content(request))
            .andExpect(jsonPath("$[0].passed").value(true))
            .andExpect(jsonPath("$[0].score").value(100.0));
    }

    @Test
    @DisplayName("Actions outside the binding's scope produce no checks")
    void unrelatedAction() throws Exception {
        mockMvc.perform(post("/api/v1/policies/check").contentType(MediaType.APPLICATION_JSON)
                .content("{\"actionType\":\"notification_send\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    @DisplayName("Bindings are found by name and disappear once removed")
    void lookupAndRemove() throws Exception {
        mockMvc.perform(get("/api/v1/policies/{id}", "Night Flight Waiver"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.bindingId").value("night-flight"));
        mockMvc.perform(post("/api/v1/policies/night-flight/disable"))
            .andExpect(jsonPath("$.enabled").value(false));
        mockMvc.perform(delete("/api/v1/policies/night-flight"))
            .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/v1/policies/night-flight"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("A check request without an action type is rejected")
    void missingActionType() throws Exception {
        mockMvc.perform(post("/api/v1/policies/check").contentType(MediaType.APPLICATION_JSON).content("{}"))
            .andExpect(status().isBadRequest());
    }
}
