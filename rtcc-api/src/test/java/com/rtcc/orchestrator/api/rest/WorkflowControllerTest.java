package com.rtcc.orchestrator.api.rest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rtcc.orchestrator.engine.condition.ConditionEvaluator;
import com.rtcc.orchestrator.engine.history.ExecutionHistoryService;
import com.rtcc.orchestrator.engine.metrics.OrchestrationMetrics;
import com.rtcc.orchestrator.engine.persistence.InMemoryExecutionEventRepository;
import com.rtcc.orchestrator.engine.persistence.InMemoryWorkflowExecutionRepository;
import com.rtcc.orchestrator.engine.persistence.InMemoryWorkflowRepository;
import com.rtcc.orchestrator.engine.workflow.ActionPublisher;
import com.rtcc.orchestrator.engine.workflow.WorkflowEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class WorkflowControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ActionPublisher publisher = mock(ActionPublisher.class);
    private WorkflowEngine engine;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        InMemoryWorkflowExecutionRepository executions = new InMemoryWorkflowExecutionRepository();
        InMemoryExecutionEventRepository events = new InMemoryExecutionEventRepository();
        engine = new WorkflowEngine(new InMemoryWorkflowRepository(), executions, events,
            new ConditionEvaluator(), publisher, OrchestrationMetrics.standalone(), objectMapper);
        mockMvc = MockMvcBuilders
            .standaloneSetup(new WorkflowController(engine, new ExecutionHistoryService(executions, events)))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private String gunfireResponse() throws Exception {
        return objectMapper.writeValueAsString(Map.of(
            "name", "Gunfire Response",
            "category", "emergency",
            "priority", 1,
            "triggers", List.of(Map.of(
                "type", "event",
                "eventTypes", List.of("gunshot_detected"),
                "conditions", List.of("confidence >= 0.8"))),
            "steps", List.of(
                Map.of("name", "alert-officers", "actionType", "notification_send",
                    "targetSubsystem", "communications", "mode", "parallel"),
                Map.of("name", "dispatch-drone", "actionType", "drone_dispatch",
                    "targetSubsystem", "drone_ops", "mode", "parallel", "resourceType", "drone"))));
    }

    @Test
    @DisplayName("Registering a workflow returns it with a derived id")
    void register() throws Exception {
        mockMvc.perform(post("/api/v1/workflows").contentType(MediaType.APPLICATION_JSON).content(gunfireResponse()))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value("gunfire-response"))
            .andExpect(jsonPath("$.steps.length()").value(2))
            .andExpect(jsonPath("$.steps[1].resource.type").value("drone"));

        mockMvc.perform(get("/api/v1/workflows").param("category", "emergency"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].name").value("Gunfire Response"));
    }

    @Test
    @DisplayName("Definitions without steps are rejected")
    void rejectsEmptySteps() throws Exception {
        mockMvc.perform(post("/api/v1/workflows").contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Empty\",\"steps\":[]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("BAD_REQUEST"));
    }

    @Test
    @DisplayName("Unknown workflows are reported as 404")
    void unknownWorkflow() throws Exception {
        mockMvc.perform(get("/api/v1/workflows/ghost"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"))
            .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    @DisplayName("Manual execution dispatches the first group; a second abort conflicts")
    void executeAndAbort() throws Exception {
        mockMvc.perform(post("/api/v1/workflows").contentType(MediaType.APPLICATION_JSON).content(gunfireResponse()))
            .andExpect(status().isCreated());

        String body = mockMvc.perform(post("/api/v1/workflows/gunfire-response/execute")
                .contentType(MediaType.APPLICATION_JSON).content("{\"incident\":\"INC-7\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("RUNNING"))
            .andExpect(jsonPath("$.triggerType").value("api"))
            .andReturn().getResponse().getContentAsString();
        String executionId = objectMapper.readTree(body).path("executionId").asText();
        verify(publisher, times(2)).queueAction(any());

        mockMvc.perform(post("/api/v1/workflows/executions/{id}/abort", executionId)
                .contentType(MediaType.APPLICATION_JSON).content("{\"reason\":\"false alarm\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ABORTED"));
        mockMvc.perform(post("/api/v1/workflows/executions/{id}/abort", executionId))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.errorCode").value("INVALID_STATE_TRANSITION"));

        mockMvc.perform(get("/api/v1/workflows/executions/{id}/history", executionId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.currentStatus").value("ABORTED"))
            .andExpect(jsonPath("$.statistics.stepsDispatched").value(2));
        mockMvc.perform(get("/api/v1/workflows/statistics"))
            .andExpect(jsonPath("$.abortedExecutions").value(1));
    }
}
