package com.rtcc.orchestrator.api.rest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rtcc.orchestrator.engine.metrics.OrchestrationMetrics;
import com.rtcc.orchestrator.engine.resource.ResourceManager;
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
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ResourceControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() throws Exception {
        mockMvc = MockMvcBuilders
            .standaloneSetup(new ResourceController(new ResourceManager(OrchestrationMetrics.standalone(), 100)))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();

        register("drone-north", 26.80, -80.06);
        register("drone-south", 26.60, -80.06);
    }

    private void register(String id, double latitude, double longitude) throws Exception {
        String body = objectMapper.writeValueAsString(Map.of(
            "resourceId", id,
            "type", "drone",
            "name", id.toUpperCase(),
            "latitude", latitude,
            "longitude", longitude,
            "capabilities", List.of("thermal", "video")));
        mockMvc.perform(post("/api/v1/resources").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("available"));
    }

    private String allocation(Map<String, Object> fields) throws Exception {
        return objectMapper.writeValueAsString(fields);
    }

    @Test
    @DisplayName("Allocating by type picks the nearest available drone")
    void allocateNearest() throws Exception {
        mockMvc.perform(post("/api/v1/resources/allocate").contentType(MediaType.APPLICATION_JSON)
                .content(allocation(Map.of("type", "drone", "latitude", 26.79, "longitude", -80.05,
                    "requester", "rtcc-operator", "purpose", "overwatch"))))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.resourceId").value("drone-north"))
            .andExpect(jsonPath("$.resourceType").value("drone"));

        mockMvc.perform(get("/api/v1/resources/drone-north"))
            .andExpect(jsonPath("$.status").value("allocated"));
        mockMvc.perform(get("/api/v1/resources/allocations"))
            .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    @DisplayName("A held resource cannot be allocated twice, removed or have its status forced")
    void conflicts() throws Exception {
        String specific = allocation(Map.of("resourceId", "drone-south", "requester", "rtcc-operator"));
        mockMvc.perform(post("/api/v1/resources/allocate").contentType(MediaType.APPLICATION_JSON).content(specific))
            .andExpect(status().isCreated());

        mockMvc.perform(post("/api/v1/resources/allocate").contentType(MediaType.APPLICATION_JSON).content(specific))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.errorCode").value("RESOURCE_CONFLICT"));
        mockMvc.perform(delete("/api/v1/resources/drone-south"))
            .andExpect(status().isConflict());
        mockMvc.perform(put("/api/v1/resources/drone-south/status").contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\":\"maintenance\"}"))
            .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("Release returns the resource to the pool and a second release conflicts")
    void release() throws Exception {
        mockMvc.perform(post("/api/v1/resources/allocate").contentType(MediaType.APPLICATION_JSON)
                .content(allocation(Map.of("resourceId", "drone-north", "requester", "rtcc-operator"))))
            .andExpect(status().isCreated());

        mockMvc.perform(post("/api/v1/resources/drone-north/release"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.released").value(true));
        mockMvc.perform(post("/api/v1/resources/drone-north/release"))
            .andExpect(status().isConflict());
        mockMvc.perform(get("/api/v1/resources/statistics"))
            .andExpect(jsonPath("$.totalAllocations").value(1))
            .andExpect(jsonPath("$.completedAllocations").value(1))
            .andExpect(jsonPath("$.activeAllocations").value(0));
    }

    @Test
    @DisplayName("Nearest lookup skips resources under maintenance")
    void nearestSkipsMaintenance() throws Exception {
        mockMvc.perform(put("/api/v1/resources/drone-north/status").contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\":\"maintenance\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("maintenance"));

        mockMvc.perform(get("/api/v1/resources/nearest")
                .param("type", "drone").param("latitude", "26.79").param("longitude", "-80.05"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.resourceId").value("drone-south"));
        mockMvc.perform(get("/api/v1/resources/nearest")
                .param("type", "helicopter").param("latitude", "26.79").param("longitude", "-80.05"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Allocation requests need a type or a resource id")
    void allocationNeedsTarget() throws Exception {
        mockMvc.perform(post("/api/v1/resources/allocate").contentType(MediaType.APPLICATION_JSON)
                .content(allocation(Map.of("requester", "rtcc-operator"))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("BAD_REQUEST"));
    }

    @Test
    @DisplayName("Unknown resources return 404")
    void unknownResource() throws Exception {
        mockMvc.perform(get("/api/v1/resources/drone-east"))
            .andExpect(status().isNotFound());
    }
}
