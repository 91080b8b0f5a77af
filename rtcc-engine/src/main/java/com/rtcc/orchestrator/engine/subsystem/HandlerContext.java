package com.rtcc.orchestrator.engine.subsystem;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rtcc.orchestrator.core.model.ActionType;
import com.rtcc.orchestrator.core.model.OrchestrationAction;
import com.rtcc.orchestrator.core.model.Resource;
import com.rtcc.orchestrator.core.model.ResourceAllocation;

import java.util.Map;
import java.util.Optional;

/**
 * Context handed to a subsystem handler for one dispatched action.
 */
public class HandlerContext {

    private final OrchestrationAction action;
    private final Resource resource;
    private final ResourceAllocation allocation;
    private final ObjectMapper objectMapper;
    private volatile boolean retainResource;

    public HandlerContext(
            OrchestrationAction action,
            Resource resource,
            ResourceAllocation allocation,
            ObjectMapper objectMapper) {
        this.action = action;
        this.resource = resource;
        this.allocation = allocation;
        this.objectMapper = objectMapper;
    }

    public OrchestrationAction getAction() {
        return action;
    }

    public ActionType getActionType() {
        return action.actionType();
    }

    public Map<String, Object> getParameters() {
        return action.parameters();
    }

    /**
     * Read a parameter as a specific type, or null when absent.
     */
    public <T> T getParameter(String name, Class<T> type) {
        Object value = action.parameters().get(name);
        return value == null ? null : objectMapper.convertValue(value, type);
    }

    /**
     * The resource allocated for this action, if the action required one.
     */
    public Optional<Resource> getResource() {
        return Optional.ofNullable(resource);
    }

    public Optional<ResourceAllocation> getAllocation() {
        return Optional.ofNullable(allocation);
    }

    public int getAttemptNumber() {
        return action.attempt();
    }

    /**
     * Keep the allocated resource after the handler returns.
     * The resource then stays allocated until released through the resource manager.
     */
    public void retainResource() {
        this.retainResource = true;
    }

    public boolean isResourceRetained() {
        return retainResource;
    }

    public ObjectNode newOutput() {
        return objectMapper.createObjectNode();
    }

    public JsonNode toJsonNode(Object result) {
        return objectMapper.valueToTree(result);
    }
}
