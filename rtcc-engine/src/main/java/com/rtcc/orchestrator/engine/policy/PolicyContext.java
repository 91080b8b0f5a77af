package com.rtcc.orchestrator.engine.policy;

import com.rtcc.orchestrator.core.model.ActionType;
import com.rtcc.orchestrator.core.model.OrchestrationAction;

import java.util.List;
import java.util.Map;

/**
 * The proposed action a policy check is evaluated against.
 *
 * @param workflowId Owning workflow, or null for ad-hoc actions
 * @param actionId Action being checked, or null for what-if checks
 * @param actionType Proposed action type
 * @param parameters Action parameters; conditions and checkers read from here
 * @param guardrails Binding names the caller explicitly asked to apply
 */
public record PolicyContext(
    String workflowId,
    String actionId,
    ActionType actionType,
    Map<String, Object> parameters,
    List<String> guardrails
) {
    public PolicyContext {
        if (actionType == null) {
            throw new IllegalArgumentException("Action type is required for a policy check");
        }
        parameters = parameters == null ? Map.of() : parameters;
        guardrails = guardrails == null ? List.of() : List.copyOf(guardrails);
    }

    public static PolicyContext of(String workflowId, ActionType actionType, Map<String, Object> parameters) {
        return new PolicyContext(workflowId, null, actionType, parameters, List.of());
    }

    public static PolicyContext forAction(OrchestrationAction action) {
        return new PolicyContext(
            action.workflowId(),
            action.actionId(),
            action.actionType(),
            action.parameters(),
            action.guardrails()
        );
    }
}
