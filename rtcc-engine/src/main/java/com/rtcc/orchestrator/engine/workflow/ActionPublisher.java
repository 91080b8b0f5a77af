package com.rtcc.orchestrator.engine.workflow;

import com.rtcc.orchestrator.core.model.OrchestrationAction;

import java.util.List;

/**
 * Where the workflow engine sends the actions its steps produce.
 * Implemented by the orchestration kernel.
 */
public interface ActionPublisher {

    /**
     * Hand an action over for policy checks, resource allocation and dispatch.
     */
    void queueAction(OrchestrationAction action);

    /**
     * Remove every not yet dispatched action of an execution.
     * Actions already running are left to finish.
     *
     * @return The withdrawn actions
     */
    List<OrchestrationAction> withdrawActions(String executionId);

    /**
     * Whether queued actions are currently being dispatched.
     */
    boolean isDispatching();
}
