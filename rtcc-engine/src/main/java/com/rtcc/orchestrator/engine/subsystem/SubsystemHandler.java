package com.rtcc.orchestrator.engine.subsystem;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Executes actions addressed to one downstream subsystem.
 * Registered with the kernel under the subsystem name actions target.
 */
@FunctionalInterface
public interface SubsystemHandler {

    /**
     * Execute an action.
     *
     * @param context The action, its allocated resource and output helpers
     * @return The action output
     * @throws HandlerException if the subsystem could not carry out the action
     */
    JsonNode handle(HandlerContext context) throws HandlerException;
}
