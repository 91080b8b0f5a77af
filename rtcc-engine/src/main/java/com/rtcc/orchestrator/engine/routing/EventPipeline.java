package com.rtcc.orchestrator.engine.routing;

import com.rtcc.orchestrator.core.model.NormalizedEvent;

/**
 * Named consumer of routed events.
 * A failing pipeline never prevents delivery to the others.
 */
@FunctionalInterface
public interface EventPipeline {

    void deliver(NormalizedEvent event) throws Exception;
}
