package com.rtcc.orchestrator.engine.workflow;

import com.rtcc.orchestrator.core.model.OrchestrationResult;

/**
 * Notified once per action when its outcome is recorded.
 */
@FunctionalInterface
public interface ActionResultListener {

    void onActionResult(OrchestrationResult result);
}
