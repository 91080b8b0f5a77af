package com.rtcc.orchestrator.engine.policy;

import com.rtcc.orchestrator.core.model.GuardrailCheck;

/**
 * Receives failed non-blocking checks for human review.
 * The action proceeds; review happens out of band.
 */
public interface ReviewChannel {

    void flag(GuardrailCheck check, PolicyContext context);
}
