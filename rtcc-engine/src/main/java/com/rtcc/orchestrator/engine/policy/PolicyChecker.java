package com.rtcc.orchestrator.engine.policy;

import com.rtcc.orchestrator.core.model.GuardrailCheck;
import com.rtcc.orchestrator.core.model.PolicyBinding;

/**
 * Evaluates one binding against one proposed action.
 * Implementations may be registered per policy type or per binding name.
 */
@FunctionalInterface
public interface PolicyChecker {

    GuardrailCheck check(PolicyBinding binding, PolicyContext context);
}
