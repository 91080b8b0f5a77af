package com.rtcc.orchestrator.engine.policy;

import com.rtcc.orchestrator.core.model.GuardrailCheck;
import com.rtcc.orchestrator.core.model.GuardrailSeverity;

import java.util.List;

/**
 * All checks produced for one proposed action.
 * The action may proceed only when no blocking binding failed.
 */
public record PolicyVerdict(List<GuardrailCheck> checks) {

    public PolicyVerdict {
        checks = checks == null ? List.of() : List.copyOf(checks);
    }

    public boolean allowed() {
        return checks.stream().noneMatch(GuardrailCheck::isBlockingFailure);
    }

    public List<GuardrailCheck> blockingFailures() {
        return checks.stream().filter(GuardrailCheck::isBlockingFailure).toList();
    }

    public List<GuardrailCheck> warnings() {
        return checks.stream()
            .filter(c -> !c.passed() && c.severity() == GuardrailSeverity.WARNING)
            .toList();
    }

    /**
     * Names of the blocking bindings that vetoed the action.
     */
    public List<String> vetoedBy() {
        return blockingFailures().stream().map(GuardrailCheck::bindingName).toList();
    }
}
