package com.rtcc.orchestrator.api.rest;

import com.rtcc.orchestrator.core.exception.NotFoundException;
import com.rtcc.orchestrator.core.model.ActionType;
import com.rtcc.orchestrator.core.model.GuardrailCheck;
import com.rtcc.orchestrator.core.model.GuardrailSeverity;
import com.rtcc.orchestrator.core.model.PolicyBinding;
import com.rtcc.orchestrator.core.model.PolicyType;
import com.rtcc.orchestrator.engine.policy.ComplianceSummary;
import com.rtcc.orchestrator.engine.policy.PolicyBindingEngine;
import com.rtcc.orchestrator.engine.policy.PolicyStatistics;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API for policy bindings and guardrail checks.
 */
@RestController
@RequestMapping("/api/v1/policies")
public class PolicyController {

    private final PolicyBindingEngine policyEngine;

    public PolicyController(PolicyBindingEngine policyEngine) {
        this.policyEngine = policyEngine;
    }

    @PostMapping
    public ResponseEntity<PolicyBinding> register(@Valid @RequestBody PolicyBindingRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(policyEngine.registerBinding(request.toBinding()));
    }

    @GetMapping
    public List<PolicyBinding> list(@RequestParam(required = false) String type) {
        return policyEngine.listBindings(type == null ? null : PolicyType.fromCode(type));
    }

    /**
     * Look up a binding by id or name.
     */
    @GetMapping("/{bindingId}")
    public PolicyBinding get(@PathVariable String bindingId) {
        return policyEngine.getBinding(bindingId)
            .orElseThrow(() -> new NotFoundException("PolicyBinding", bindingId));
    }

    @PostMapping("/{bindingId}/enable")
    public PolicyBinding enable(@PathVariable String bindingId) {
        return policyEngine.enableBinding(bindingId);
    }

    @PostMapping("/{bindingId}/disable")
    public PolicyBinding disable(@PathVariable String bindingId) {
        return policyEngine.disableBinding(bindingId);
    }

    @DeleteMapping("/{bindingId}")
    public ResponseEntity<Void> remove(@PathVariable String bindingId) {
        if (!policyEngine.removeBinding(bindingId)) {
            throw new NotFoundException("PolicyBinding", bindingId);
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * Evaluate a prospective action against every applicable binding without dispatching it.
     */
    @PostMapping("/check")
    public List<GuardrailCheck> check(@Valid @RequestBody PolicyCheckRequest request) {
        return policyEngine.checkPolicy(request.workflowId(), request.actionType(),
            request.parameters() == null ? Map.of() : request.parameters());
    }

    @GetMapping("/history")
    public List<GuardrailCheck> history(
            @RequestParam(required = false) String type,
            @RequestParam(defaultValue = "100") int limit) {
        return policyEngine.getCheckHistory(type == null ? null : PolicyType.fromCode(type), limit);
    }

    @GetMapping("/compliance")
    public ComplianceSummary compliance() {
        return policyEngine.getComplianceSummary();
    }

    @GetMapping("/statistics")
    public PolicyStatistics statistics() {
        return policyEngine.getStatistics();
    }

    // ========== DTOs ==========

    public record PolicyCheckRequest(
        String workflowId,
        @NotNull ActionType actionType,
        Map<String, Object> parameters
    ) {}

    public record PolicyBindingRequest(
        String bindingId,
        @NotBlank String name,
        @NotNull PolicyType policyType,
        GuardrailSeverity severity,
        String description,
        List<String> workflows,
        List<ActionType> actions,
        List<String> conditions,
        List<String> requirements,
        List<String> prohibitions,
        Boolean enabled
    ) {
        PolicyBinding toBinding() {
            PolicyBinding.Builder builder = PolicyBinding.builder(name, policyType)
                .description(description);
            if (bindingId != null) {
                builder.bindingId(bindingId);
            }
            if (severity != null) {
                builder.severity(severity);
            }
            if (workflows != null) {
                builder.workflows(workflows.toArray(String[]::new));
            }
            if (actions != null) {
                builder.actions(actions.toArray(ActionType[]::new));
            }
            if (conditions != null) {
                builder.conditions(conditions.toArray(String[]::new));
            }
            if (requirements != null) {
                builder.requirements(requirements.toArray(String[]::new));
            }
            if (prohibitions != null) {
                builder.prohibitions(prohibitions.toArray(String[]::new));
            }
            if (enabled != null) {
                builder.enabled(enabled);
            }
            return builder.build();
        }
    }
}
