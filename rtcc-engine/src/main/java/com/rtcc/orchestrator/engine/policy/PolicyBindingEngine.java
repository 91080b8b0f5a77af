package com.rtcc.orchestrator.engine.policy;

import com.rtcc.orchestrator.core.exception.NotFoundException;
import com.rtcc.orchestrator.core.model.ActionType;
import com.rtcc.orchestrator.core.model.GuardrailCheck;
import com.rtcc.orchestrator.core.model.GuardrailSeverity;
import com.rtcc.orchestrator.core.model.OrchestrationAction;
import com.rtcc.orchestrator.core.model.PolicyBinding;
import com.rtcc.orchestrator.core.model.PolicyType;
import com.rtcc.orchestrator.core.repository.GuardrailCheckRepository;
import com.rtcc.orchestrator.engine.condition.ConditionEvaluator;
import com.rtcc.orchestrator.engine.metrics.OrchestrationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Holds policy bindings and evaluates them against proposed actions.
 *
 * A binding applies to an action when it is enabled and either its workflow filter,
 * action filter and conditions all match, or the action names the binding explicitly
 * in its guardrail list. Every applicable binding is evaluated; there is no
 * short-circuit, so the audit trail lists every violated policy.
 *
 * Checkers resolve by binding name first, then by policy type, then the standard checker.
 * A checker that throws yields a failed check, so a blocking binding fails closed.
 */
public class PolicyBindingEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyBindingEngine.class);

    public static final int COMPLIANCE_WINDOW = 1000;

    private final GuardrailCheckRepository checkRepository;
    private final ConditionEvaluator conditionEvaluator;
    private final ReviewChannel reviewChannel;
    private final OrchestrationMetrics metrics;
    private final PolicyChecker defaultChecker = new StandardPolicyChecker();

    private final Map<String, PolicyBinding> bindings = new LinkedHashMap<>();
    private final Map<PolicyType, PolicyChecker> checkersByType = new ConcurrentHashMap<>();
    private final Map<String, PolicyChecker> checkersByBinding = new ConcurrentHashMap<>();

    // Statistics
    private final AtomicLong totalChecks = new AtomicLong();
    private final AtomicLong passedChecks = new AtomicLong();
    private final AtomicLong failedChecks = new AtomicLong();
    private final AtomicLong blocksIssued = new AtomicLong();
    private final AtomicLong warningsIssued = new AtomicLong();
    private final AtomicLong checkerErrors = new AtomicLong();

    public PolicyBindingEngine(
            GuardrailCheckRepository checkRepository,
            ConditionEvaluator conditionEvaluator,
            ReviewChannel reviewChannel,
            OrchestrationMetrics metrics) {
        this.checkRepository = checkRepository;
        this.conditionEvaluator = conditionEvaluator;
        this.reviewChannel = reviewChannel;
        this.metrics = metrics;
    }

    // ========== Bindings ==========

    /**
     * Register a binding. A binding with the same id is replaced.
     */
    public PolicyBinding registerBinding(PolicyBinding binding) {
        PolicyBinding previous;
        synchronized (bindings) {
            previous = bindings.put(binding.bindingId(), binding);
        }
        log.info("{} policy binding {} ({}, {})",
            previous == null ? "Registered" : "Replaced",
            binding.name(), binding.policyType(), binding.severity());
        return binding;
    }

    public boolean removeBinding(String bindingId) {
        PolicyBinding removed;
        synchronized (bindings) {
            removed = bindings.remove(bindingId);
        }
        if (removed != null) {
            log.info("Removed policy binding {}", removed.name());
        }
        return removed != null;
    }

    public PolicyBinding enableBinding(String bindingId) {
        return setEnabled(bindingId, true);
    }

    public PolicyBinding disableBinding(String bindingId) {
        return setEnabled(bindingId, false);
    }

    private PolicyBinding setEnabled(String bindingId, boolean enabled) {
        PolicyBinding updated;
        synchronized (bindings) {
            PolicyBinding current = bindings.get(bindingId);
            if (current == null) {
                throw new NotFoundException("PolicyBinding", bindingId);
            }
            updated = current.withEnabled(enabled);
            bindings.put(bindingId, updated);
        }
        log.info("Policy binding {} {}", updated.name(), enabled ? "enabled" : "disabled");
        return updated;
    }

    /**
     * Look up a binding by id, falling back to a case-insensitive name match.
     */
    public Optional<PolicyBinding> getBinding(String idOrName) {
        synchronized (bindings) {
            PolicyBinding byId = bindings.get(idOrName);
            if (byId != null) {
                return Optional.of(byId);
            }
            return bindings.values().stream()
                .filter(b -> b.name().equalsIgnoreCase(idOrName))
                .findFirst();
        }
    }

    /**
     * @param policyType Filter by type, or null for all
     */
    public List<PolicyBinding> listBindings(PolicyType policyType) {
        return snapshot().stream()
            .filter(b -> policyType == null || b.policyType() == policyType)
            .toList();
    }

    private List<PolicyBinding> snapshot() {
        synchronized (bindings) {
            return List.copyOf(bindings.values());
        }
    }

    // ========== Checkers ==========

    public void registerChecker(PolicyType policyType, PolicyChecker checker) {
        checkersByType.put(policyType, checker);
        log.info("Registered custom checker for policy type {}", policyType);
    }

    public void registerChecker(String bindingName, PolicyChecker checker) {
        checkersByBinding.put(bindingName.toLowerCase(Locale.ROOT), checker);
        log.info("Registered custom checker for binding {}", bindingName);
    }

    private PolicyChecker checkerFor(PolicyBinding binding) {
        PolicyChecker named = checkersByBinding.get(binding.name().toLowerCase(Locale.ROOT));
        if (named != null) {
            return named;
        }
        return checkersByType.getOrDefault(binding.policyType(), defaultChecker);
    }

    // ========== Evaluation ==========

    /**
     * Bindings that apply to a proposed action, in registration order.
     */
    public List<PolicyBinding> getApplicableBindings(PolicyContext context) {
        Set<String> named = context.guardrails().stream()
            .map(g -> g.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());

        List<PolicyBinding> applicable = new ArrayList<>();
        for (PolicyBinding binding : snapshot()) {
            if (!binding.enabled()) {
                continue;
            }
            if (named.contains(binding.name().toLowerCase(Locale.ROOT))
                    || (binding.appliesToWorkflow(context.workflowId())
                        && binding.appliesToAction(context.actionType())
                        && conditionEvaluator.evaluateAll(binding.conditions(), context.parameters()))) {
                applicable.add(binding);
            }
        }
        return applicable;
    }

    public List<PolicyBinding> getApplicableBindings(String workflowId, ActionType actionType, Map<String, Object> parameters) {
        return getApplicableBindings(PolicyContext.of(workflowId, actionType, parameters));
    }

    /**
     * Evaluate every applicable binding against a proposed action and record the checks.
     * The caller decides what to do with a blocking failure.
     */
    public List<GuardrailCheck> checkPolicy(String workflowId, ActionType actionType, Map<String, Object> parameters) {
        return evaluate(PolicyContext.of(workflowId, actionType, parameters)).checks();
    }

    /**
     * Evaluate an action about to be dispatched, honouring its guardrail list.
     */
    public PolicyVerdict checkAction(OrchestrationAction action) {
        return evaluate(PolicyContext.forAction(action));
    }

    public PolicyVerdict evaluate(PolicyContext context) {
        List<GuardrailCheck> checks = new ArrayList<>();
        for (PolicyBinding binding : getApplicableBindings(context)) {
            GuardrailCheck check = runChecker(binding, context);
            record(check, context);
            checks.add(check);
        }
        PolicyVerdict verdict = new PolicyVerdict(checks);
        if (!verdict.allowed()) {
            log.warn("Action {} ({}) in workflow {} blocked by {}",
                context.actionId(), context.actionType(), context.workflowId(), verdict.vetoedBy());
        } else {
            log.debug("Action {} ({}) passed {} policy check(s)",
                context.actionId(), context.actionType(), checks.size());
        }
        return verdict;
    }

    private GuardrailCheck runChecker(PolicyBinding binding, PolicyContext context) {
        try {
            GuardrailCheck check = checkerFor(binding).check(binding, context);
            if (check == null) {
                throw new IllegalStateException("checker returned no result");
            }
            return check;
        } catch (RuntimeException e) {
            checkerErrors.incrementAndGet();
            log.error("Policy checker for binding {} failed: {}", binding.name(), e.getMessage(), e);
            return GuardrailCheck.of(
                binding,
                context.workflowId(),
                context.actionId(),
                context.actionType(),
                false,
                "Checker error: " + e.getMessage(),
                List.of("Checker error: " + e.getMessage()),
                List.of(),
                0
            );
        }
    }

    private void record(GuardrailCheck check, PolicyContext context) {
        checkRepository.append(check);
        metrics.policyChecked(check);
        totalChecks.incrementAndGet();
        if (check.passed()) {
            passedChecks.incrementAndGet();
            return;
        }
        failedChecks.incrementAndGet();
        if (check.severity() == GuardrailSeverity.BLOCKING) {
            blocksIssued.incrementAndGet();
        } else if (check.severity() == GuardrailSeverity.WARNING) {
            warningsIssued.incrementAndGet();
            reviewChannel.flag(check, context);
        }
    }

    // ========== Reporting ==========

    /**
     * @param policyType Filter by type, or null for all
     */
    public List<GuardrailCheck> getCheckHistory(PolicyType policyType, int limit) {
        return checkRepository.findRecent(policyType, limit);
    }

    public PolicyStatistics getStatistics() {
        List<PolicyBinding> all = snapshot();
        Map<PolicyType, Long> byType = new EnumMap<>(PolicyType.class);
        for (PolicyBinding binding : all) {
            byType.merge(binding.policyType(), 1L, Long::sum);
        }
        return new PolicyStatistics(
            totalChecks.get(),
            passedChecks.get(),
            failedChecks.get(),
            blocksIssued.get(),
            warningsIssued.get(),
            checkerErrors.get(),
            all.size(),
            (int) all.stream().filter(PolicyBinding::enabled).count(),
            byType
        );
    }

    /**
     * Compliance per policy type over the most recent {@value #COMPLIANCE_WINDOW} checks.
     */
    public ComplianceSummary getComplianceSummary() {
        List<GuardrailCheck> recent = checkRepository.findRecent(null, COMPLIANCE_WINDOW);
        Map<PolicyType, List<GuardrailCheck>> grouped = recent.stream()
            .collect(Collectors.groupingBy(GuardrailCheck::policyType, () -> new EnumMap<>(PolicyType.class), Collectors.toList()));

        Map<PolicyType, ComplianceSummary.Compliance> byType = new EnumMap<>(PolicyType.class);
        grouped.forEach((type, checks) -> {
            long passed = checks.stream().filter(GuardrailCheck::passed).count();
            double averageScore = checks.stream().mapToDouble(GuardrailCheck::score).average().orElse(0);
            byType.put(type, new ComplianceSummary.Compliance(
                checks.size(),
                passed,
                checks.size() - passed,
                passed * 100.0 / checks.size(),
                averageScore
            ));
        });
        return new ComplianceSummary(recent.size(), byType);
    }
}
