package com.rtcc.orchestrator.engine.policy;

import com.rtcc.orchestrator.core.model.GuardrailCheck;
import com.rtcc.orchestrator.core.model.PolicyBinding;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Default checker: scores an action against a binding's requirements and prohibitions.
 *
 * The caller attests what it satisfied via the {@code satisfied_requirements} parameter
 * and reports what was detected via {@code detected_violations}; both accept a list or a
 * comma separated string. Scoring starts at 100:
 * <ul>
 *   <li>a missing requirement costs 25 and fails a blocking binding,</li>
 *   <li>a missing requirement costs 10 and only recommends on other severities,</li>
 *   <li>any detected prohibition fails the check with score 0.</li>
 * </ul>
 */
public class StandardPolicyChecker implements PolicyChecker {

    public static final String SATISFIED_REQUIREMENTS = "satisfied_requirements";
    public static final String DETECTED_VIOLATIONS = "detected_violations";

    static final double FULL_SCORE = 100.0;
    static final double BLOCKING_PENALTY = 25.0;
    static final double ADVISORY_PENALTY = 10.0;

    @Override
    public GuardrailCheck check(PolicyBinding binding, PolicyContext context) {
        Set<String> satisfied = readTokens(context.parameters().get(SATISFIED_REQUIREMENTS));
        Set<String> detected = readTokens(context.parameters().get(DETECTED_VIOLATIONS));

        boolean passed = true;
        double score = FULL_SCORE;
        List<String> violations = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        for (String requirement : binding.requirements()) {
            if (satisfied.contains(normalize(requirement))) {
                continue;
            }
            if (binding.severity().isBlocking()) {
                passed = false;
                violations.add("Missing requirement: " + requirement);
                score -= BLOCKING_PENALTY;
            } else {
                recommendations.add("Consider satisfying: " + requirement);
                score -= ADVISORY_PENALTY;
            }
        }

        for (String prohibition : binding.prohibitions()) {
            if (detected.contains(normalize(prohibition))) {
                passed = false;
                violations.add("Prohibition violated: " + prohibition);
                score = 0;
            }
        }

        String message = passed
            ? "Policy check passed"
            : "Policy check failed: " + violations.size() + " violation(s)";
        return GuardrailCheck.of(
            binding,
            context.workflowId(),
            context.actionId(),
            context.actionType(),
            passed,
            message,
            violations,
            recommendations,
            Math.max(0, score)
        );
    }

    private static Set<String> readTokens(Object raw) {
        Set<String> tokens = new LinkedHashSet<>();
        if (raw instanceof Collection<?> values) {
            for (Object value : values) {
                if (value != null) {
                    tokens.add(normalize(value.toString()));
                }
            }
        } else if (raw instanceof String text) {
            for (String part : text.split(",")) {
                if (!part.isBlank()) {
                    tokens.add(normalize(part));
                }
            }
        }
        return tokens;
    }

    private static String normalize(String token) {
        return token.trim().toLowerCase(Locale.ROOT);
    }
}
