package com.rtcc.orchestrator.engine.condition;

import java.util.List;
import java.util.Map;

/**
 * Evaluates condition expressions against a payload map.
 * Shared by routing rules, workflow triggers and policy bindings.
 *
 * Supported expressions:
 *   - "confidence >= 0.8"              numeric comparison (>, >=, <, <=)
 *   - "location.zone == 'downtown'"    equality on a nested field
 *   - "status != 'resolved'"           inequality
 *   - null or blank                    always matches
 *
 * A "payload.", "data." or "parameters." prefix on the field path is ignored.
 * Missing fields and unparseable expressions never match.
 */
public class ConditionEvaluator {

    private static final String[] OPERATORS = {"!=", "==", ">=", "<=", ">", "<"};
    private static final String[] ROOT_PREFIXES = {"payload.", "data.", "parameters."};

    /**
     * Evaluate a single condition against a payload.
     */
    public boolean evaluate(String condition, Map<String, ?> payload) {
        if (condition == null || condition.isBlank()) {
            return true;
        }
        try {
            return parseAndEvaluate(condition.trim(), payload == null ? Map.of() : payload);
        } catch (RuntimeException e) {
            return false;
        }
    }

    /**
     * Evaluate conditions as a conjunction. An empty list matches.
     */
    public boolean evaluateAll(List<String> conditions, Map<String, ?> payload) {
        if (conditions == null) {
            return true;
        }
        for (String condition : conditions) {
            if (!evaluate(condition, payload)) {
                return false;
            }
        }
        return true;
    }

    private boolean parseAndEvaluate(String condition, Map<String, ?> payload) {
        String operator = null;
        int at = -1;
        // Leftmost operator wins; two-character operators are listed first so they win ties
        for (String candidate : OPERATORS) {
            int index = condition.indexOf(candidate);
            if (index > 0 && (operator == null || index < at)) {
                operator = candidate;
                at = index;
            }
        }
        if (operator == null) {
            return false;
        }

        String fieldPath = condition.substring(0, at).trim();
        String expectedRaw = condition.substring(at + operator.length()).trim();
        if (fieldPath.isEmpty() || expectedRaw.isEmpty()) {
            return false;
        }

        Object actual = resolveField(fieldPath, payload);
        if (actual == null) {
            return false;
        }
        return compare(actual, parseValue(expectedRaw), operator);
    }

    /**
     * Resolve a dotted path such as "location.zone" against nested maps.
     */
    Object resolveField(String fieldPath, Map<String, ?> payload) {
        String path = fieldPath;
        for (String prefix : ROOT_PREFIXES) {
            if (path.startsWith(prefix) && !payload.containsKey(prefix.substring(0, prefix.length() - 1))) {
                path = path.substring(prefix.length());
                break;
            }
        }

        Object current = payload;
        for (String key : path.split("\\.")) {
            if (current instanceof Map<?, ?> map) {
                current = map.get(key);
            } else {
                return null;
            }
        }
        return current;
    }

    private Object parseValue(String raw) {
        if ((raw.startsWith("'") && raw.endsWith("'") && raw.length() >= 2)
                || (raw.startsWith("\"") && raw.endsWith("\"") && raw.length() >= 2)) {
            return raw.substring(1, raw.length() - 1);
        }
        if ("true".equalsIgnoreCase(raw)) return true;
        if ("false".equalsIgnoreCase(raw)) return false;
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            return raw;
        }
    }

    private boolean compare(Object actual, Object expected, String operator) {
        return switch (operator) {
            case "==" -> valuesEqual(actual, expected);
            case "!=" -> !valuesEqual(actual, expected);
            default -> compareNumeric(actual, expected, operator);
        };
    }

    private boolean valuesEqual(Object actual, Object expected) {
        Double a = asNumber(actual);
        Double e = asNumber(expected);
        if (a != null && e != null) {
            return a.doubleValue() == e.doubleValue();
        }
        return actual.toString().equalsIgnoreCase(expected.toString());
    }

    private boolean compareNumeric(Object actual, Object expected, String operator) {
        Double a = asNumber(actual);
        Double e = asNumber(expected);
        if (a == null || e == null) {
            return false;
        }
        return switch (operator) {
            case ">" -> a > e;
            case ">=" -> a >= e;
            case "<" -> a < e;
            case "<=" -> a <= e;
            default -> false;
        };
    }

    private static Double asNumber(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Boolean) {
            return null;
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
