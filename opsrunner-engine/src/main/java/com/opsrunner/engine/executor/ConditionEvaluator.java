package com.opsrunner.engine.executor;

import java.util.Comparator;
import java.util.Locale;
import java.util.Map;

/**
 * Evaluates step conditions against a run's variables.
 *
 * A condition containing {@code $} has every {@code $name} occurrence
 * replaced by the variable's value and passes only if the result equals
 * {@code "true"} ignoring case. A condition without {@code $} always passes.
 * Unknown names are left in place, so the condition fails.
 */
public class ConditionEvaluator {

    private static final String MARKER = "$";

    public boolean evaluate(String condition, Map<String, String> variables) {
        if (condition == null || !condition.contains(MARKER)) {
            return true;
        }
        return substitute(condition, variables).toLowerCase(Locale.ROOT).equals("true");
    }

    /**
     * Replace {@code $name} references. Longer names go first so that
     * {@code $flag} never eats the prefix of {@code $flag_enabled}.
     */
    String substitute(String condition, Map<String, String> variables) {
        String result = condition;
        var names = variables.keySet().stream()
            .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
            .toList();
        for (String name : names) {
            String value = variables.get(name);
            result = result.replace(MARKER + name, value == null ? "" : value);
        }
        return result;
    }
}
