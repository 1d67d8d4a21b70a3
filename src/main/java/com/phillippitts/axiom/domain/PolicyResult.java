package com.phillippitts.axiom.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of running the full validator chain over one piece of text.
 *
 * @param passed     {@code true} exactly when there are no violations
 * @param violations rule name to detail, in validator registration order
 */
public record PolicyResult(boolean passed, Map<String, String> violations) {

    private static final PolicyResult PASS = new PolicyResult(true, Map.of());

    public PolicyResult {
        violations = violations == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(violations));
        if (passed != violations.isEmpty()) {
            throw new IllegalArgumentException("passed must be true exactly when there are no violations");
        }
    }

    public static PolicyResult pass() {
        return PASS;
    }

    public static PolicyResult of(Map<String, String> violations) {
        return violations == null || violations.isEmpty() ? PASS : new PolicyResult(false, violations);
    }

    public boolean hasViolation(String rule) {
        return violations.containsKey(rule);
    }
}
