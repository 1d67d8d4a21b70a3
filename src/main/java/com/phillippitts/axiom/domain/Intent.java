package com.phillippitts.axiom.domain;

import java.util.Map;
import java.util.Objects;

/**
 * A detected user intent.
 *
 * @param name       intent name, for example {@code greeting} or {@code time.query}
 * @param confidence confidence between 0.0 and 1.0
 * @param entities   extracted slot values, never {@code null}
 */
public record Intent(String name, double confidence, Map<String, String> entities) {

    public static final String FALLBACK = "fallback";

    private static final Intent FALLBACK_INTENT = new Intent(FALLBACK, 0.0, Map.of());

    public Intent {
        Objects.requireNonNull(name, "Intent name must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        entities = entities == null ? Map.of() : Map.copyOf(entities);
    }

    public static Intent of(String name, double confidence) {
        return new Intent(name, confidence, Map.of());
    }

    /**
     * Returns the zero-confidence intent meaning "no match".
     */
    public static Intent fallback() {
        return FALLBACK_INTENT;
    }

    public boolean isFallback() {
        return FALLBACK.equals(name);
    }
}
