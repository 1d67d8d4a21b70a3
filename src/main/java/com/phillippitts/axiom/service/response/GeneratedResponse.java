package com.phillippitts.axiom.service.response;

import java.util.Objects;

/**
 * Text produced for a turn, with where it came from.
 *
 * @param text         response text
 * @param intentName   intent whose strategy produced the text (may be {@code fallback})
 * @param strategy     strategy name, for metadata and metrics
 * @param variantIndex template variant used, or {@code -1} when not template-based
 */
public record GeneratedResponse(String text, String intentName, String strategy, int variantIndex) {

    public GeneratedResponse {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(intentName, "intentName must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
    }

    public boolean hasVariant() {
        return variantIndex >= 0;
    }
}
