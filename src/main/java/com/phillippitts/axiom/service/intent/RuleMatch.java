package com.phillippitts.axiom.service.intent;

import java.util.Map;

/**
 * Result of one {@link IntentMatcher} hit.
 *
 * @param confidence 0.0 to 1.0
 * @param entities   values captured by the rule (for example named regex groups)
 */
public record RuleMatch(double confidence, Map<String, String> entities) {

    public RuleMatch {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        entities = entities == null ? Map.of() : Map.copyOf(entities);
    }

    /**
     * Confidence for a contiguous match: the share of the text it covers, discounted when the
     * match does not start the text.
     */
    static RuleMatch positional(int start, int end, int textLength, Map<String, String> entities) {
        if (textLength == 0) {
            return new RuleMatch(0.0, entities);
        }
        double coverage = (double) (end - start) / textLength;
        double positionFactor = start == 0 ? 1.0 : 0.8;
        return new RuleMatch(Math.min(1.0, coverage * positionFactor), entities);
    }
}
