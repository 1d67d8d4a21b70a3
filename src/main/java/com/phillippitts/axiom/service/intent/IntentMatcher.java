package com.phillippitts.axiom.service.intent;

import java.util.Optional;

/**
 * A single match rule inside an intent's pattern group.
 */
@FunctionalInterface
public interface IntentMatcher {

    /**
     * @param normalizedText trimmed, whitespace-collapsed, lower-case text
     * @return the match with its confidence, or empty when the rule does not apply
     */
    Optional<RuleMatch> match(String normalizedText);
}
