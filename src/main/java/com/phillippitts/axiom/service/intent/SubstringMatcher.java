package com.phillippitts.axiom.service.intent;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Matches when the text contains a literal phrase.
 */
public final class SubstringMatcher implements IntentMatcher {

    private final String phrase;

    public SubstringMatcher(String phrase) {
        if (phrase == null || phrase.isBlank()) {
            throw new IllegalArgumentException("phrase must not be blank");
        }
        this.phrase = phrase.toLowerCase(Locale.ROOT);
    }

    @Override
    public Optional<RuleMatch> match(String normalizedText) {
        int index = normalizedText.indexOf(phrase);
        if (index < 0) {
            return Optional.empty();
        }
        return Optional.of(RuleMatch.positional(index, index + phrase.length(), normalizedText.length(), Map.of()));
    }

    @Override
    public String toString() {
        return "substring:" + phrase;
    }
}
