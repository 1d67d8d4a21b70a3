package com.phillippitts.axiom.service.intent;

import java.util.Arrays;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Matches when any whole word of the text is in a keyword set. Confidence is the share of
 * the text's words that are keywords.
 */
public final class KeywordMatcher implements IntentMatcher {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}']+");

    private final Set<String> keywords;

    public KeywordMatcher(Collection<String> keywords) {
        this.keywords = keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        if (this.keywords.isEmpty()) {
            throw new IllegalArgumentException("keywords must not be empty");
        }
    }

    @Override
    public Optional<RuleMatch> match(String normalizedText) {
        String[] tokens = Arrays.stream(NON_WORD.split(normalizedText))
                .filter(t -> !t.isEmpty())
                .toArray(String[]::new);
        if (tokens.length == 0) {
            return Optional.empty();
        }
        long hits = Arrays.stream(tokens).filter(keywords::contains).count();
        if (hits == 0) {
            return Optional.empty();
        }
        return Optional.of(new RuleMatch((double) hits / tokens.length, Map.of()));
    }

    @Override
    public String toString() {
        return "keywords:" + keywords;
    }
}
