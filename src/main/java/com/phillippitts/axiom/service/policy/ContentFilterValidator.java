package com.phillippitts.axiom.service.policy;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Blocks configured words in either direction ({@code blocked_content}). Matching is
 * whole-word and case-insensitive; the detail reports how many distinct words matched.
 */
public class ContentFilterValidator implements Validator {

    public static final String RULE = "blocked_content";

    private final List<Pattern> bannedWords;

    public ContentFilterValidator(Collection<String> bannedWords) {
        this.bannedWords = new TreeSet<>(bannedWords.stream()
                .filter(w -> w != null && !w.isBlank())
                .map(w -> w.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet()))
                .stream()
                .map(w -> Pattern.compile("\\b" + Pattern.quote(w) + "\\b", Pattern.CASE_INSENSITIVE))
                .toList();
    }

    @Override
    public Map<String, String> validate(String text, Direction direction) {
        long hits = bannedWords.stream().filter(p -> p.matcher(text).find()).count();
        if (hits == 0) {
            return Map.of();
        }
        return Map.of(RULE, hits + " blocked term(s) found in " + direction.name().toLowerCase(Locale.ROOT));
    }
}
