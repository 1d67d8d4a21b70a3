package com.phillippitts.axiom.service.intent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches a case-insensitive regular expression. Named groups that participate in the match
 * become entities, so {@code (?<role>nurse|doctor)} yields {@code role=nurse}.
 */
public final class RegexMatcher implements IntentMatcher {

    private static final Pattern GROUP_NAME = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    private final Pattern pattern;
    private final List<String> groupNames;

    public RegexMatcher(String regex) {
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        Matcher names = GROUP_NAME.matcher(regex);
        List<String> found = new ArrayList<>();
        while (names.find()) {
            found.add(names.group(1));
        }
        this.groupNames = List.copyOf(found);
    }

    @Override
    public Optional<RuleMatch> match(String normalizedText) {
        Matcher m = pattern.matcher(normalizedText);
        if (!m.find() || m.end() == m.start()) {
            return Optional.empty();
        }
        Map<String, String> entities = new LinkedHashMap<>();
        for (String name : groupNames) {
            String value = m.group(name);
            if (value != null) {
                entities.put(name, value);
            }
        }
        return Optional.of(RuleMatch.positional(m.start(), m.end(), normalizedText.length(), entities));
    }

    @Override
    public String toString() {
        return "regex:" + pattern.pattern();
    }
}
