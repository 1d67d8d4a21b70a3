package com.phillippitts.axiom.service.policy;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Base for validators that report one rule when any of a fixed list of patterns is found.
 * Only the first matching pattern is reported; the detail names the pattern index, never
 * the matched text.
 */
abstract class PatternValidator implements Validator {

    private final String rule;
    private final String description;
    private final List<Pattern> patterns;
    private final Set<Direction> directions;

    PatternValidator(String rule, String description, List<Pattern> patterns, Set<Direction> directions) {
        this.rule = Objects.requireNonNull(rule);
        this.description = Objects.requireNonNull(description);
        this.patterns = List.copyOf(patterns);
        this.directions = Set.copyOf(directions);
    }

    @Override
    public Map<String, String> validate(String text, Direction direction) {
        if (!directions.contains(direction)) {
            return Map.of();
        }
        for (int i = 0; i < patterns.size(); i++) {
            if (patterns.get(i).matcher(text).find()) {
                return Map.of(rule, description + " (pattern " + (i + 1) + ")");
            }
        }
        return Map.of();
    }

    static Pattern ci(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }
}
