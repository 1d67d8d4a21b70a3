package com.phillippitts.axiom.service.policy;

import java.util.Map;

/**
 * Rejects control characters in user input ({@code invalid_characters}). Tabs and line
 * breaks are allowed.
 */
public class CharacterSetValidator implements Validator {

    public static final String RULE = "invalid_characters";

    @Override
    public Map<String, String> validate(String text, Direction direction) {
        if (direction != Direction.INPUT) {
            return Map.of();
        }
        long count = text.codePoints()
                .filter(cp -> Character.isISOControl(cp) && cp != '\t' && cp != '\n' && cp != '\r')
                .count();
        return count == 0 ? Map.of() : Map.of(RULE, count + " control character(s) not allowed");
    }
}
