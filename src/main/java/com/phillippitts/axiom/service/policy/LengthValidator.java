package com.phillippitts.axiom.service.policy;

import java.util.Map;

/**
 * Rejects input or output longer than its configured limit ({@code length_exceeded}).
 */
public class LengthValidator implements Validator {

    public static final String RULE = "length_exceeded";

    private final int maxInputLength;
    private final int maxOutputLength;

    public LengthValidator(int maxInputLength, int maxOutputLength) {
        if (maxInputLength < 1 || maxOutputLength < 1) {
            throw new IllegalArgumentException("Length limits must be positive");
        }
        this.maxInputLength = maxInputLength;
        this.maxOutputLength = maxOutputLength;
    }

    @Override
    public Map<String, String> validate(String text, Direction direction) {
        int limit = direction == Direction.INPUT ? maxInputLength : maxOutputLength;
        if (text.length() > limit) {
            return Map.of(RULE, "length " + text.length() + " exceeds limit " + limit);
        }
        return Map.of();
    }
}
