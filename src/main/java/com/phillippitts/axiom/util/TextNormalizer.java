package com.phillippitts.axiom.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes user text before intent detection: trims, collapses runs of whitespace and
 * lower-cases with {@link Locale#ROOT}.
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }
}
