package com.phillippitts.axiom.service.policy;

import java.util.Map;

/**
 * One policy rule applied to user input or assistant output.
 *
 * <p>Implementations must be deterministic for a given text and direction, must not throw
 * for any text, and must not echo the offending text in violation details.
 */
@FunctionalInterface
public interface Validator {

    /**
     * @return rule name to detail for every problem found; empty when the text is acceptable
     */
    Map<String, String> validate(String text, Direction direction);
}
