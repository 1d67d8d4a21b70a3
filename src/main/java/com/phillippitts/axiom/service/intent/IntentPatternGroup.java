package com.phillippitts.axiom.service.intent;

import java.util.List;
import java.util.Objects;

/**
 * All match rules for one intent name. Groups are evaluated in registration order, which
 * also decides confidence ties.
 *
 * @param intentName intent produced when any rule matches
 * @param matchers   one or more rules; the best-scoring one sets the group's confidence
 */
public record IntentPatternGroup(String intentName, List<IntentMatcher> matchers) {

    public IntentPatternGroup {
        if (intentName == null || intentName.isBlank()) {
            throw new IllegalArgumentException("intentName must not be blank");
        }
        Objects.requireNonNull(matchers, "matchers must not be null");
        if (matchers.isEmpty()) {
            throw new IllegalArgumentException("Pattern group '" + intentName + "' needs at least one matcher");
        }
        matchers = List.copyOf(matchers);
    }

    public static IntentPatternGroup of(String intentName, IntentMatcher... matchers) {
        return new IntentPatternGroup(intentName, List.of(matchers));
    }
}
