package com.phillippitts.axiom.service.intent;

import com.phillippitts.axiom.domain.Intent;

import java.util.List;

/**
 * Maps normalized user text to ranked candidate intents.
 */
public interface IntentDetector {

    /**
     * Never throws. Returns candidates by descending confidence with ties in registration
     * order, or a single {@link Intent#fallback()} when nothing reaches the threshold.
     */
    List<Intent> detect(String normalizedText);

    /**
     * Convenience for the top-ranked candidate.
     */
    default Intent detectBest(String normalizedText) {
        return detect(normalizedText).get(0);
    }
}
