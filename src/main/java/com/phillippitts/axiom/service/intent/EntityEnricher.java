package com.phillippitts.axiom.service.intent;

import java.util.Map;

/**
 * Adds entities that do not come from the text itself (clock values, defaults).
 */
@FunctionalInterface
public interface EntityEnricher {

    EntityEnricher NONE = (intentName, text) -> Map.of();

    Map<String, String> enrich(String intentName, String normalizedText);
}
