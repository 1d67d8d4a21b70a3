package com.phillippitts.axiom.service.context;

/**
 * Names of the session slots written by the turn orchestrator and read by response
 * strategies.
 */
public final class ContextSlots {

    /** Name of the intent detected in the latest turn. */
    public static final String LAST_INTENT = "last_intent";
    /** Entities of the latest intent, as a {@code Map<String, String>}. */
    public static final String LAST_ENTITIES = "last_entities";
    /** The user text of the turn in progress (then of the latest turn). */
    public static final String LAST_USER_INPUT = "last_user_input";
    /** Number of turns committed in this session. */
    public static final String TURN_COUNT = "turn_count";

    private static final String LAST_VARIANT_PREFIX = "last_variant.";

    private ContextSlots() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Slot holding the template variant index last used for {@code intentName}.
     */
    public static String lastVariant(String intentName) {
        return LAST_VARIANT_PREFIX + intentName;
    }
}
