package com.phillippitts.axiom.domain;

import java.util.regex.Pattern;

/**
 * Built-in bus topics and the topic naming rule.
 *
 * <p>Topic names are dot-namespaced lowercase segments, for example {@code conversation.turn}.
 */
public final class Topics {

    public static final String SYSTEM_START = "system.start";
    public static final String SYSTEM_SHUTDOWN = "system.shutdown";
    public static final String CONVERSATION_TURN = "conversation.turn";
    public static final String STATE_UPDATED = "state.updated";

    private static final Pattern TOPIC_NAME = Pattern.compile("[a-z][a-z0-9_]*(\\.[a-z][a-z0-9_]*)+");

    private Topics() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static boolean isValidName(String topic) {
        return topic != null && TOPIC_NAME.matcher(topic).matches();
    }
}
