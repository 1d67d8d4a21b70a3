package com.phillippitts.axiom.service.store;

import com.phillippitts.axiom.domain.ConversationTurn;
import com.phillippitts.axiom.domain.Event;
import com.phillippitts.axiom.exception.EventValidationException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload layout of {@code conversation.turn} events and its conversion to and from
 * {@link ConversationTurn}.
 */
public final class TurnEventPayload {

    public static final String SESSION_ID = "sessionId";
    public static final String SEQUENCE_NUMBER = "sequenceNumber";
    public static final String USER_INPUT = "userInput";
    public static final String ASSISTANT_RESPONSE = "assistantResponse";
    public static final String DETECTED_INTENT = "detectedIntent";
    public static final String CONFIDENCE = "confidence";
    public static final String STATUS = "status";
    public static final String PROCESSING_DURATION_MS = "processingDurationMs";
    public static final String COMPLETED_AT = "completedAt";
    public static final String METADATA = "metadata";

    private TurnEventPayload() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Builds the event payload for a committed turn.
     */
    public static Map<String, Object> of(ConversationTurn turn, double confidence, String status) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(SESSION_ID, turn.sessionId());
        payload.put(SEQUENCE_NUMBER, turn.sequenceNumber());
        payload.put(USER_INPUT, turn.userInput());
        payload.put(ASSISTANT_RESPONSE, turn.assistantResponse());
        payload.put(DETECTED_INTENT, turn.detectedIntent());
        payload.put(CONFIDENCE, confidence);
        payload.put(STATUS, status);
        payload.put(PROCESSING_DURATION_MS, turn.processingDurationMs());
        payload.put(COMPLETED_AT, turn.createdAt().toString());
        payload.put(METADATA, turn.metadata());
        return payload;
    }

    /**
     * Rebuilds the turn carried by a {@code conversation.turn} event.
     *
     * @throws EventValidationException if required fields are missing or malformed
     */
    public static ConversationTurn toTurn(Event event) {
        Map<String, Object> p = event.payload();
        try {
            Object completedAt = p.get(COMPLETED_AT);
            return new ConversationTurn(
                    (String) require(p, SESSION_ID),
                    ((Number) require(p, SEQUENCE_NUMBER)).longValue(),
                    (String) require(p, USER_INPUT),
                    (String) p.get(DETECTED_INTENT),
                    (String) require(p, ASSISTANT_RESPONSE),
                    completedAt == null ? event.createdAt() : Instant.parse(completedAt.toString()),
                    p.get(PROCESSING_DURATION_MS) instanceof Number n ? n.longValue() : 0L,
                    metadata(p.get(METADATA)));
        } catch (ClassCastException | IllegalArgumentException | DateTimeParseException e) {
            throw new EventValidationException("Malformed conversation.turn payload in event " + event.id(), e);
        }
    }

    private static Object require(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value == null) {
            throw new EventValidationException("conversation.turn payload is missing '" + key + "'");
        }
        return value;
    }

    /**
     * Copies the metadata map, turning keys into strings so a payload from any publisher yields
     * a well-typed map.
     */
    private static Map<String, Object> metadata(Object value) {
        if (!(value instanceof Map<?, ?> m)) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        m.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }
}
