package com.phillippitts.axiom.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One completed request/response exchange within a session.
 *
 * <p>Created once per completed pipeline run and never modified. The pair
 * ({@code sessionId}, {@code sequenceNumber}) identifies the turn in the durable store.
 *
 * @param sessionId            owning session
 * @param sequenceNumber       1-based, gap-free per session
 * @param userInput            the text the user submitted
 * @param detectedIntent       intent name, {@code null} when detection did not run
 * @param assistantResponse    the text returned to the user
 * @param createdAt            completion time
 * @param processingDurationMs pipeline duration in milliseconds
 * @param metadata             free-form details (turn id, status, strategy, ...)
 */
public record ConversationTurn(
        String sessionId,
        long sequenceNumber,
        String userInput,
        String detectedIntent,
        String assistantResponse,
        Instant createdAt,
        long processingDurationMs,
        Map<String, Object> metadata
) {

    public ConversationTurn {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        if (sequenceNumber < 1) {
            throw new IllegalArgumentException("sequenceNumber must be >= 1, got: " + sequenceNumber);
        }
        Objects.requireNonNull(userInput, "userInput must not be null");
        Objects.requireNonNull(assistantResponse, "assistantResponse must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        if (processingDurationMs < 0) {
            throw new IllegalArgumentException("processingDurationMs must be >= 0, got: " + processingDurationMs);
        }
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ConversationTurn of(String sessionId, long sequenceNumber, String userInput,
                                      String detectedIntent, String assistantResponse) {
        return new ConversationTurn(sessionId, sequenceNumber, userInput, detectedIntent,
                assistantResponse, Instant.now(), 0L, Map.of());
    }
}
