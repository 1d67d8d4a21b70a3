package com.phillippitts.axiom.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What {@code submitTurn} returns to the caller.
 *
 * @param turnId         id of the turn, also the correlation id of its events
 * @param status         COMPLETE, DEGRADED or FAILED
 * @param responseText   text to show the user; a denial or apology when FAILED
 * @param intent         detected intent, {@code null} when detection did not run
 * @param violations     policy violations behind a denial or substitution, empty otherwise
 * @param failureKind    reason for DEGRADED or FAILED, {@code null} when COMPLETE
 * @param sequenceNumber sequence number of the committed turn, {@code null} if none was committed
 * @param finalState     terminal state reached
 * @param details        free-form diagnostics (for example {@code persisted})
 */
public record TurnOutcome(
        String turnId,
        TurnStatus status,
        String responseText,
        Intent intent,
        Map<String, String> violations,
        FailureKind failureKind,
        Long sequenceNumber,
        TurnState finalState,
        Map<String, Object> details
) {

    public TurnOutcome {
        Objects.requireNonNull(turnId, "turnId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(responseText, "responseText must not be null");
        Objects.requireNonNull(finalState, "finalState must not be null");
        if (!finalState.isTerminal()) {
            throw new IllegalArgumentException("finalState must be terminal, got: " + finalState);
        }
        if ((status == TurnStatus.COMPLETE) != (failureKind == null)) {
            throw new IllegalArgumentException("failureKind must be set exactly when status is not COMPLETE");
        }
        violations = violations == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(violations));
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public boolean isFailed() {
        return status == TurnStatus.FAILED;
    }
}
