package com.phillippitts.axiom.service.orchestration;

import com.phillippitts.axiom.domain.TurnState;

/**
 * Progress of one running turn, shared between the turn thread and cancellation requests.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * RECEIVED → INPUT_VALIDATED → INTENT_DETECTED → CONTEXT_UPDATED → RESPONSE_GENERATED
 *          → OUTPUT_VALIDATED → PUBLISHED
 * </pre>
 * Terminal states are not tracked here; the turn is removed from the in-flight table instead.
 */
final class InFlightTurn {

    private final String turnId;
    private final String sessionId;
    private TurnState state = TurnState.RECEIVED;
    private boolean cancelled;

    InFlightTurn(String turnId, String sessionId) {
        this.turnId = turnId;
        this.sessionId = sessionId;
    }

    String turnId() {
        return turnId;
    }

    String sessionId() {
        return sessionId;
    }

    synchronized TurnState state() {
        return state;
    }

    synchronized boolean isCancelled() {
        return cancelled;
    }

    /**
     * Moves to {@code next} unless cancellation was granted.
     *
     * @return {@code false} if the turn must stop
     */
    synchronized boolean advance(TurnState next) {
        if (next.ordinal() <= state.ordinal()) {
            throw new IllegalStateException("Turn " + turnId + " cannot move from " + state + " to " + next);
        }
        if (cancelled) {
            return false;
        }
        state = next;
        return true;
    }

    synchronized CancellationResult requestCancel() {
        if (cancelled) {
            return CancellationResult.CANCELLED;
        }
        if (!state.isCancellable()) {
            return CancellationResult.REJECTED;
        }
        cancelled = true;
        return CancellationResult.CANCELLED;
    }
}
