package com.phillippitts.axiom.domain;

/**
 * States of a single turn. A turn is in state {@code S} once stage {@code S} has completed;
 * {@link #COMPLETE}, {@link #DEGRADED} and {@link #FAILED} are terminal.
 */
public enum TurnState {
    RECEIVED,
    INPUT_VALIDATED,
    INTENT_DETECTED,
    CONTEXT_UPDATED,
    RESPONSE_GENERATED,
    OUTPUT_VALIDATED,
    PUBLISHED,
    COMPLETE,
    DEGRADED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == DEGRADED || this == FAILED;
    }

    /**
     * Cancellation is honoured only before the context update becomes observable.
     */
    public boolean isCancellable() {
        return ordinal() < CONTEXT_UPDATED.ordinal();
    }
}
