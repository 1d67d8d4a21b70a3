package com.phillippitts.axiom.service.orchestration;

import com.phillippitts.axiom.domain.TurnOutcome;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A submitted turn: its id (usable with {@link TurnOrchestrator#cancel}) and its eventual outcome.
 * The future always completes normally.
 */
public record TurnHandle(String turnId, CompletableFuture<TurnOutcome> outcome) {

    public TurnHandle {
        Objects.requireNonNull(turnId, "turnId must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
    }
}
