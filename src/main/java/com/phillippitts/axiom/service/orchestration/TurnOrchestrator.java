package com.phillippitts.axiom.service.orchestration;

import com.phillippitts.axiom.domain.TurnOutcome;

import java.time.Duration;

/**
 * Drives one user turn through input validation, intent detection, context update, response
 * generation, output validation and publication.
 *
 * <p><b>Concurrency:</b> turns of the same session run one at a time in submission order of
 * lock acquisition; turns of different sessions run in parallel.
 *
 * <p><b>Outcomes:</b> {@code submitTurn} never throws for pipeline failures. Policy denials,
 * system errors, timeouts and cancellations are reported through {@link TurnOutcome}.
 * A turn that fails before committing leaves no trace in its session context.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * TurnOutcome outcome = orchestrator.submitTurn("session-1", "hello");
 * if (outcome.status() == TurnStatus.COMPLETE) {
 *     display(outcome.responseText());
 * }
 * }</pre>
 */
public interface TurnOrchestrator {

    /**
     * Processes a turn with the configured turn timeout and waits for its outcome.
     *
     * @throws IllegalArgumentException if {@code sessionId} is blank
     */
    TurnOutcome submitTurn(String sessionId, String text);

    /**
     * Processes a turn bounded by {@code timeout} and waits for its outcome.
     */
    TurnOutcome submitTurn(String sessionId, String text, Duration timeout);

    /**
     * Queues a turn and returns immediately. The timeout starts counting now, so time spent
     * queued or waiting for the session lock is part of the budget.
     */
    TurnHandle submitTurnAsync(String sessionId, String text, Duration timeout);

    /**
     * Requests cancellation of an in-flight turn. Honoured only before the turn updates its
     * session context.
     */
    CancellationResult cancel(String turnId);

    /**
     * Discards the session's context and announces it on {@code state.updated}. A turn of the
     * session that is still running finishes first.
     *
     * @return {@code true} if the session was active
     */
    boolean endSession(String sessionId);

    /**
     * Ends every session idle for longer than {@code idleTimeout}.
     *
     * @return number of sessions ended
     */
    int endIdleSessions(Duration idleTimeout);

    int inFlightCount();
}
