/**
 * Turn orchestration: one user utterance in, one outcome out.
 *
 * <p>{@link com.phillippitts.axiom.service.orchestration.DefaultTurnOrchestrator} drives each
 * turn through {@code RECEIVED -> INPUT_VALIDATED -> INTENT_DETECTED -> CONTEXT_UPDATED ->
 * RESPONSE_GENERATED -> OUTPUT_VALIDATED -> PUBLISHED -> COMPLETE}, with {@code DEGRADED} and {@code FAILED}
 * as the other terminal states.
 *
 * <p>Guarantees:
 * <ul>
 *   <li>Turns of one session run one at a time, in submission order
 *       ({@link com.phillippitts.axiom.service.orchestration.SessionLockRegistry}); sessions run
 *       in parallel on the turn executor</li>
 *   <li>Slots written at {@code CONTEXT_UPDATED} are restored if the turn later fails or times
 *       out; history is appended only at commit</li>
 *   <li>Cancellation is honoured only before {@code CONTEXT_UPDATED}</li>
 *   <li>The {@code conversation.turn} event is published before the history append, so durable
 *       sequence numbers have no gaps</li>
 * </ul>
 *
 * @see com.phillippitts.axiom.domain.TurnState
 */
package com.phillippitts.axiom.service.orchestration;
