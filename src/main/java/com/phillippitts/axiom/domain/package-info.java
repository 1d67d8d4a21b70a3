/**
 * Domain models for conversational turns.
 *
 * <p>Everything here is an immutable record except
 * {@link com.phillippitts.axiom.domain.SessionContext}, the long-lived per-session state
 * that only the turn orchestrator mutates.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.axiom.domain.Event} - message carried by the event bus</li>
 *   <li>{@link com.phillippitts.axiom.domain.ConversationTurn} - one completed exchange</li>
 *   <li>{@link com.phillippitts.axiom.domain.Intent} - detected intent with confidence and entities</li>
 *   <li>{@link com.phillippitts.axiom.domain.PolicyResult} - aggregated validator verdict</li>
 *   <li>{@link com.phillippitts.axiom.domain.TurnOutcome} - what the caller receives</li>
 * </ul>
 */
package com.phillippitts.axiom.domain;
