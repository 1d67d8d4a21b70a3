/**
 * Service layer: the turn pipeline and the components it coordinates.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code service.bus} - in-process topic bus with per-subscriber FIFO delivery</li>
 *   <li>{@code service.policy} - input and output validators and the engine that runs them</li>
 *   <li>{@code service.intent} - rule-based intent detection</li>
 *   <li>{@code service.context} - bounded per-session history and slots</li>
 *   <li>{@code service.response} - template and backend response strategies</li>
 *   <li>{@code service.store} - durable, idempotent persistence of turns and events</li>
 *   <li>{@code service.orchestration} - the per-turn state machine</li>
 *   <li>{@code service.health}, {@code service.metrics}, {@code service.events},
 *       {@code service.lifecycle} - operational concerns</li>
 * </ul>
 */
package com.phillippitts.axiom.service;
