/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Presentation depends on service but not vice versa. Controllers are thin adapters over
 * {@link com.phillippitts.axiom.service.orchestration.TurnOrchestrator} and
 * {@link com.phillippitts.axiom.service.store.DurableStore}.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - turn submission, history, cancellation, ping</li>
 *   <li>{@code presentation.exception} - maps exceptions to {@code ApiError} responses</li>
 * </ul>
 */
package com.phillippitts.axiom.presentation;
