/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.phillippitts.axiom.exception.AxiomException}, which carries an
 * {@link com.phillippitts.axiom.exception.ErrorCode} so logs, REST errors and
 * turn outcomes share one vocabulary.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.axiom.exception.UnregisteredTopicException} - publish to a topic
 *       with no registered publisher</li>
 *   <li>{@link com.phillippitts.axiom.exception.EventValidationException} - malformed event or topic</li>
 *   <li>{@link com.phillippitts.axiom.exception.EventBusShutdownException} - bus no longer accepting work</li>
 *   <li>{@link com.phillippitts.axiom.exception.StorageException} - durable store read/write failure</li>
 *   <li>{@link com.phillippitts.axiom.exception.ContextStoreException} - session context unavailable</li>
 *   <li>{@link com.phillippitts.axiom.exception.BackendUnavailableException} - generation backend failure</li>
 *   <li>{@link com.phillippitts.axiom.exception.TurnTimeoutException} - bounded wait exceeded inside a turn</li>
 * </ul>
 *
 * <p>Policy violations are not exceptions: they are typed results consumed by the turn
 * state machine.
 *
 * @see com.phillippitts.axiom.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.axiom.exception;
