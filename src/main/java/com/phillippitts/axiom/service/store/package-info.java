/**
 * Durable persistence of turns and events.
 *
 * <p>Writes are idempotent on {@code (session_id, sequence_number)} for turns and on the event id
 * for events, so retries never duplicate a record. Subscribers on the event bus feed the store;
 * {@link com.phillippitts.axiom.service.store.PersistenceTracker} lets a turn optionally wait
 * for its own write.
 */
package com.phillippitts.axiom.service.store;
