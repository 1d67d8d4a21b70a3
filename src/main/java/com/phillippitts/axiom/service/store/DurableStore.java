package com.phillippitts.axiom.service.store;

import com.phillippitts.axiom.domain.ConversationTurn;
import com.phillippitts.axiom.domain.Event;

import java.time.Instant;
import java.util.List;

/**
 * Append/query storage for completed turns and system events.
 *
 * <p>Writes are idempotent: a turn is keyed by ({@code sessionId}, {@code sequenceNumber}) and
 * an event by its id, and writing the same key twice keeps the first record. All methods
 * throw {@link com.phillippitts.axiom.exception.StorageException} when the store fails and
 * may be called concurrently.
 */
public interface DurableStore {

    /**
     * @return {@code true} if a new record was written, {@code false} if it already existed
     */
    boolean persist(ConversationTurn turn);

    /**
     * @return up to {@code limit} turns of the session, most recent first
     */
    List<ConversationTurn> query(String sessionId, int limit);

    /**
     * @return highest stored sequence number for the session, {@code 0} if none
     */
    long latestSequenceNumber(String sessionId);

    boolean persistEvent(Event event);

    /**
     * @return up to {@code limit} events of the topic, most recent first
     */
    List<Event> queryEvents(String topic, int limit);

    /**
     * Deletes turns and events created before {@code cutoff}.
     *
     * @return number of deleted records
     */
    int purgeOlderThan(Instant cutoff);

    /**
     * Cheap round trip used by health checks.
     */
    boolean isAvailable();
}
