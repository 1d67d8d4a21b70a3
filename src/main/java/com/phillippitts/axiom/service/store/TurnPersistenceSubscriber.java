package com.phillippitts.axiom.service.store;

import com.phillippitts.axiom.domain.ConversationTurn;
import com.phillippitts.axiom.domain.Event;
import com.phillippitts.axiom.domain.Topics;
import com.phillippitts.axiom.exception.EventValidationException;
import com.phillippitts.axiom.exception.StorageException;
import com.phillippitts.axiom.exception.TurnConflictException;
import com.phillippitts.axiom.service.bus.EventBus;
import com.phillippitts.axiom.service.bus.EventCodec;
import com.phillippitts.axiom.service.bus.EventHandler;
import com.phillippitts.axiom.service.metrics.TurnMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Objects;

/**
 * Writes every {@code conversation.turn} event to the {@link DurableStore}.
 *
 * <p>The bus delivers at least once and does not retry, so this subscriber owns retries:
 * transient {@link StorageException}s are retried by the {@link RetryPolicy}, and the
 * store's idempotent write makes redelivery and retry safe. A write that still fails is
 * logged, counted and announced as a {@link PersistenceFailedEvent}; it never reaches the
 * user. A {@link TurnConflictException} is reported the same way without retrying.
 */
public class TurnPersistenceSubscriber implements EventHandler {

    private static final Logger LOG = LogManager.getLogger(TurnPersistenceSubscriber.class);

    private static final String KIND = "turn";

    private final DurableStore store;
    private final RetryPolicy retryPolicy;
    private final PersistenceTracker tracker;
    private final ApplicationEventPublisher publisher;
    private final TurnMetrics metrics;

    public TurnPersistenceSubscriber(DurableStore store, RetryPolicy retryPolicy, PersistenceTracker tracker,
                                     ApplicationEventPublisher publisher, TurnMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    public void attach(EventBus bus) {
        bus.subscribe(Topics.CONVERSATION_TURN, this);
    }

    @Override
    public void handle(Event event) {
        ConversationTurn turn;
        try {
            turn = TurnEventPayload.toTurn(event);
        } catch (EventValidationException e) {
            LOG.error("Discarding unreadable turn event {}: {}", event.id(), e.getMessage());
            tracker.acknowledge(event.correlationId(), false);
            return;
        }

        String key = turn.sessionId() + "#" + turn.sequenceNumber();
        try {
            boolean inserted = retryPolicy.execute("Persist turn " + key,
                    () -> store.persist(turn),
                    attempt -> metrics.incrementPersistenceRetry(KIND));
            LOG.debug("Turn {} {}", key, inserted ? "stored" : "already stored");
            tracker.acknowledge(event.correlationId(), true);
        } catch (StorageException e) {
            LOG.error("Giving up on turn {} after {} attempts; unstored event: {}", key, retryPolicy.maxAttempts(),
                    EventCodec.toLogString(event), e);
            reportFailure(event, key, retryPolicy.maxAttempts(), e.getMessage());
        } catch (TurnConflictException e) {
            LOG.error("Rejected conflicting write for turn {}: {}; unstored event: {}", key, e.getMessage(),
                    EventCodec.toLogString(event));
            reportFailure(event, key, 1, e.getMessage());
        }
    }

    private void reportFailure(Event event, String key, int attempts, String reason) {
        metrics.incrementPersistenceFailure(KIND);
        publisher.publishEvent(new PersistenceFailedEvent(KIND, key, attempts, reason, Instant.now()));
        tracker.acknowledge(event.correlationId(), false);
    }

    @Override
    public String toString() {
        return "TurnPersistenceSubscriber";
    }
}
