package com.phillippitts.axiom.service.store;

import com.phillippitts.axiom.domain.Event;
import com.phillippitts.axiom.domain.Topics;
import com.phillippitts.axiom.exception.StorageException;
import com.phillippitts.axiom.service.bus.EventBus;
import com.phillippitts.axiom.service.bus.EventCodec;
import com.phillippitts.axiom.service.bus.EventHandler;
import com.phillippitts.axiom.service.metrics.TurnMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Records lifecycle and state events ({@code system.*}, {@code state.updated}) in the
 * durable store, with the same retry handling as turns.
 */
public class SystemEventSubscriber implements EventHandler {

    private static final Logger LOG = LogManager.getLogger(SystemEventSubscriber.class);

    static final List<String> TOPICS = List.of(Topics.SYSTEM_START, Topics.SYSTEM_SHUTDOWN, Topics.STATE_UPDATED);

    private static final String KIND = "event";

    private final DurableStore store;
    private final RetryPolicy retryPolicy;
    private final ApplicationEventPublisher publisher;
    private final TurnMetrics metrics;

    public SystemEventSubscriber(DurableStore store, RetryPolicy retryPolicy,
                                 ApplicationEventPublisher publisher, TurnMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    public void attach(EventBus bus) {
        TOPICS.forEach(topic -> bus.subscribe(topic, this));
    }

    @Override
    public void handle(Event event) {
        try {
            retryPolicy.execute("Persist event " + event.id(),
                    () -> store.persistEvent(event),
                    attempt -> metrics.incrementPersistenceRetry(KIND));
        } catch (StorageException e) {
            LOG.error("Giving up on {} event {} after {} attempts; unstored event: {}", event.topic(), event.id(),
                    retryPolicy.maxAttempts(), EventCodec.toLogString(event), e);
            metrics.incrementPersistenceFailure(KIND);
            publisher.publishEvent(new PersistenceFailedEvent(KIND, event.id(), retryPolicy.maxAttempts(),
                    e.getMessage(), Instant.now()));
        }
    }

    @Override
    public String toString() {
        return "SystemEventSubscriber";
    }
}
