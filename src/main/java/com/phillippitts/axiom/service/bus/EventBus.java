package com.phillippitts.axiom.service.bus;

import com.phillippitts.axiom.domain.Event;

import java.time.Duration;
import java.util.Collection;

/**
 * Topic-based publish/subscribe broker.
 *
 * <p><b>Delivery contract:</b>
 * <ul>
 *   <li>{@link #publish} returns once the event is queued for every current subscriber;
 *       handlers never run on the publishing thread.</li>
 *   <li>Each subscription receives the events of its topic in publish order. There is no
 *       ordering across topics or across different subscribers of one topic.</li>
 *   <li>At-least-once per subscriber for the lifetime of the process. Events still queued
 *       when the bus shuts down are dropped.</li>
 * </ul>
 */
public interface EventBus {

    /**
     * Declares that {@code publisherName} emits the given topics. Publishing to a topic is
     * rejected until at least one publisher has registered for it.
     */
    void registerPublisher(String publisherName, Collection<String> topics);

    void subscribe(String topic, EventHandler handler);

    /**
     * Removes a subscription. Events already queued for it are still delivered.
     *
     * @return {@code true} if the handler was subscribed to the topic
     */
    boolean unsubscribe(String topic, EventHandler handler);

    /**
     * Queues an event for every subscriber of its topic.
     *
     * @return the published event carrying its bus-assigned id
     * @throws com.phillippitts.axiom.exception.UnregisteredTopicException if the event has no
     *         topic or no publisher is registered for it
     * @throws com.phillippitts.axiom.exception.EventBusShutdownException after {@link #shutdown}
     */
    Event publish(Event event);

    /**
     * Stops accepting events and waits up to {@code grace} for queued deliveries.
     */
    void shutdown(Duration grace);

    boolean isRunning();
}
