package com.phillippitts.axiom.service.bus;

import com.phillippitts.axiom.domain.Event;
import com.phillippitts.axiom.domain.Topics;
import com.phillippitts.axiom.exception.EventBusShutdownException;
import com.phillippitts.axiom.exception.EventValidationException;
import com.phillippitts.axiom.exception.UnregisteredTopicException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process {@link EventBus} in which every subscription owns an inbound queue drained by
 * its own single worker thread.
 *
 * <p>One worker per subscription gives FIFO delivery per topic per subscriber and keeps a
 * slow subscriber (for example the durable store) from delaying the publisher or any other
 * subscriber. Worker threads are created lazily on the first delivery and are daemons.
 *
 * <p><b>MDC propagation:</b> the publisher's Log4j2 {@link ThreadContext} is captured at
 * publish time and restored around the handler call, with {@code topic}, {@code eventId}
 * and {@code correlationId} added.
 *
 * <p><b>Thread Safety:</b> all methods may be called concurrently.
 *
 * @since 1.0
 */
public class DefaultEventBus implements EventBus, AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(DefaultEventBus.class);

    private final Map<String, Set<String>> publishersByTopic = new ConcurrentHashMap<>();
    private final Map<String, List<Subscription>> subscriptionsByTopic = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicLong publishedCount = new AtomicLong();
    private final AtomicLong deliveredCount = new AtomicLong();
    private final AtomicLong handlerFailureCount = new AtomicLong();
    private final Duration defaultShutdownGrace;

    public DefaultEventBus() {
        this(Duration.ofSeconds(5));
    }

    public DefaultEventBus(Duration defaultShutdownGrace) {
        this.defaultShutdownGrace = Objects.requireNonNull(defaultShutdownGrace, "defaultShutdownGrace must not be null");
    }

    @Override
    public void registerPublisher(String publisherName, Collection<String> topics) {
        if (publisherName == null || publisherName.isBlank()) {
            throw new EventValidationException("Publisher name must not be blank");
        }
        Objects.requireNonNull(topics, "topics must not be null");
        for (String topic : topics) {
            requireValidTopic(topic);
            publishersByTopic.computeIfAbsent(topic, t -> ConcurrentHashMap.newKeySet()).add(publisherName);
        }
        LOG.info("Registered publisher '{}' for topics {}", publisherName, topics);
    }

    @Override
    public void subscribe(String topic, EventHandler handler) {
        requireValidTopic(topic);
        Objects.requireNonNull(handler, "handler must not be null");
        if (!running.get()) {
            throw new EventBusShutdownException("Cannot subscribe to " + topic + ": event bus is shut down");
        }
        subscriptionsByTopic.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>())
                .add(new Subscription(topic, handler));
        LOG.debug("Subscribed handler {} to topic {}", handler, topic);
    }

    @Override
    public boolean unsubscribe(String topic, EventHandler handler) {
        List<Subscription> subscriptions = subscriptionsByTopic.get(topic);
        if (subscriptions == null || handler == null) {
            return false;
        }
        for (Subscription subscription : subscriptions) {
            if (subscription.handler == handler && subscriptions.remove(subscription)) {
                subscription.worker.shutdown();
                LOG.debug("Unsubscribed handler {} from topic {}", handler, topic);
                return true;
            }
        }
        return false;
    }

    @Override
    public Event publish(Event event) {
        Objects.requireNonNull(event, "event must not be null");
        if (!running.get()) {
            throw new EventBusShutdownException("Cannot publish to " + event.topic() + ": event bus is shut down");
        }
        String topic = event.topic();
        if (topic == null || !publishersByTopic.containsKey(topic)) {
            throw new UnregisteredTopicException(topic);
        }
        Event published = event.hasId() ? event : event.withId(UUID.randomUUID().toString());
        publishedCount.incrementAndGet();

        List<Subscription> subscriptions = subscriptionsByTopic.getOrDefault(topic, List.of());
        if (subscriptions.isEmpty()) {
            LOG.debug("No subscribers for topic {} (eventId={})", topic, published.id());
        }
        Map<String, String> mdc = ThreadContext.getImmutableContext();
        for (Subscription subscription : subscriptions) {
            subscription.enqueue(published, mdc);
        }
        return published;
    }

    @Override
    public void shutdown(Duration grace) {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        long deadline = System.nanoTime() + grace.toNanos();
        List<Subscription> all = subscriptionsByTopic.values().stream().flatMap(List::stream).toList();
        all.forEach(s -> s.worker.shutdown());

        int dropped = 0;
        for (Subscription subscription : all) {
            long remaining = deadline - System.nanoTime();
            try {
                if (!subscription.worker.awaitTermination(Math.max(remaining, 0L), TimeUnit.NANOSECONDS)) {
                    dropped += subscription.worker.shutdownNow().size();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                dropped += subscription.worker.shutdownNow().size();
            }
        }
        if (dropped > 0) {
            LOG.warn("Event bus shut down with {} undelivered event(s) dropped", dropped);
        }
        LOG.info("Event bus shut down: published={}, delivered={}, handlerFailures={}",
                publishedCount.get(), deliveredCount.get(), handlerFailureCount.get());
    }

    @Override
    public void close() {
        shutdown(defaultShutdownGrace);
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    public boolean hasPublisher(String topic) {
        return publishersByTopic.containsKey(topic);
    }

    public int subscriberCount(String topic) {
        return subscriptionsByTopic.getOrDefault(topic, List.of()).size();
    }

    public int totalSubscriptions() {
        return subscriptionsByTopic.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Events queued or in flight across all subscriptions.
     */
    public long pendingDeliveries() {
        return subscriptionsByTopic.values().stream()
                .flatMap(List::stream)
                .mapToLong(s -> s.worker.getQueue().size() + s.worker.getActiveCount())
                .sum();
    }

    public long publishedCount() {
        return publishedCount.get();
    }

    public long deliveredCount() {
        return deliveredCount.get();
    }

    public long handlerFailureCount() {
        return handlerFailureCount.get();
    }

    private static void requireValidTopic(String topic) {
        if (!Topics.isValidName(topic)) {
            throw new EventValidationException("Invalid topic name: " + topic);
        }
    }

    private final class Subscription {
        private final String topic;
        private final EventHandler handler;
        private final ThreadPoolExecutor worker;

        private Subscription(String topic, EventHandler handler) {
            this.topic = topic;
            this.handler = handler;
            CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("bus-" + topic + "-");
            threadFactory.setDaemon(true);
            this.worker = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                    new LinkedBlockingQueue<>(), threadFactory);
        }

        private void enqueue(Event event, Map<String, String> mdc) {
            try {
                worker.execute(() -> deliver(event, mdc));
            } catch (RejectedExecutionException e) {
                LOG.warn("Dropped event {} on topic {}: subscription {} is closed", event.id(), topic, handler);
            }
        }

        private void deliver(Event event, Map<String, String> mdc) {
            try {
                if (mdc != null && !mdc.isEmpty()) {
                    ThreadContext.putAll(mdc);
                }
                ThreadContext.put("topic", topic);
                ThreadContext.put("eventId", event.id());
                if (event.correlationId() != null) {
                    ThreadContext.put("correlationId", event.correlationId());
                }
                handler.handle(event);
                deliveredCount.incrementAndGet();
            } catch (Exception e) {
                handlerFailureCount.incrementAndGet();
                LOG.error("Handler {} failed for event {} on topic {}", handler, event.id(), topic, e);
            } finally {
                ThreadContext.clearAll();
            }
        }
    }
}
