package com.phillippitts.axiom.service.lifecycle;

import com.phillippitts.axiom.domain.Event;
import com.phillippitts.axiom.domain.Topics;
import com.phillippitts.axiom.exception.AxiomException;
import com.phillippitts.axiom.service.bus.EventBus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Publishes {@code system.start} once the application is ready and {@code system.shutdown}
 * when the context closes, before the bus drains.
 */
@Component
public class SystemLifecycleEvents {

    private static final Logger LOG = LogManager.getLogger(SystemLifecycleEvents.class);

    public static final String SOURCE = "system_lifecycle";

    private final EventBus eventBus;
    private final Instant createdAt = Instant.now();

    public SystemLifecycleEvents(EventBus eventBus) {
        this.eventBus = eventBus;
        eventBus.registerPublisher(SOURCE, List.of(Topics.SYSTEM_START, Topics.SYSTEM_SHUTDOWN));
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("startedAt", createdAt.toString());
        payload.put("javaVersion", System.getProperty("java.version"));
        publish(Topics.SYSTEM_START, payload);
    }

    @EventListener(ContextClosedEvent.class)
    public void onClosed() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("uptimeSeconds", Duration.between(createdAt, Instant.now()).toSeconds());
        publish(Topics.SYSTEM_SHUTDOWN, payload);
    }

    private void publish(String topic, Map<String, Object> payload) {
        try {
            eventBus.publish(Event.create(topic, payload, SOURCE, null));
            LOG.info("Published {}", topic);
        } catch (AxiomException e) {
            LOG.warn("Could not publish {} [{}]: {}", topic, e.getErrorCode(), e.getMessage());
        }
    }
}
