package com.phillippitts.axiom.domain;

import com.phillippitts.axiom.exception.EventValidationException;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable message carried by the event bus.
 *
 * <p>The {@code id} is assigned by the bus when the event is published; an event built with
 * {@link #create} has no id until then. The payload is copied on construction and exposed
 * read-only, so a published event cannot be mutated by publishers or handlers.
 *
 * @param id            unique id, {@code null} until published
 * @param topic         dot-namespaced topic (validated by the bus, may be {@code null} here)
 * @param payload       structured payload, never {@code null}
 * @param createdAt     creation time
 * @param source        name of the producing component, never blank
 * @param correlationId optional id linking related events (for example all events of one turn)
 */
public record Event(
        String id,
        String topic,
        Map<String, Object> payload,
        Instant createdAt,
        String source,
        String correlationId
) {

    public Event {
        if (payload == null) {
            throw new EventValidationException("Event payload must not be null");
        }
        if (source == null || source.isBlank()) {
            throw new EventValidationException("Event source must not be blank");
        }
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * Creates an unpublished event stamped with the current time.
     */
    public static Event create(String topic, Map<String, Object> payload, String source, String correlationId) {
        return new Event(null, topic, payload, Instant.now(), source, correlationId);
    }

    /**
     * Creates a follow-up event sharing the parent's correlation id. When the parent has no
     * correlation id its own id links the two.
     */
    public static Event correlate(Event parent, String topic, Map<String, Object> payload, String source) {
        Objects.requireNonNull(parent, "parent must not be null");
        String correlation = parent.correlationId() != null ? parent.correlationId() : parent.id();
        return create(topic, payload, source, correlation);
    }

    public Event withId(String newId) {
        Objects.requireNonNull(newId, "id must not be null");
        return new Event(newId, topic, payload, createdAt, source, correlationId);
    }

    public boolean hasId() {
        return id != null;
    }
}
