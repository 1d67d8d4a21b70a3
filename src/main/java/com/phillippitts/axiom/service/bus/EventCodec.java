package com.phillippitts.axiom.service.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.phillippitts.axiom.domain.Event;
import com.phillippitts.axiom.exception.EventValidationException;

import java.util.Map;

/**
 * JSON codec for the event wire shape {@code {id, topic, payload, createdAt, source, correlationId}}
 * and for the free-form maps stored next to turns and events.
 *
 * <p>{@code createdAt} is written as an ISO-8601 string; map keys are written in sorted order
 * so equal payloads produce equal JSON.
 */
public final class EventCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() { };

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private EventCodec() {
        // utility class
    }

    public static String toJson(Event event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventValidationException("Failed to serialize event " + event.id(), e);
        }
    }

    /**
     * Wire JSON of the event for log lines, or a short id and topic form when the payload
     * cannot be serialized.
     */
    public static String toLogString(Event event) {
        try {
            return toJson(event);
        } catch (EventValidationException e) {
            return "Event[id=" + event.id() + ", topic=" + event.topic() + ", unserializable payload]";
        }
    }

    public static String writeMap(Map<String, ?> map) {
        try {
            return MAPPER.writeValueAsString(map == null ? Map.of() : map);
        } catch (JsonProcessingException e) {
            throw new EventValidationException("Failed to serialize map", e);
        }
    }

    public static Map<String, Object> readMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new EventValidationException("Failed to deserialize map", e);
        }
    }
}
