package com.phillippitts.axiom.service.store;

import java.time.Instant;

/**
 * Emitted (as a Spring application event) when a durable write is abandoned after all
 * retries.
 *
 * @param kind        what was being written ({@code turn} or {@code event})
 * @param key         record key, for example {@code session-1#4} or an event id
 * @param attempts    attempts made
 * @param reason      last failure message
 * @param timestamp   when the write was abandoned
 */
public record PersistenceFailedEvent(
        String kind,
        String key,
        int attempts,
        String reason,
        Instant timestamp
) {}
