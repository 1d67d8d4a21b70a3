package com.phillippitts.axiom.service.store;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lets a turn wait for its {@code conversation.turn} event to be written.
 *
 * <p>The waiter registers the correlation id before publishing; the persistence subscriber
 * completes the future with {@code true} once stored (or already present) and {@code false}
 * when retries are exhausted. Unregistered acknowledgements are ignored.
 */
public class PersistenceTracker {

    private final Map<String, CompletableFuture<Boolean>> pending = new ConcurrentHashMap<>();

    public CompletableFuture<Boolean> expect(String correlationId) {
        return pending.computeIfAbsent(correlationId, id -> new CompletableFuture<>());
    }

    public void acknowledge(String correlationId, boolean stored) {
        if (correlationId == null) {
            return;
        }
        CompletableFuture<Boolean> future = pending.remove(correlationId);
        if (future != null) {
            future.complete(stored);
        }
    }

    public void forget(String correlationId) {
        pending.remove(correlationId);
    }

    public int pendingCount() {
        return pending.size();
    }
}
