package com.phillippitts.axiom.service.events;

import com.phillippitts.axiom.service.store.PersistenceFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Operator-facing warnings for abandoned durable writes.
 *
 * <p>At most one warning per record kind per minute; records dropped in between are counted and
 * reported with the next warning, so a failing datasource shows up as one line with a total
 * instead of one line per turn.
 */
@Component
class PersistenceEventsListener {
    private static final Logger LOG = LogManager.getLogger(PersistenceEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> suppressed = new ConcurrentHashMap<>();

    @EventListener
    void onPersistenceFailed(PersistenceFailedEvent e) {
        String key = "persistence-" + e.kind();
        if (shouldLog(key)) {
            long dropped = suppressedCount(key);
            suppressed.remove(key);
            LOG.warn("Durable store dropped a {} record ({}) after {} attempts: {}. {} more dropped since last "
                    + "warning. Check the datasource and axiom.store.* settings.",
                    e.kind(), e.key(), e.attempts(), e.reason(), dropped);
        } else {
            suppressed.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        boolean[] allowed = {false};
        lastLog.compute(key, (k, prev) -> {
            if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
                allowed[0] = true;
                return now;
            }
            return prev;
        });
        return allowed[0];
    }

    long suppressedCount(String key) {
        AtomicLong count = suppressed.get(key);
        return count == null ? 0L : count.get();
    }
}
