package com.phillippitts.axiom.service.orchestration;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One fair lock per session, created on demand and dropped once no thread holds or waits for it.
 */
final class SessionLockRegistry {

    private final Map<String, LockEntry> locks = new ConcurrentHashMap<>();

    /**
     * Waits up to {@code timeoutNanos} for the session's lock.
     *
     * @return {@code true} if acquired; the caller must then {@link #unlock} it
     */
    boolean tryLock(String sessionId, long timeoutNanos) throws InterruptedException {
        LockEntry entry = locks.compute(sessionId, (id, existing) -> {
            LockEntry e = existing == null ? new LockEntry() : existing;
            e.users++;
            return e;
        });
        boolean acquired = false;
        try {
            acquired = entry.lock.tryLock(Math.max(0L, timeoutNanos), TimeUnit.NANOSECONDS);
            return acquired;
        } finally {
            if (!acquired) {
                release(sessionId);
            }
        }
    }

    void unlock(String sessionId) {
        LockEntry entry = locks.get(sessionId);
        if (entry == null || !entry.lock.isHeldByCurrentThread()) {
            throw new IllegalMonitorStateException("Session lock not held: " + sessionId);
        }
        entry.lock.unlock();
        release(sessionId);
    }

    int size() {
        return locks.size();
    }

    private void release(String sessionId) {
        locks.computeIfPresent(sessionId, (id, e) -> --e.users == 0 ? null : e);
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock(true);
        // guarded by the map's compute
        private int users;
    }
}
