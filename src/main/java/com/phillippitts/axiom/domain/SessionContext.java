package com.phillippitts.axiom.domain;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-session conversation state: a bounded history of recent turns plus key/value slots
 * read by response generation.
 *
 * <p>Mutations happen only inside a turn holding the session's lock; methods are
 * synchronized so that out-of-band readers (history endpoints, the idle sweeper) see a
 * consistent view.
 *
 * <p>Turns must be appended in sequence order with no gaps. The history keeps at most
 * {@code maxHistory} turns and evicts the oldest first.
 */
public final class SessionContext {

    private final String sessionId;
    private final int maxHistory;
    private final Deque<ConversationTurn> history = new ArrayDeque<>();
    private final Map<String, Object> slots = new LinkedHashMap<>();
    private long lastSequenceNumber;
    private Instant lastActivity;

    public SessionContext(String sessionId, int maxHistory) {
        this(sessionId, maxHistory, 0L);
    }

    public SessionContext(String sessionId, int maxHistory, long lastSequenceNumber) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        if (maxHistory < 1) {
            throw new IllegalArgumentException("maxHistory must be >= 1, got: " + maxHistory);
        }
        if (lastSequenceNumber < 0) {
            throw new IllegalArgumentException("lastSequenceNumber must be >= 0, got: " + lastSequenceNumber);
        }
        this.sessionId = sessionId;
        this.maxHistory = maxHistory;
        this.lastSequenceNumber = lastSequenceNumber;
        this.lastActivity = Instant.now();
    }

    public String sessionId() {
        return sessionId;
    }

    public int maxHistory() {
        return maxHistory;
    }

    /**
     * Sequence number the next committed turn must carry.
     */
    public synchronized long nextSequenceNumber() {
        return lastSequenceNumber + 1;
    }

    /**
     * Appends a turn, evicting the oldest when the cap is exceeded.
     *
     * @throws IllegalArgumentException if the turn belongs to another session or is out of sequence
     */
    public synchronized void append(ConversationTurn turn) {
        Objects.requireNonNull(turn, "turn must not be null");
        if (!sessionId.equals(turn.sessionId())) {
            throw new IllegalArgumentException("Turn for session " + turn.sessionId()
                    + " cannot be appended to session " + sessionId);
        }
        if (turn.sequenceNumber() != lastSequenceNumber + 1) {
            throw new IllegalArgumentException("Expected sequence number " + (lastSequenceNumber + 1)
                    + " but got " + turn.sequenceNumber());
        }
        history.addLast(turn);
        while (history.size() > maxHistory) {
            history.removeFirst();
        }
        lastSequenceNumber = turn.sequenceNumber();
        lastActivity = turn.createdAt();
    }

    /**
     * Recent turns, oldest first.
     */
    public synchronized List<ConversationTurn> history() {
        return List.copyOf(history);
    }

    public synchronized Optional<ConversationTurn> lastTurn() {
        return Optional.ofNullable(history.peekLast());
    }

    public synchronized int historySize() {
        return history.size();
    }

    public synchronized Object slot(String key) {
        return slots.get(key);
    }

    public synchronized void putSlot(String key, Object value) {
        Objects.requireNonNull(key, "slot key must not be null");
        if (value == null) {
            slots.remove(key);
        } else {
            slots.put(key, value);
        }
    }

    public synchronized Map<String, Object> slots() {
        return new LinkedHashMap<>(slots);
    }

    /**
     * Replaces all slots with a previously taken {@link #slots()} snapshot.
     */
    public synchronized void restoreSlots(Map<String, Object> snapshot) {
        slots.clear();
        if (snapshot != null) {
            slots.putAll(snapshot);
        }
    }

    public synchronized void touch(Instant when) {
        lastActivity = Objects.requireNonNull(when, "when must not be null");
    }

    public synchronized Instant lastActivity() {
        return lastActivity;
    }

    @Override
    public synchronized String toString() {
        return "SessionContext{sessionId=" + sessionId + ", turns=" + history.size()
                + ", lastSequenceNumber=" + lastSequenceNumber + ", slots=" + slots.keySet() + '}';
    }
}
