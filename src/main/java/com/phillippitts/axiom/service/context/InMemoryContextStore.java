package com.phillippitts.axiom.service.context;

import com.phillippitts.axiom.domain.ConversationTurn;
import com.phillippitts.axiom.domain.SessionContext;
import com.phillippitts.axiom.exception.ContextStoreException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.ToLongFunction;

/**
 * {@link ContextStore} backed by a concurrent map.
 *
 * <p>A new context starts its sequence after the latest number already persisted for the
 * session (looked up through {@code lastSequenceLookup}), so numbering stays gap-free across
 * restarts. A failing lookup surfaces as {@link ContextStoreException}.
 *
 * <p>Persistence lags behind the context, so the highest number ever assigned to a session is
 * also kept and outlives the context. A context created after {@link #endSession} or idle
 * eviction is seeded from whichever of the two is larger.
 */
public class InMemoryContextStore implements ContextStore {

    private static final Logger LOG = LogManager.getLogger(InMemoryContextStore.class);

    private final Map<String, SessionContext> contexts = new ConcurrentHashMap<>();
    private final Map<String, Long> assignedHighWater = new ConcurrentHashMap<>();
    private final int maxHistory;
    private final ToLongFunction<String> lastSequenceLookup;

    public InMemoryContextStore(int maxHistory) {
        this(maxHistory, sessionId -> 0L);
    }

    public InMemoryContextStore(int maxHistory, ToLongFunction<String> lastSequenceLookup) {
        if (maxHistory < 1) {
            throw new IllegalArgumentException("maxHistory must be >= 1, got: " + maxHistory);
        }
        this.maxHistory = maxHistory;
        this.lastSequenceLookup = Objects.requireNonNull(lastSequenceLookup, "lastSequenceLookup must not be null");
    }

    @Override
    public SessionContext get(String sessionId) {
        requireSessionId(sessionId);
        return contexts.computeIfAbsent(sessionId, this::newContext);
    }

    @Override
    public Optional<SessionContext> find(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(contexts.get(sessionId));
    }

    @Override
    public void appendTurn(String sessionId, ConversationTurn turn) {
        Objects.requireNonNull(turn, "turn must not be null");
        try {
            get(sessionId).append(turn);
        } catch (IllegalArgumentException e) {
            throw new ContextStoreException(sessionId, "Cannot append turn " + turn.sequenceNumber(), e);
        }
    }

    @Override
    public boolean endSession(String sessionId) {
        SessionContext removed = sessionId == null ? null : contexts.remove(sessionId);
        if (removed == null) {
            return false;
        }
        rememberAssigned(removed);
        LOG.info("Session ended: {}", sessionId);
        return true;
    }

    @Override
    public List<String> idleSessions(Instant cutoff) {
        List<String> idle = new ArrayList<>();
        contexts.forEach((id, ctx) -> {
            if (ctx.lastActivity().isBefore(cutoff)) {
                idle.add(id);
            }
        });
        return idle;
    }

    @Override
    public boolean evictIfIdle(String sessionId, Instant cutoff) {
        SessionContext ctx = sessionId == null ? null : contexts.get(sessionId);
        if (ctx == null || !ctx.lastActivity().isBefore(cutoff) || !contexts.remove(sessionId, ctx)) {
            return false;
        }
        rememberAssigned(ctx);
        LOG.info("Idle session evicted: {}", sessionId);
        return true;
    }

    @Override
    public int activeSessionCount() {
        return contexts.size();
    }

    /**
     * Number of sessions whose last assigned sequence number is still held because the
     * store had not caught up when the context went away.
     */
    int heldSequenceCount() {
        return assignedHighWater.size();
    }

    private void rememberAssigned(SessionContext ctx) {
        long lastAssigned = ctx.nextSequenceNumber() - 1;
        if (lastAssigned > 0) {
            assignedHighWater.merge(ctx.sessionId(), lastAssigned, Math::max);
        }
    }

    private SessionContext newContext(String sessionId) {
        long lastSequence;
        try {
            lastSequence = lastSequenceLookup.applyAsLong(sessionId);
        } catch (RuntimeException e) {
            throw new ContextStoreException(sessionId, "Failed to load last sequence number", e);
        }
        Long assigned = assignedHighWater.get(sessionId);
        if (assigned != null) {
            if (assigned > lastSequence) {
                lastSequence = assigned;
            } else {
                // store has caught up
                assignedHighWater.remove(sessionId, assigned);
            }
        }
        LOG.debug("Created context for session {} (lastSequence={})", sessionId, lastSequence);
        return new SessionContext(sessionId, maxHistory, lastSequence);
    }

    private static void requireSessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
    }
}
