package com.phillippitts.axiom.service.context;

import com.phillippitts.axiom.domain.ConversationTurn;
import com.phillippitts.axiom.domain.SessionContext;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Per-session conversation state. A session's context is only reachable through its own
 * {@code sessionId}; nothing is shared between sessions.
 */
public interface ContextStore {

    /**
     * Returns the session's context, creating an empty one on first access.
     *
     * @throws com.phillippitts.axiom.exception.ContextStoreException if the store cannot
     *         provide the context
     */
    SessionContext get(String sessionId);

    /**
     * Returns the context only if the session is active.
     */
    Optional<SessionContext> find(String sessionId);

    /**
     * Appends a completed turn, evicting the oldest history entry past the cap.
     */
    void appendTurn(String sessionId, ConversationTurn turn);

    /**
     * Discards the session's context. Sequence numbering of a later context for the same id
     * continues after the last number assigned here.
     *
     * @return {@code true} if the session was active
     */
    boolean endSession(String sessionId);

    /**
     * Lists sessions whose last activity is before {@code cutoff}. Nothing is removed.
     */
    List<String> idleSessions(Instant cutoff);

    /**
     * Discards the session's context if it is still idle at the time of the call.
     *
     * @return {@code true} if the context was removed
     */
    boolean evictIfIdle(String sessionId, Instant cutoff);

    int activeSessionCount();
}
