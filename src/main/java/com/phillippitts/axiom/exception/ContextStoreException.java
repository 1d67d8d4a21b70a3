package com.phillippitts.axiom.exception;

/**
 * Thrown when session context cannot be read or committed.
 */
public class ContextStoreException extends AxiomException {

    private final String sessionId;

    public ContextStoreException(String sessionId, String message) {
        super(ErrorCode.VA_CONTEXT_ERROR, message + " (session: " + sessionId + ")");
        this.sessionId = sessionId;
    }

    public ContextStoreException(String sessionId, String message, Throwable cause) {
        super(ErrorCode.VA_CONTEXT_ERROR, message + " (session: " + sessionId + ")", cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
