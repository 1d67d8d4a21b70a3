package com.phillippitts.axiom.exception;

/**
 * Thrown when a turn's key is already stored with different content. Unlike
 * {@link StorageException} this is not transient and is never retried.
 */
public class TurnConflictException extends AxiomException {

    private final String sessionId;
    private final long sequenceNumber;

    public TurnConflictException(String sessionId, long sequenceNumber) {
        super(ErrorCode.STATE_INTEGRITY_ERROR,
                "Turn " + sessionId + "#" + sequenceNumber + " is already stored with different content");
        this.sessionId = sessionId;
        this.sequenceNumber = sequenceNumber;
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getSequenceNumber() {
        return sequenceNumber;
    }
}
