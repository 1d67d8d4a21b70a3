package com.phillippitts.axiom.exception;

/**
 * Thrown internally when a bounded wait inside a turn (session lock, generation)
 * exceeds its budget. The orchestrator converts it into a FAILED outcome.
 */
public class TurnTimeoutException extends AxiomException {

    private final String stage;
    private final long timeoutMs;

    public TurnTimeoutException(String stage, long timeoutMs) {
        super(ErrorCode.SYSTEM_TIMEOUT, "Turn timed out after " + timeoutMs + "ms during " + stage);
        this.stage = stage;
        this.timeoutMs = timeoutMs;
    }

    public String getStage() {
        return stage;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
