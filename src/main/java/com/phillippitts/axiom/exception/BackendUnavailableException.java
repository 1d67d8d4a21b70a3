package com.phillippitts.axiom.exception;

/**
 * Thrown when a generation backend cannot produce a completion
 * (not configured, unreachable, or returned no text).
 */
public class BackendUnavailableException extends AxiomException {

    private final String backendName;

    public BackendUnavailableException(String backendName, String message) {
        super(ErrorCode.VA_RESPONSE_GENERATION_FAILED, message + " (backend: " + backendName + ")");
        this.backendName = backendName;
    }

    public BackendUnavailableException(String backendName, String message, Throwable cause) {
        super(ErrorCode.VA_RESPONSE_GENERATION_FAILED, message + " (backend: " + backendName + ")", cause);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
