package com.phillippitts.axiom.exception;

/**
 * Thrown when the durable store cannot persist or read conversation data.
 * Persistence is retried by the subscriber that owns the write; callers of
 * {@code submitTurn} never see this exception.
 */
public class StorageException extends AxiomException {

    private final String operation;

    public StorageException(String operation, String message) {
        super(ErrorCode.STATE_QUERY_FAILED, message + " (operation: " + operation + ")");
        this.operation = operation;
    }

    public StorageException(String operation, String message, Throwable cause) {
        super(ErrorCode.STATE_QUERY_FAILED, message + " (operation: " + operation + ")", cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
