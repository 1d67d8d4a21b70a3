package com.phillippitts.axiom.exception;

import java.util.Objects;

/**
 * Base exception for all axiom application-specific errors.
 * All domain exceptions extend this class and carry an {@link ErrorCode}
 * to enable centralized error handling.
 */
public class AxiomException extends RuntimeException {

    private final ErrorCode errorCode;

    public AxiomException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    }

    public AxiomException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getUserMessage() {
        return errorCode.userMessage();
    }
}
