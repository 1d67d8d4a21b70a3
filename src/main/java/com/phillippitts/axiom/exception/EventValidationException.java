package com.phillippitts.axiom.exception;

/**
 * Thrown when an event or topic name is malformed (blank source, bad topic syntax, unreadable JSON).
 */
public class EventValidationException extends AxiomException {

    public EventValidationException(String message) {
        super(ErrorCode.BUS_INVALID_EVENT, message);
    }

    public EventValidationException(String message, Throwable cause) {
        super(ErrorCode.BUS_INVALID_EVENT, message, cause);
    }
}
