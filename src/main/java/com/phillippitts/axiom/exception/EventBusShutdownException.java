package com.phillippitts.axiom.exception;

/**
 * Thrown when publishing or subscribing after the event bus has been shut down.
 */
public class EventBusShutdownException extends AxiomException {

    public EventBusShutdownException(String message) {
        super(ErrorCode.BUS_SHUT_DOWN, message);
    }
}
