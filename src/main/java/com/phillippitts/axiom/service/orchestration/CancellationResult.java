package com.phillippitts.axiom.service.orchestration;

/**
 * Answer to a cancellation request.
 */
public enum CancellationResult {
    /** The turn stops before its context update and ends FAILED. */
    CANCELLED,
    /** The turn already updated its session context and runs to completion. */
    REJECTED,
    /** No in-flight turn has that id. */
    UNKNOWN
}
