package com.phillippitts.axiom.domain;

/**
 * Why a turn did not complete normally.
 */
public enum FailureKind {
    POLICY_VIOLATION,
    SYSTEM_ERROR,
    TIMEOUT,
    /** The caller cancelled the turn before its context update. */
    CANCELLED;

    /**
     * Timeouts are reported as their own kind but handled as system errors.
     */
    public boolean isSystemError() {
        return this == SYSTEM_ERROR || this == TIMEOUT;
    }
}
