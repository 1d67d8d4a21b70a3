package com.phillippitts.axiom.domain;

/**
 * Caller-visible result class of a turn.
 */
public enum TurnStatus {
    /** Normal response. */
    COMPLETE,
    /** A safe substitute response was returned. */
    DEGRADED,
    /** No normal response; the text is a denial or an apology. */
    FAILED
}
