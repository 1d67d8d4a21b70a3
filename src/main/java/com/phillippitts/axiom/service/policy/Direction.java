package com.phillippitts.axiom.service.policy;

/**
 * Which side of a turn a piece of text comes from.
 */
public enum Direction {
    /** Text submitted by the user. */
    INPUT,
    /** Text about to be returned to the user. */
    OUTPUT
}
