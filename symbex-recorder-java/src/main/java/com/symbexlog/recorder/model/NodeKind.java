package com.symbexlog.recorder.model;

/**
 * Coarse classification of a program node, as far as the recorder needs it
 * to decide whether a step is logged and through which record variant.
 */
public enum NodeKind {
    METHOD,
    PREDICATE,
    FUNCTION,
    STATEMENT,
    /** A statement block. Never logged on its own; its statements are. */
    SEQUENCE,
    METHOD_CALL,
    EXPRESSION,
    CONDITIONAL_EXPRESSION,
    IMPLICATION
}
