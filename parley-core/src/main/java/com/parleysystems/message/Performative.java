package com.parleysystems.message;

/**
 * Speech-act kind of a message (its communicative intent), independent of the payload.
 * The fabric carries it as a tag and never branches on it; protocol layers may.
 */
public enum Performative {
    INFORM,
    REQUEST,
    QUERY,
    PROPOSE,
    ACCEPT,
    REJECT,
    CONFIRM,
    DISCONFIRM,
    SUBSCRIBE,
    /** Call for proposals. */
    CFP,
    REFUSE,
    AGREE
}
