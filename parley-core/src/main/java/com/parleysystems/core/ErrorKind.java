package com.parleysystems.core;

/**
 * Classifies the ways a delivery or protocol operation can fail.
 */
public enum ErrorKind {
    /** The routing target is not registered. The message was not delivered. */
    UNKNOWN_AGENT,

    /** A bounded mailbox rejected the message under its reject-new policy. The caller may retry. */
    MAILBOX_FULL,

    /** The mailbox has been closed, normally because its agent was deregistered. */
    MAILBOX_CLOSED,

    /** No correlated reply arrived before the deadline. The request is not retracted. */
    REPLY_TIMEOUT,

    /** The caller aborted a blocking operation. Nothing was consumed. */
    CANCELLED,

    /** Any other delivery failure. */
    SEND_FAILED
}
