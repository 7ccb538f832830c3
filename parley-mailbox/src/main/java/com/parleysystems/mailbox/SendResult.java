package com.parleysystems.mailbox;

/**
 * Outcome of a send with a deadline or cancellation token.
 */
public enum SendResult {
    /** The message is in the queue. */
    ACCEPTED,
    /** The mailbox is full and its policy is {@link OverflowPolicy#REJECT_NEW}. */
    FULL,
    /** The mailbox stayed full until the deadline elapsed. */
    TIMED_OUT,
    /** The caller cancelled the wait or interrupted the sending thread. */
    CANCELLED,
    /** The mailbox is closed. */
    CLOSED;

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}
