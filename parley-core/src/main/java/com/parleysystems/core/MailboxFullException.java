package com.parleysystems.core;

/**
 * Thrown when a bounded mailbox is at capacity and its overflow policy rejects new messages.
 */
public class MailboxFullException extends MessagingException {

    private final int capacity;

    public MailboxFullException(int capacity) {
        super(ErrorKind.MAILBOX_FULL, "Mailbox full (capacity " + capacity + ")");
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
