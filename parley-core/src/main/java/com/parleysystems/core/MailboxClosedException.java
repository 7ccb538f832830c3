package com.parleysystems.core;

/**
 * Thrown when sending to, or blocking on, a mailbox that has been closed.
 */
public class MailboxClosedException extends MessagingException {

    public MailboxClosedException() {
        super(ErrorKind.MAILBOX_CLOSED, "Mailbox closed");
    }
}
