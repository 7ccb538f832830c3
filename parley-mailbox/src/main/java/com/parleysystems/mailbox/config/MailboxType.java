package com.parleysystems.mailbox.config;

/**
 * Mailbox implementation to create for an agent.
 */
public enum MailboxType {
    /**
     * {@link com.parleysystems.mailbox.LinkedMailbox}: unbounded or bounded,
     * honours every overflow policy. The default.
     */
    LINKED,

    /**
     * {@link com.parleysystems.mailbox.MpscMailbox}: lock-free enqueue, unbounded only.
     */
    MPSC
}
