package com.parleysystems.mailbox.config;

import com.parleysystems.mailbox.Mailbox;

/**
 * An interface for providing agent mailboxes.
 * Implementations decide which mailbox implementation backs a configuration.
 *
 * @param <M> The type of messages the mailbox will hold.
 */
public interface MailboxProvider<M> {

    /**
     * Creates a mailbox for the provided configuration.
     *
     * @param config The mailbox configuration; null means {@link MailboxConfig#unbounded()}
     * @return A new {@link Mailbox} instance
     * @throws IllegalArgumentException if the configuration is invalid
     */
    Mailbox<M> createMailbox(MailboxConfig config);
}
