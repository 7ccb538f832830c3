package com.parleysystems.mailbox.config;

import com.parleysystems.mailbox.Mailbox;

/**
 * Strategy interface for creating one kind of mailbox from configuration.
 * This allows new mailbox implementations to be plugged in without modifying
 * the provider logic.
 *
 * @param <M> The message type
 */
@FunctionalInterface
public interface MailboxCreationStrategy<M> {

    /**
     * Creates a mailbox according to this strategy.
     *
     * @param config The validated mailbox configuration
     * @return A new mailbox instance
     */
    Mailbox<M> createMailbox(MailboxConfig config);
}
