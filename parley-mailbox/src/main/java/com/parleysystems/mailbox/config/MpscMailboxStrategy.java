package com.parleysystems.mailbox.config;

import com.parleysystems.mailbox.Mailbox;
import com.parleysystems.mailbox.MpscMailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates {@link MpscMailbox} instances for agents with many concurrent senders.
 *
 * @param <M> The message type
 */
public class MpscMailboxStrategy<M> implements MailboxCreationStrategy<M> {
    private static final Logger logger = LoggerFactory.getLogger(MpscMailboxStrategy.class);

    @Override
    public Mailbox<M> createMailbox(MailboxConfig config) {
        logger.debug("Creating MpscMailbox with initial chunk size: {}", config.getChunkSize());
        return new MpscMailbox<>(config.getChunkSize());
    }
}
