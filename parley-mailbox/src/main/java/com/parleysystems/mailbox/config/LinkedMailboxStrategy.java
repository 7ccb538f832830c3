package com.parleysystems.mailbox.config;

import com.parleysystems.mailbox.LinkedMailbox;
import com.parleysystems.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates {@link LinkedMailbox} instances, bounded or not.
 *
 * @param <M> The message type
 */
public class LinkedMailboxStrategy<M> implements MailboxCreationStrategy<M> {
    private static final Logger logger = LoggerFactory.getLogger(LinkedMailboxStrategy.class);

    @Override
    public Mailbox<M> createMailbox(MailboxConfig config) {
        logger.debug("Creating LinkedMailbox with capacity: {}, overflow policy: {}",
                     config.isBounded() ? config.getCapacity() : "unbounded", config.getOverflowPolicy());
        return new LinkedMailbox<>(config.getCapacity(), config.getOverflowPolicy());
    }
}
