package com.parleysystems.mailbox.config;

import com.parleysystems.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Default mailbox provider that selects a {@link MailboxCreationStrategy}
 * by {@link MailboxType}.
 *
 * - LINKED: LinkedMailbox (bounded or unbounded, any overflow policy)
 * - MPSC: MpscMailbox (unbounded, lock-free enqueue)
 */
public class DefaultMailboxProvider<M> implements MailboxProvider<M> {
    private static final Logger logger = LoggerFactory.getLogger(DefaultMailboxProvider.class);

    private final Map<MailboxType, MailboxCreationStrategy<M>> strategies;

    public DefaultMailboxProvider() {
        this.strategies = new EnumMap<>(MailboxType.class);
        this.strategies.put(MailboxType.LINKED, new LinkedMailboxStrategy<>());
        this.strategies.put(MailboxType.MPSC, new MpscMailboxStrategy<>());
    }

    /**
     * Replaces the strategy used for one mailbox type.
     *
     * @param type the mailbox type
     * @param strategy the strategy to use
     * @return this provider
     */
    public DefaultMailboxProvider<M> withStrategy(MailboxType type, MailboxCreationStrategy<M> strategy) {
        strategies.put(Objects.requireNonNull(type), Objects.requireNonNull(strategy));
        return this;
    }

    @Override
    public Mailbox<M> createMailbox(MailboxConfig config) {
        MailboxConfig effectiveConfig = (config != null) ? config : MailboxConfig.unbounded();
        effectiveConfig.validate();

        logger.debug("DefaultMailboxProvider creating mailbox - config: {}", effectiveConfig);

        return strategies.get(effectiveConfig.getMailboxType()).createMailbox(effectiveConfig);
    }
}
