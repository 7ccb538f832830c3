package com.parleysystems.mailbox.config;

import com.parleysystems.mailbox.Mailbox;
import com.parleysystems.mailbox.OverflowPolicy;

import java.util.Objects;

/**
 * Configuration for agent mailbox settings.
 */
public class MailboxConfig {
    // Default values for mailbox configuration
    public static final int DEFAULT_CAPACITY = Mailbox.UNBOUNDED;
    public static final int DEFAULT_MPSC_CHUNK_SIZE = 128;
    public static final MailboxType DEFAULT_MAILBOX_TYPE = MailboxType.LINKED;
    public static final OverflowPolicy DEFAULT_OVERFLOW_POLICY = OverflowPolicy.BLOCK;

    private int capacity;
    private int chunkSize;
    private MailboxType mailboxType;
    private OverflowPolicy overflowPolicy;

    /**
     * Creates a new MailboxConfig with default values: an unbounded linked mailbox.
     */
    public MailboxConfig() {
        this.capacity = DEFAULT_CAPACITY;
        this.chunkSize = DEFAULT_MPSC_CHUNK_SIZE;
        this.mailboxType = DEFAULT_MAILBOX_TYPE;
        this.overflowPolicy = DEFAULT_OVERFLOW_POLICY;
    }

    /**
     * Unbounded linked mailbox.
     */
    public static MailboxConfig unbounded() {
        return new MailboxConfig();
    }

    /**
     * Bounded linked mailbox with an explicit overflow policy.
     *
     * @param capacity the maximum number of queued messages
     * @param overflowPolicy the policy applied when full
     */
    public static MailboxConfig bounded(int capacity, OverflowPolicy overflowPolicy) {
        return new MailboxConfig()
            .setCapacity(capacity)
            .setOverflowPolicy(overflowPolicy);
    }

    /**
     * Unbounded lock-free MPSC mailbox.
     */
    public static MailboxConfig highThroughput() {
        return new MailboxConfig().setMailboxType(MailboxType.MPSC);
    }

    /**
     * Sets the maximum capacity for the mailbox.
     * 
     * @param capacity The maximum capacity, or {@link Mailbox#UNBOUNDED}
     * @return This MailboxConfig instance
     */
    public MailboxConfig setCapacity(int capacity) {
        this.capacity = capacity;
        return this;
    }

    public int getCapacity() {
        return capacity;
    }

    public boolean isBounded() {
        return capacity != Mailbox.UNBOUNDED;
    }

    /**
     * Sets the initial chunk size of MPSC mailboxes. Ignored by linked mailboxes.
     * 
     * @param chunkSize The chunk size
     * @return This MailboxConfig instance
     */
    public MailboxConfig setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
        return this;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * Sets the mailbox type.
     * 
     * @param mailboxType The mailbox type (LINKED or MPSC)
     * @return This MailboxConfig instance
     */
    public MailboxConfig setMailboxType(MailboxType mailboxType) {
        this.mailboxType = mailboxType;
        return this;
    }

    public MailboxType getMailboxType() {
        return mailboxType;
    }

    /**
     * Sets the overflow policy applied when a bounded mailbox is full.
     * 
     * @param overflowPolicy The overflow policy (BLOCK, DROP_OLDEST or REJECT_NEW)
     * @return This MailboxConfig instance
     */
    public MailboxConfig setOverflowPolicy(OverflowPolicy overflowPolicy) {
        this.overflowPolicy = overflowPolicy;
        return this;
    }

    public OverflowPolicy getOverflowPolicy() {
        return overflowPolicy;
    }

    /**
     * Checks that the settings can be satisfied by one mailbox implementation.
     *
     * @return This MailboxConfig instance
     * @throws IllegalArgumentException if the combination is invalid
     */
    public MailboxConfig validate() {
        Objects.requireNonNull(mailboxType, "mailboxType cannot be null");
        Objects.requireNonNull(overflowPolicy, "overflowPolicy cannot be null");
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        if (mailboxType == MailboxType.MPSC && isBounded()) {
            throw new IllegalArgumentException("MPSC mailboxes are unbounded; capacity " + capacity
                + " requires MailboxType.LINKED");
        }
        return this;
    }

    @Override
    public String toString() {
        return "MailboxConfig{" +
            "type=" + mailboxType +
            ", capacity=" + (isBounded() ? String.valueOf(capacity) : "unbounded") +
            ", overflowPolicy=" + overflowPolicy +
            '}';
    }
}
