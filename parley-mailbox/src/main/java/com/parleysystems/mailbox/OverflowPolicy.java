package com.parleysystems.mailbox;

/**
 * Defines how a bounded mailbox handles a send when it is at capacity.
 * Unbounded mailboxes never reach capacity, so the policy has no effect on them.
 *
 * <ul>
 *   <li>{@link #BLOCK} - sender waits until space is available (default, backpressure-friendly)</li>
 *   <li>{@link #DROP_OLDEST} - the head of the queue is discarded to make room (lossy, opt-in)</li>
 *   <li>{@link #REJECT_NEW} - the send fails with {@code MAILBOX_FULL}; the caller may retry</li>
 * </ul>
 */
public enum OverflowPolicy {
    /**
     * Block the sender until a receiver frees space, the wait times out,
     * or the caller cancels it.
     */
    BLOCK,

    /**
     * Evict the oldest queued message and accept the new one.
     * The only policy under which an accepted message can be lost.
     */
    DROP_OLDEST,

    /**
     * Refuse the new message and leave the queue unchanged.
     */
    REJECT_NEW
}
