package com.parleysystems.mailbox;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Concurrency-safe FIFO queue owned by one agent.
 * <p>
 * Messages are received in the order they were accepted. Each accepted message is
 * returned by exactly one receive; when several receivers wait, each gets a distinct
 * message. The only way an accepted message leaves the queue without being received is
 * the opt-in {@link OverflowPolicy#DROP_OLDEST} policy, or an explicit {@link #drain()}.
 * <p>
 * Blocking operations come in two tiers: {@link #send(Object)} and {@link #receive()}
 * throw on failure, while the variants taking a timeout and {@link CancellationToken}
 * return a tagged {@link SendResult} / {@link ReceiveResult}.
 *
 * @param <T> The type of messages stored in the mailbox
 */
public interface Mailbox<T> {

    /**
     * Capacity reported by unbounded mailboxes.
     */
    int UNBOUNDED = Integer.MAX_VALUE;

    /**
     * Enqueues a message at the tail, applying the overflow policy when the mailbox is full.
     * Wakes at most one waiting receiver.
     *
     * @param message the message to add
     * @throws com.parleysystems.core.MailboxFullException if full under {@link OverflowPolicy#REJECT_NEW}
     * @throws com.parleysystems.core.MailboxClosedException if the mailbox is closed
     * @throws com.parleysystems.core.CancelledException if interrupted while blocked
     *         under {@link OverflowPolicy#BLOCK}; the interrupt flag is restored
     */
    void send(T message);

    /**
     * Enqueues a message, waiting at most {@code timeout} for space under
     * {@link OverflowPolicy#BLOCK}.
     *
     * @param message the message to add
     * @param timeout the longest time to wait for space
     * @param token cancels the wait
     * @return the outcome; never throws for full, timed-out, cancelled or closed mailboxes
     */
    SendResult send(T message, Duration timeout, CancellationToken token);

    /**
     * Inserts the message if possible without waiting.
     * Under {@link OverflowPolicy#DROP_OLDEST} a full mailbox evicts its head and accepts.
     *
     * @param message the message to add
     * @return true if the message was added, false if full or closed
     */
    boolean offer(T message);

    /**
     * Removes and returns the head message, waiting until one is available.
     *
     * @return the head of this mailbox
     * @throws InterruptedException if interrupted while waiting
     * @throws com.parleysystems.core.MailboxClosedException if the mailbox is closed and empty
     */
    T receive() throws InterruptedException;

    /**
     * Removes and returns the head message, waiting until one is available,
     * the deadline elapses, or the token is cancelled.
     *
     * @param timeout the longest time to wait
     * @param token cancels the wait
     * @return the received message, or why none was received
     */
    ReceiveResult<T> receive(Duration timeout, CancellationToken token);

    default ReceiveResult<T> receive(Duration timeout) {
        return receive(timeout, CancellationToken.NONE);
    }

    /**
     * Waits without a deadline until a message arrives or the token is cancelled.
     */
    default ReceiveResult<T> receive(CancellationToken token) {
        return receive(null, token);
    }

    /**
     * Removes and returns the head message without waiting.
     *
     * @return the head of this mailbox, or empty if there is none
     */
    default Optional<T> tryReceive() {
        return Optional.ofNullable(poll());
    }

    /**
     * Retrieves and removes the head of this mailbox, or returns null if empty.
     *
     * @return the head of this mailbox, or null if empty
     */
    T poll();

    /**
     * Removes available messages, in order, into the given collection.
     *
     * @param collection the collection to transfer messages into
     * @param maxElements the maximum number of messages to transfer
     * @return the number of messages transferred
     */
    int drainTo(Collection<? super T> collection, int maxElements);

    /**
     * Removes and returns every queued message, in order.
     */
    default List<T> drain() {
        List<T> drained = new ArrayList<>();
        drainTo(drained, Integer.MAX_VALUE);
        return drained;
    }

    /**
     * Returns the number of queued messages. A snapshot that may be stale on return.
     */
    int size();

    /**
     * Returns true if no message is queued. A snapshot that may be stale on return.
     */
    boolean isEmpty();

    /**
     * Returns the total capacity, or {@link #UNBOUNDED}.
     */
    int capacity();

    /**
     * Returns the number of additional messages this mailbox can accept
     * without applying its overflow policy, or {@link #UNBOUNDED}.
     */
    default int remainingCapacity() {
        int capacity = capacity();
        if (capacity == UNBOUNDED) {
            return UNBOUNDED;
        }
        return Math.max(0, capacity - size());
    }

    OverflowPolicy overflowPolicy();

    /**
     * Closes the mailbox. Further sends fail with {@code MAILBOX_CLOSED}, waiting senders
     * and receivers wake up. Messages already queued remain available to
     * {@link #poll()} and {@link #drain()}.
     */
    void close();

    boolean isClosed();
}
