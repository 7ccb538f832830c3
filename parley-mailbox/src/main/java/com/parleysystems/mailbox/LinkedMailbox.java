package com.parleysystems.mailbox;

import com.parleysystems.core.CancelledException;
import com.parleysystems.core.MailboxClosedException;
import com.parleysystems.core.MailboxFullException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default mailbox implementation: a deque guarded by one lock with
 * "not empty" and "not full" conditions.
 *
 * Recommended for:
 * - General-purpose agent mailboxes
 * - When a bound and an explicit overflow policy are needed
 * - When senders or receivers must be cancellable
 *
 * @param <T> The type of messages
 */
public class LinkedMailbox<T> implements Mailbox<T> {
    private static final Logger logger = LoggerFactory.getLogger(LinkedMailbox.class);

    private final ArrayDeque<T> queue = new ArrayDeque<>();
    private final int capacity;
    private final OverflowPolicy overflowPolicy;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    private boolean closed;
    private long droppedCount;

    /**
     * Creates an unbounded mailbox.
     */
    public LinkedMailbox() {
        this(UNBOUNDED, OverflowPolicy.BLOCK);
    }

    /**
     * Creates a bounded mailbox that blocks senders when full.
     *
     * @param capacity the maximum number of messages
     */
    public LinkedMailbox(int capacity) {
        this(capacity, OverflowPolicy.BLOCK);
    }

    /**
     * Creates a bounded mailbox with the given overflow policy.
     *
     * @param capacity the maximum number of messages
     * @param overflowPolicy what to do when a send finds the mailbox full
     */
    public LinkedMailbox(int capacity, OverflowPolicy overflowPolicy) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.overflowPolicy = Objects.requireNonNull(overflowPolicy, "Overflow policy cannot be null");
    }

    @Override
    public void send(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        lock.lock();
        try {
            if (closed) {
                throw new MailboxClosedException();
            }
            if (queue.size() >= capacity) {
                switch (overflowPolicy) {
                    case REJECT_NEW -> throw new MailboxFullException(capacity);
                    case DROP_OLDEST -> dropOldest();
                    case BLOCK -> awaitSpace();
                }
            }
            enqueue(message);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public SendResult send(T message, Duration timeout, CancellationToken token) {
        Objects.requireNonNull(message, "Message cannot be null");
        Objects.requireNonNull(token, "Token cannot be null");
        long nanos = Durations.toNanos(timeout);

        try (CancellationToken.Registration ignored = token.onCancel(this::wakeAll)) {
            lock.lockInterruptibly();
            try {
                while (true) {
                    if (closed) {
                        return SendResult.CLOSED;
                    }
                    if (queue.size() < capacity) {
                        enqueue(message);
                        return SendResult.ACCEPTED;
                    }
                    if (overflowPolicy == OverflowPolicy.REJECT_NEW) {
                        return SendResult.FULL;
                    }
                    if (overflowPolicy == OverflowPolicy.DROP_OLDEST) {
                        dropOldest();
                        enqueue(message);
                        return SendResult.ACCEPTED;
                    }
                    if (token.isCancelled()) {
                        return SendResult.CANCELLED;
                    }
                    if (nanos <= 0L) {
                        return SendResult.TIMED_OUT;
                    }
                    nanos = notFull.awaitNanos(nanos);
                }
            } finally {
                if (queue.size() < capacity) {
                    // pass on a signal this sender may have absorbed without using
                    notFull.signal();
                }
                lock.unlock();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SendResult.CANCELLED;
        }
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            if (queue.size() >= capacity) {
                if (overflowPolicy != OverflowPolicy.DROP_OLDEST) {
                    return false;
                }
                dropOldest();
            }
            enqueue(message);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public T receive() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty()) {
                if (closed) {
                    throw new MailboxClosedException();
                }
                try {
                    notEmpty.await();
                } catch (InterruptedException e) {
                    if (!queue.isEmpty()) {
                        notEmpty.signal();
                    }
                    throw e;
                }
            }
            return dequeue();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ReceiveResult<T> receive(Duration timeout, CancellationToken token) {
        Objects.requireNonNull(token, "Token cannot be null");
        long nanos = Durations.toNanos(timeout);

        try (CancellationToken.Registration ignored = token.onCancel(this::wakeAll)) {
            lock.lockInterruptibly();
            try {
                while (true) {
                    if (token.isCancelled()) {
                        return ReceiveResult.cancelled();
                    }
                    if (!queue.isEmpty()) {
                        return ReceiveResult.received(dequeue());
                    }
                    if (closed) {
                        return ReceiveResult.closed();
                    }
                    if (nanos <= 0L) {
                        return ReceiveResult.timedOut();
                    }
                    nanos = notEmpty.awaitNanos(nanos);
                }
            } finally {
                if (!queue.isEmpty()) {
                    // pass on a signal this receiver may have absorbed without using
                    notEmpty.signal();
                }
                lock.unlock();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ReceiveResult.cancelled();
        }
    }

    @Override
    public T poll() {
        lock.lock();
        try {
            return queue.isEmpty() ? null : dequeue();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int drainTo(Collection<? super T> collection, int maxElements) {
        Objects.requireNonNull(collection, "Collection cannot be null");
        lock.lock();
        try {
            int count = 0;
            while (count < maxElements && !queue.isEmpty()) {
                collection.add(queue.pollFirst());
                count++;
            }
            if (count > 0) {
                notFull.signalAll();
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public OverflowPolicy overflowPolicy() {
        return overflowPolicy;
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            logger.debug("Mailbox closed with {} queued messages", queue.size());
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of messages evicted under {@link OverflowPolicy#DROP_OLDEST}.
     *
     * @return total messages dropped
     */
    public long getDroppedCount() {
        lock.lock();
        try {
            return droppedCount;
        } finally {
            lock.unlock();
        }
    }

    // Callers hold the lock.

    private void enqueue(T message) {
        queue.addLast(message);
        notEmpty.signal();
    }

    private T dequeue() {
        T message = queue.pollFirst();
        notFull.signal();
        return message;
    }

    private void dropOldest() {
        T evicted = queue.pollFirst();
        droppedCount++;
        logger.debug("Mailbox at capacity {}, dropped oldest message {}", capacity, evicted);
    }

    private void awaitSpace() {
        try {
            while (queue.size() >= capacity) {
                notFull.await();
                if (closed) {
                    throw new MailboxClosedException();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException("Interrupted while waiting for mailbox space", e);
        }
    }

    private void wakeAll() {
        lock.lock();
        try {
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "LinkedMailbox{size=" + size()
            + ", capacity=" + (capacity == UNBOUNDED ? "unbounded" : capacity)
            + ", policy=" + overflowPolicy + "}";
    }
}
