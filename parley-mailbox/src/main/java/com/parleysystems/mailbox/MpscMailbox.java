package com.parleysystems.mailbox;

import com.parleysystems.core.MailboxClosedException;
import org.jctools.queues.MpscUnboundedArrayQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * High-throughput mailbox using a JCTools MPSC (Multi-Producer Single-Consumer) queue.
 *
 * This implementation provides:
 * - Lock-free message enqueuing from any number of senders
 * - Minimal allocation overhead
 *
 * Recommended for:
 * - Agents receiving from many concurrent senders
 * - Low-latency delivery where a bound is not needed
 *
 * Trade-offs:
 * - Always unbounded: the overflow policy is never applied and sends never block
 * - Consumers are serialized on an internal lock, since the queue supports a single consumer;
 *   several receivers are still safe, they just take turns
 *
 * @param <T> The type of messages
 */
public class MpscMailbox<T> implements Mailbox<T> {
    private static final Logger logger = LoggerFactory.getLogger(MpscMailbox.class);

    private final MpscUnboundedArrayQueue<T> queue;
    private final ReentrantLock consumerLock = new ReentrantLock();
    private final Condition notEmpty = consumerLock.newCondition();
    private final AtomicInteger waitingConsumers = new AtomicInteger();
    // producers between their closed check and their enqueue
    private final AtomicInteger inFlight = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an MPSC mailbox with default chunk size (128).
     */
    public MpscMailbox() {
        this(128);
    }

    /**
     * Creates an MPSC mailbox with the specified chunk size.
     *
     * Note: This is unbounded - the chunk size only controls how the queue grows.
     *
     * @param chunkSize the initial chunk size (rounded up to a power of 2)
     */
    public MpscMailbox(int chunkSize) {
        // JCTools requires at least 2
        int safeChunk = chunkSize <= 1 ? 2 : chunkSize;
        this.queue = new MpscUnboundedArrayQueue<>(nextPowerOfTwo(safeChunk));
    }

    @Override
    public void send(T message) {
        if (!offer(message)) {
            throw new MailboxClosedException();
        }
    }

    @Override
    public SendResult send(T message, Duration timeout, CancellationToken token) {
        Objects.requireNonNull(token, "Token cannot be null");
        if (token.isCancelled()) {
            return SendResult.CANCELLED;
        }
        return offer(message) ? SendResult.ACCEPTED : SendResult.CLOSED;
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        inFlight.incrementAndGet();
        try {
            if (closed) {
                return false;
            }
            queue.offer(message);
        } finally {
            inFlight.decrementAndGet();
        }
        signalNotEmpty();
        return true;
    }

    @Override
    public T receive() throws InterruptedException {
        consumerLock.lockInterruptibly();
        try {
            waitingConsumers.incrementAndGet();
            try {
                while (true) {
                    T message = queue.poll();
                    if (message != null) {
                        return message;
                    }
                    if (closed) {
                        throw new MailboxClosedException();
                    }
                    notEmpty.await();
                }
            } finally {
                waitingConsumers.decrementAndGet();
            }
        } finally {
            consumerLock.unlock();
        }
    }

    @Override
    public ReceiveResult<T> receive(Duration timeout, CancellationToken token) {
        Objects.requireNonNull(token, "Token cannot be null");
        long nanos = Durations.toNanos(timeout);

        try (CancellationToken.Registration ignored = token.onCancel(this::wakeAll)) {
            consumerLock.lockInterruptibly();
            try {
                waitingConsumers.incrementAndGet();
                try {
                    while (true) {
                        if (token.isCancelled()) {
                            return ReceiveResult.cancelled();
                        }
                        T message = queue.poll();
                        if (message != null) {
                            return ReceiveResult.received(message);
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
                    waitingConsumers.decrementAndGet();
                    if (!queue.isEmpty()) {
                        notEmpty.signal();
                    }
                }
            } finally {
                consumerLock.unlock();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ReceiveResult.cancelled();
        }
    }

    @Override
    public T poll() {
        consumerLock.lock();
        try {
            return queue.poll();
        } finally {
            consumerLock.unlock();
        }
    }

    @Override
    public int drainTo(Collection<? super T> collection, int maxElements) {
        Objects.requireNonNull(collection, "Collection cannot be null");
        consumerLock.lock();
        try {
            int count = 0;
            while (count < maxElements) {
                T message = queue.poll();
                if (message == null) {
                    break;
                }
                collection.add(message);
                count++;
            }
            return count;
        } finally {
            consumerLock.unlock();
        }
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public int capacity() {
        return UNBOUNDED;
    }

    @Override
    public OverflowPolicy overflowPolicy() {
        return OverflowPolicy.BLOCK;
    }

    /**
     * Closes the mailbox. Returns once every send that got past the closed check has
     * enqueued, so a drain that follows sees all accepted messages.
     */
    @Override
    public void close() {
        boolean first = !closed;
        closed = true;
        while (inFlight.get() > 0) {
            Thread.onSpinWait();
        }
        if (first) {
            logger.debug("Mailbox closed with {} queued messages", queue.size());
        }
        wakeAll();
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    /**
     * Signals a waiting consumer that a message is available.
     * Only acquires the lock if a consumer is actually waiting, to keep enqueue lock-free.
     * The queue's producer-index CAS and the consumer's counter increment are both full
     * fences, so either the consumer sees the message or the producer sees the waiter.
     */
    private void signalNotEmpty() {
        if (waitingConsumers.get() > 0) {
            consumerLock.lock();
            try {
                notEmpty.signal();
            } finally {
                consumerLock.unlock();
            }
        }
    }

    private void wakeAll() {
        consumerLock.lock();
        try {
            notEmpty.signalAll();
        } finally {
            consumerLock.unlock();
        }
    }

    /**
     * Rounds up to the next power of 2.
     */
    private static int nextPowerOfTwo(int value) {
        if ((value & (value - 1)) == 0) {
            return value;
        }
        int result = 1;
        while (result < value) {
            result <<= 1;
        }
        return result;
    }
}
