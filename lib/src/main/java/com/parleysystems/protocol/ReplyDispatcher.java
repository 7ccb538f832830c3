package com.parleysystems.protocol;

import com.parleysystems.core.Result;
import com.parleysystems.core.UnknownAgentException;
import com.parleysystems.mailbox.CancellationToken;
import com.parleysystems.mailbox.LinkedMailbox;
import com.parleysystems.mailbox.Mailbox;
import com.parleysystems.mailbox.ReceiveResult;
import com.parleysystems.message.AgentId;
import com.parleysystems.message.Message;
import com.parleysystems.message.MessageId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Files the replies arriving in one requester's mailbox.
 * <p>
 * There is one dispatcher per requester, obtained from
 * {@link com.parleysystems.routing.Router#replyDispatcher(AgentId)} and shared by every
 * {@link RequestReply} whose requester it is. It holds all of that requester's outstanding
 * exchanges, so whichever thread drains the mailbox can resolve any of them, and one side
 * inbox for the messages that answer none.
 * <p>
 * Only one thread drains the mailbox at a time; the others wait on their exchange and take
 * over when it leaves.
 */
public final class ReplyDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(ReplyDispatcher.class);

    // how long a non-draining waiter sleeps before checking whether it can take over
    private static final long HANDOFF_NANOS = TimeUnit.MILLISECONDS.toNanos(10);

    private final AgentId requester;
    private final ConcurrentHashMap<MessageId, Exchange> outstanding = new ConcurrentHashMap<>();
    private final Mailbox<Message> sideInbox = new LinkedMailbox<>();
    private final ReentrantLock drainLock = new ReentrantLock();

    public ReplyDispatcher(AgentId requester) {
        this.requester = requester;
    }

    public AgentId requester() {
        return requester;
    }

    /**
     * Messages taken from the requester's mailbox that answered no outstanding exchange,
     * in arrival order.
     */
    public Mailbox<Message> sideInbox() {
        return sideInbox;
    }

    /**
     * Returns a snapshot of every exchange of this requester still waiting for a reply.
     */
    public Collection<Exchange> outstanding() {
        return new ArrayList<>(outstanding.values());
    }

    Collection<Exchange> outstanding(RequestReply owner) {
        List<Exchange> owned = new ArrayList<>();
        for (Exchange exchange : outstanding.values()) {
            if (exchange.owner() == owner) {
                owned.add(exchange);
            }
        }
        return owned;
    }

    void register(Exchange exchange) {
        MessageId requestId = exchange.request().id();
        if (outstanding.putIfAbsent(requestId, exchange) != null) {
            throw new IllegalStateException("Request " + requestId + " is already outstanding");
        }
    }

    void remove(Exchange exchange) {
        outstanding.remove(exchange.request().id(), exchange);
    }

    /**
     * Cancels every outstanding exchange of this requester.
     *
     * @param cause recorded as the cause of each cancellation, may be null
     * @return the number of exchanges cancelled
     */
    public int cancelAll(Throwable cause) {
        return cancelEach(outstanding(), cause);
    }

    int cancelAll(RequestReply owner, Throwable cause) {
        return cancelEach(outstanding(owner), cause);
    }

    private int cancelEach(Collection<Exchange> exchanges, Throwable cause) {
        int cancelled = 0;
        for (Exchange exchange : exchanges) {
            // one already resolved by a reply or its deadline stays as it is
            if (cancel(exchange, cause)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    boolean cancel(Exchange exchange, Throwable cause) {
        if (!exchange.cancel(cause)) {
            return false;
        }
        remove(exchange);
        logger.debug("Conversation {} cancelled", exchange.conversationId());
        return true;
    }

    /**
     * Waits for the reply to an exchange, draining the requester's mailbox when no other
     * thread does.
     */
    Result<Message> awaitReply(Mailbox<Message> mailbox, Exchange exchange, Duration timeout,
                               CancellationToken token) {
        long timeoutNanos = saturatedNanos(timeout);
        long start = System.nanoTime();
        // wakes the draining thread when the caller cancels or the exchange is resolved elsewhere
        CancellationToken wake = CancellationToken.create();
        exchange.onResolved(wake::cancel);
        try (CancellationToken.Registration ignored = token.onCancel(wake::cancel)) {
            while (!exchange.isResolved()) {
                if (token.isCancelled()) {
                    cancel(exchange, null);
                    break;
                }
                long remaining = timeoutNanos - (System.nanoTime() - start);
                if (remaining <= 0L) {
                    if (exchange.timeOut(timeout)) {
                        remove(exchange);
                        logger.debug("No reply in conversation {} within {}", exchange.conversationId(), timeout);
                    }
                    break;
                }
                if (drainLock.tryLock()) {
                    try {
                        if (!exchange.isResolved()) {
                            pump(mailbox, exchange, remaining, wake);
                        }
                    } finally {
                        drainLock.unlock();
                    }
                } else {
                    exchange.awaitResolution(Math.min(remaining, HANDOFF_NANOS));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(exchange, e);
        }
        return exchange.outcome();
    }

    /**
     * Takes one message from the requester's mailbox and files it. Caller holds the drain lock.
     */
    private void pump(Mailbox<Message> mailbox, Exchange waiting, long remainingNanos, CancellationToken wake) {
        ReceiveResult<Message> received = mailbox.receive(Duration.ofNanos(remainingNanos), wake);
        if (received instanceof ReceiveResult.Received<Message> message) {
            dispatch(message.value());
        } else if (received instanceof ReceiveResult.Closed<?>) {
            logger.debug("Requester {} deregistered while waiting in conversation {}",
                requester, waiting.conversationId());
            cancel(waiting, new UnknownAgentException(requester));
        } else if (received instanceof ReceiveResult.Cancelled<?> && Thread.currentThread().isInterrupted()) {
            cancel(waiting, new InterruptedException("Interrupted while waiting for a reply"));
        }
    }

    private void dispatch(Message message) {
        Exchange target = message.inReplyTo().map(outstanding::get).orElse(null);
        if (target != null && message.isReplyTo(target.request()) && target.complete(message)) {
            remove(target);
            logger.debug("Reply {} resolved conversation {}", message.id(), target.conversationId());
            return;
        }
        sideInbox.send(message);
        logger.debug("Message {} from {} answers no outstanding request, moved to side inbox",
            message.id(), message.sender());
    }

    /**
     * Converts a timeout to nanoseconds, saturating at {@link Long#MAX_VALUE}; negative is zero.
     */
    static long saturatedNanos(Duration timeout) {
        if (timeout.isNegative()) {
            return 0L;
        }
        try {
            return timeout.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    @Override
    public String toString() {
        return "ReplyDispatcher{requester=" + requester + ", outstanding=" + outstanding.size()
            + ", sideInbox=" + sideInbox.size() + "}";
    }
}
