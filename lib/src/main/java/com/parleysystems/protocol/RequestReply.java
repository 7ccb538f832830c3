package com.parleysystems.protocol;

import com.parleysystems.core.CancelledException;
import com.parleysystems.core.MessagingException;
import com.parleysystems.core.Result;
import com.parleysystems.core.UnknownAgentException;
import com.parleysystems.mailbox.CancellationToken;
import com.parleysystems.mailbox.Mailbox;
import com.parleysystems.mailbox.ReceiveResult;
import com.parleysystems.message.AgentId;
import com.parleysystems.message.Message;
import com.parleysystems.message.MessageId;
import com.parleysystems.message.Performative;
import com.parleysystems.routing.Router;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.UUID;

/**
 * Request/reply conversations between a fixed requester and responder, layered on plain
 * mailbox delivery.
 * <p>
 * The requester sends a request tagged with a conversation id and later waits for the
 * message that answers it: same conversation id, in-reply-to the request id. While it
 * waits, messages pulled from the requester's mailbox are sorted:
 * <ul>
 *   <li>a reply to another outstanding exchange of the requester, made through this or any
 *   other handler, resolves that exchange;</li>
 *   <li>anything else goes, in arrival order, to the {@link #sideInbox()}.</li>
 * </ul>
 * Nothing pulled from the mailbox is dropped or put back. Replies that arrive after their
 * exchange timed out or was cancelled also end up in the side inbox.
 * <p>
 * The bookkeeping lives in the requester's {@link ReplyDispatcher}, so several handlers
 * with the same requester and different responders can wait at once without losing each
 * other's replies.
 *
 * <pre>{@code
 * RequestReply rr = fabric.requestReply(client, server);
 * Exchange exchange = rr.sendRequest(new Message(client, server, Performative.QUERY, "status"));
 * Result<Message> reply = rr.receiveReply(exchange, Duration.ofSeconds(2));
 * }</pre>
 */
public class RequestReply {
    private static final Logger logger = LoggerFactory.getLogger(RequestReply.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final Router router;
    private final AgentId requester;
    private final AgentId responder;
    private final Duration defaultTimeout;

    public RequestReply(Router router, AgentId requester, AgentId responder) {
        this(router, requester, responder, DEFAULT_TIMEOUT);
    }

    /**
     * @param router the router both agents are registered with
     * @param requester the agent sending requests and receiving replies
     * @param responder the agent answering requests
     * @param defaultTimeout used by the reply waits that take no timeout
     */
    public RequestReply(Router router, AgentId requester, AgentId responder, Duration defaultTimeout) {
        this.router = Objects.requireNonNull(router, "router cannot be null");
        this.requester = Objects.requireNonNull(requester, "requester cannot be null");
        this.responder = Objects.requireNonNull(responder, "responder cannot be null");
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout cannot be null");
        if (defaultTimeout.isNegative()) {
            throw new IllegalArgumentException("defaultTimeout cannot be negative: " + defaultTimeout);
        }
    }

    public AgentId requester() {
        return requester;
    }

    public AgentId responder() {
        return responder;
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    /**
     * Messages taken from the requester's mailbox while waiting for a reply that did not
     * answer any outstanding exchange, in arrival order. Shared by every handler of the
     * requester.
     */
    public Mailbox<Message> sideInbox() {
        return router.replyDispatcher(requester).sideInbox();
    }

    /**
     * Returns a snapshot of the exchanges of this handler still waiting for a reply.
     */
    public Collection<Exchange> outstanding() {
        return router.replyDispatcher(requester).outstanding(this);
    }

    // ========== REQUESTER SIDE ==========

    /**
     * Sends a request to the responder. A conversation id is assigned if the message has none.
     *
     * @param request a message from the requester to the responder
     * @return the exchange, in state {@link ExchangeState#REQUEST_SENT} unless a reply or
     *         {@link #cancelAll()} already resolved it
     * @throws IllegalArgumentException if the sender or receiver do not match this handler
     * @throws MessagingException if the request could not be routed
     */
    public Exchange sendRequest(Message request) {
        Objects.requireNonNull(request, "request cannot be null");
        if (!request.sender().equals(requester)) {
            throw new IllegalArgumentException(
                "Request sender " + request.sender() + " is not the requester " + requester);
        }
        if (!request.receiver().equals(responder)) {
            throw new IllegalArgumentException(
                "Request receiver " + request.receiver() + " is not the responder " + responder);
        }
        Message tagged = request.conversationId().isPresent()
            ? request
            : request.withConversationId(UUID.randomUUID().toString());
        Exchange exchange = new Exchange(tagged, this);
        ReplyDispatcher dispatcher = router.replyDispatcher(requester);

        // register before routing so a fast reply always finds its exchange
        dispatcher.register(exchange);
        Result<MessageId> routed = router.route(tagged);
        if (routed.isFailure()) {
            dispatcher.remove(exchange);
            logger.debug("Request {} in conversation {} not sent", tagged.id(), exchange.conversationId());
            routed.getOrThrow();
        }
        exchange.markSent();
        logger.debug("Request {} sent from {} to {} in conversation {}",
            tagged.id(), requester, responder, exchange.conversationId());
        return exchange;
    }

    public Result<Message> receiveReply(Exchange exchange) {
        return receiveReply(exchange, defaultTimeout, CancellationToken.NONE);
    }

    public Result<Message> receiveReply(Exchange exchange, Duration timeout) {
        return receiveReply(exchange, timeout, CancellationToken.NONE);
    }

    /**
     * Waits for the reply to an exchange.
     * <p>
     * Fails with {@link com.parleysystems.core.ReplyTimeoutException} once the timeout
     * elapses and with {@link CancelledException} when the token is cancelled or the thread
     * is interrupted. Either way the exchange is resolved for good: a later call returns the
     * same outcome and a late reply goes to the side inbox. The request is never retracted.
     * A timeout too large to count in nanoseconds waits without a deadline.
     *
     * @param exchange an exchange returned by {@link #sendRequest(Message)} of this handler
     * @param timeout the longest time to wait
     * @param token cancels the wait
     * @return the reply, or why none was received
     */
    public Result<Message> receiveReply(Exchange exchange, Duration timeout, CancellationToken token) {
        Objects.requireNonNull(exchange, "exchange cannot be null");
        Objects.requireNonNull(timeout, "timeout cannot be null");
        Objects.requireNonNull(token, "token cannot be null");
        if (exchange.owner() != this) {
            throw new IllegalArgumentException(exchange + " does not belong to this handler");
        }
        if (exchange.isResolved()) {
            return exchange.outcome();
        }
        Mailbox<Message> mailbox = router.mailbox(requester).orElse(null);
        if (mailbox == null) {
            return Result.failure(new UnknownAgentException(requester));
        }
        return router.replyDispatcher(requester).awaitReply(mailbox, exchange, timeout, token);
    }

    /**
     * Sends a request and waits for its reply with the default timeout.
     */
    public Result<Message> request(Message request) {
        return request(request, defaultTimeout);
    }

    /**
     * Sends a request and waits for its reply. Routing failures are returned, not thrown.
     */
    public Result<Message> request(Message request, Duration timeout) {
        Exchange exchange;
        try {
            exchange = sendRequest(request);
        } catch (MessagingException e) {
            return Result.failure(e);
        }
        return receiveReply(exchange, timeout);
    }

    /**
     * Cancels every outstanding exchange of this handler, including one whose request is
     * still being routed. Threads waiting on them return a cancelled outcome.
     *
     * @return the number of exchanges cancelled
     */
    public int cancelAll() {
        int cancelled = router.replyDispatcher(requester).cancelAll(this, null);
        if (cancelled > 0) {
            logger.debug("Cancelled {} outstanding exchanges between {} and {}", cancelled, requester, responder);
        }
        return cancelled;
    }

    // ========== RESPONDER SIDE ==========

    /**
     * Waits without a deadline for the next message in the responder's mailbox.
     *
     * @throws UnknownAgentException if the responder is not registered
     * @throws com.parleysystems.core.MailboxClosedException if the responder is deregistered while waiting
     */
    public Message receiveRequest() throws InterruptedException {
        return responderMailbox().receive();
    }

    public ReceiveResult<Message> receiveRequest(Duration timeout) {
        return receiveRequest(timeout, CancellationToken.NONE);
    }

    /**
     * Waits for the next message in the responder's mailbox. Any message is returned as it is.
     */
    public ReceiveResult<Message> receiveRequest(Duration timeout, CancellationToken token) {
        return responderMailbox().receive(timeout, token);
    }

    /**
     * Sends a reply to a request, tagging it with the request's conversation and id.
     *
     * @param request the request being answered
     * @param reply a message addressed to the request's sender
     * @return the id of the routed reply, or why it was not delivered
     */
    public Result<MessageId> sendReply(Message request, Message reply) {
        Objects.requireNonNull(request, "request cannot be null");
        Objects.requireNonNull(reply, "reply cannot be null");
        if (!reply.receiver().equals(request.sender())) {
            throw new IllegalArgumentException(
                "Reply receiver " + reply.receiver() + " is not the request sender " + request.sender());
        }
        Message tagged = reply.withInReplyTo(request.id());
        if (request.conversationId().isPresent()) {
            tagged = tagged.withConversationId(request.conversationId().get());
        }
        return router.route(tagged);
    }

    /**
     * Builds the reply from the request and sends it back to the request's sender.
     */
    public Result<MessageId> sendReply(Message request, Performative performative, String content) {
        Objects.requireNonNull(request, "request cannot be null");
        return router.route(request.replyWith(performative, content));
    }

    private Mailbox<Message> responderMailbox() {
        return router.mailbox(responder).orElseThrow(() -> new UnknownAgentException(responder));
    }
}
