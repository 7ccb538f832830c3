package com.parleysystems;

import com.parleysystems.mailbox.Mailbox;
import com.parleysystems.mailbox.config.MailboxConfig;
import com.parleysystems.message.AgentId;
import com.parleysystems.message.IdGenerator;
import com.parleysystems.message.Message;
import com.parleysystems.message.Performative;
import com.parleysystems.protocol.RequestReply;
import com.parleysystems.routing.Router;
import com.parleysystems.routing.RouterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The messaging context shared by a group of agents.
 * <p>
 * A fabric owns one {@link Router}, generates agent and message ids, and tracks the
 * {@link RequestReply} handlers it created so that {@link #shutdown()} can cancel their
 * outstanding exchanges. Fabrics are independent: several may coexist in one process.
 *
 * <pre>{@code
 * MessagingFabric fabric = new MessagingFabric();
 * AgentId a = fabric.newAgentId();
 * AgentId b = fabric.newAgentId();
 * Mailbox<Message> inbox = fabric.register(b);
 * fabric.register(a);
 * fabric.router().route(fabric.newMessage(a, b, Performative.INFORM, "ping"));
 * }</pre>
 */
public class MessagingFabric {
    private static final Logger logger = LoggerFactory.getLogger(MessagingFabric.class);

    private final Router router;
    private final IdGenerator agentIds;
    private final IdGenerator messageIds;
    private final List<RequestReply> protocols = new CopyOnWriteArrayList<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public MessagingFabric() {
        this(new RouterConfig());
    }

    public MessagingFabric(RouterConfig config) {
        this(new Router(config), IdGenerator.prefixed("agent"), IdGenerator.UUID);
    }

    /**
     * Creates a fabric around an existing router.
     *
     * @param router the router agents are registered with
     * @param agentIds generates the ids returned by {@link #newAgentId()}
     * @param messageIds generates the ids of messages built by {@link #newMessage}
     */
    public MessagingFabric(Router router, IdGenerator agentIds, IdGenerator messageIds) {
        this.router = Objects.requireNonNull(router, "router cannot be null");
        this.agentIds = Objects.requireNonNull(agentIds, "agentIds cannot be null");
        this.messageIds = Objects.requireNonNull(messageIds, "messageIds cannot be null");
    }

    public Router router() {
        return router;
    }

    /**
     * Generates a fresh agent id. The id is not registered.
     */
    public AgentId newAgentId() {
        return AgentId.generate(agentIds);
    }

    public Mailbox<Message> register(AgentId agentId) {
        checkRunning();
        return router.register(agentId);
    }

    public Mailbox<Message> register(AgentId agentId, MailboxConfig config) {
        checkRunning();
        return router.register(agentId, config);
    }

    /**
     * Builds a message whose id comes from this fabric's message id generator.
     */
    public Message newMessage(AgentId sender, AgentId receiver, Performative performative, String content) {
        return Message.builder()
            .idGenerator(messageIds)
            .sender(sender)
            .receiver(receiver)
            .performative(performative)
            .content(content)
            .build();
    }

    public RequestReply requestReply(AgentId requester, AgentId responder) {
        return requestReply(requester, responder, RequestReply.DEFAULT_TIMEOUT);
    }

    /**
     * Creates a request/reply handler between two agents of this fabric.
     */
    public RequestReply requestReply(AgentId requester, AgentId responder, Duration defaultTimeout) {
        checkRunning();
        RequestReply protocol = new RequestReply(router, requester, responder, defaultTimeout);
        protocols.add(protocol);
        return protocol;
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * Cancels every outstanding exchange and deregisters every agent. Calling it again has no effect.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        logger.info("Shutting down messaging fabric");
        int cancelled = 0;
        for (RequestReply protocol : protocols) {
            cancelled += protocol.cancelAll();
        }
        protocols.clear();
        router.shutdown();
        logger.info("Messaging fabric shut down, {} outstanding exchanges cancelled", cancelled);
    }

    private void checkRunning() {
        if (shutdown.get()) {
            throw new IllegalStateException("Messaging fabric is shut down");
        }
    }
}
