package com.parleysystems.routing;

import com.parleysystems.core.CancelledException;
import com.parleysystems.core.MailboxClosedException;
import com.parleysystems.core.MailboxFullException;
import com.parleysystems.core.Result;
import com.parleysystems.core.UnknownAgentException;
import com.parleysystems.mailbox.CancellationToken;
import com.parleysystems.mailbox.Mailbox;
import com.parleysystems.mailbox.SendResult;
import com.parleysystems.mailbox.config.DefaultMailboxProvider;
import com.parleysystems.mailbox.config.MailboxConfig;
import com.parleysystems.mailbox.config.MailboxProvider;
import com.parleysystems.message.AgentId;
import com.parleysystems.message.Message;
import com.parleysystems.message.MessageId;
import com.parleysystems.protocol.ReplyDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Delivers messages between agents by looking up the receiver's mailbox.
 * <p>
 * The router owns one mailbox per registered agent, a bounded history of the ids it
 * delivered, and the topic subscriptions. Routers are independent of each other; several
 * can coexist in one process.
 * <p>
 * Concurrency: the registry is a {@link ConcurrentHashMap} with atomic create-or-return
 * registration. No lock spans the registry and a mailbox, so senders to different agents
 * never contend. Enqueue happens before the id is recorded, so {@link #hasRouted(MessageId)}
 * never reports a message that was not delivered.
 */
public class Router {
    private static final Logger logger = LoggerFactory.getLogger(Router.class);

    private final ConcurrentHashMap<AgentId, Mailbox<Message>> mailboxes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<AgentId, ReplyDispatcher> replyDispatchers = new ConcurrentHashMap<>();
    private final TopicRegistry topics = new TopicRegistry();
    private final DeliveryHistory history;
    private final MailboxProvider<Message> mailboxProvider;
    private final MailboxConfig defaultMailboxConfig;

    /**
     * Creates a router with default configuration.
     */
    public Router() {
        this(new RouterConfig());
    }

    public Router(RouterConfig config) {
        this(config, new DefaultMailboxProvider<>());
    }

    /**
     * Creates a router with a custom mailbox provider.
     *
     * @param config the router configuration
     * @param mailboxProvider creates the mailbox of each registered agent
     */
    public Router(RouterConfig config, MailboxProvider<Message> mailboxProvider) {
        this(config, mailboxProvider, DeliveryHistory.from(config));
    }

    Router(RouterConfig config, MailboxProvider<Message> mailboxProvider, DeliveryHistory history) {
        Objects.requireNonNull(config, "config cannot be null");
        this.mailboxProvider = Objects.requireNonNull(mailboxProvider, "mailboxProvider cannot be null");
        this.defaultMailboxConfig = config.getDefaultMailboxConfig();
        this.history = Objects.requireNonNull(history, "history cannot be null");
        logger.debug("Router created with {}", config);
    }

    // ========== REGISTRY ==========

    /**
     * Registers an agent with the default mailbox configuration.
     * Registering an id twice returns the mailbox created the first time.
     *
     * @param agentId the agent to register
     * @return the agent's mailbox
     */
    public Mailbox<Message> register(AgentId agentId) {
        return register(agentId, defaultMailboxConfig);
    }

    /**
     * Registers an agent with its own mailbox configuration.
     * The configuration is ignored if the agent is already registered.
     *
     * @param agentId the agent to register
     * @param config the mailbox configuration
     * @return the agent's mailbox
     */
    public Mailbox<Message> register(AgentId agentId, MailboxConfig config) {
        Objects.requireNonNull(agentId, "agentId cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
        return mailboxes.computeIfAbsent(agentId, id -> {
            Mailbox<Message> mailbox = mailboxProvider.createMailbox(config);
            logger.debug("Registered agent {} with {}", id, mailbox);
            return mailbox;
        });
    }

    /**
     * Attaches a mailbox created by the caller.
     *
     * @param agentId the agent to register
     * @param mailbox the mailbox to attach
     * @return the attached mailbox
     * @throws IllegalStateException if a different mailbox is already registered for the agent
     * @throws IllegalArgumentException if the mailbox is closed
     */
    public Mailbox<Message> register(AgentId agentId, Mailbox<Message> mailbox) {
        Objects.requireNonNull(agentId, "agentId cannot be null");
        Objects.requireNonNull(mailbox, "mailbox cannot be null");
        if (mailbox.isClosed()) {
            throw new IllegalArgumentException("Cannot register a closed mailbox for agent " + agentId);
        }
        Mailbox<Message> existing = mailboxes.putIfAbsent(agentId, mailbox);
        if (existing != null && existing != mailbox) {
            throw new IllegalStateException("Agent " + agentId + " is already registered with another mailbox");
        }
        if (existing == null) {
            logger.debug("Registered agent {} with provided {}", agentId, mailbox);
        }
        return mailbox;
    }

    /**
     * Removes an agent. Its mailbox is closed, its topic subscriptions are dropped, the
     * requests it still waits on are cancelled and the messages still queued are handed
     * back to the caller.
     *
     * @param agentId the agent to remove
     * @return the undelivered messages in arrival order, empty if the agent was unknown
     */
    public List<Message> deregister(AgentId agentId) {
        Objects.requireNonNull(agentId, "agentId cannot be null");
        Mailbox<Message> mailbox = mailboxes.remove(agentId);
        int topicCount = topics.unsubscribeAll(agentId);
        ReplyDispatcher dispatcher = replyDispatchers.remove(agentId);
        if (dispatcher != null) {
            dispatcher.cancelAll(new UnknownAgentException(agentId));
        }
        if (mailbox == null) {
            return Collections.emptyList();
        }
        // close first so every send either landed before the drain or fails
        mailbox.close();
        List<Message> remaining = mailbox.drain();
        logger.debug("Deregistered agent {} ({} queued messages returned, {} topics left)",
            agentId, remaining.size(), topicCount);
        return remaining;
    }

    public boolean isRegistered(AgentId agentId) {
        return mailboxes.containsKey(agentId);
    }

    public Optional<Mailbox<Message>> mailbox(AgentId agentId) {
        return Optional.ofNullable(mailboxes.get(agentId));
    }

    /**
     * Returns the reply bookkeeping of a requester, shared by every request/reply handler
     * whose requester it is. Dropped when the agent is deregistered.
     *
     * @param requester the agent waiting for replies
     * @return the requester's dispatcher, created on first use
     */
    public ReplyDispatcher replyDispatcher(AgentId requester) {
        Objects.requireNonNull(requester, "requester cannot be null");
        return replyDispatchers.computeIfAbsent(requester, ReplyDispatcher::new);
    }

    public int agentCount() {
        return mailboxes.size();
    }

    /**
     * Returns a sorted snapshot of the registered agent ids.
     */
    public Set<AgentId> registeredAgents() {
        return Collections.unmodifiableSet(new TreeSet<>(mailboxes.keySet()));
    }

    // ========== DELIVERY ==========

    /**
     * Delivers a message to its receiver's mailbox.
     * A BLOCK-policy mailbox that is full makes this call wait for space.
     *
     * @param message the message to deliver
     * @return the message id, or the reason it was not delivered
     */
    public Result<MessageId> route(Message message) {
        Objects.requireNonNull(message, "message cannot be null");
        AgentId receiver = message.receiver();
        Mailbox<Message> mailbox = mailboxes.get(receiver);
        if (mailbox == null) {
            logger.warn("Failed to route message {} to agent {}: agent not registered", message.id(), receiver);
            return Result.failure(new UnknownAgentException(receiver));
        }
        try {
            mailbox.send(message);
        } catch (MailboxClosedException e) {
            logger.warn("Failed to route message {} to agent {}: agent deregistered", message.id(), receiver);
            return Result.failure(new UnknownAgentException(receiver, e));
        } catch (MailboxFullException e) {
            logger.debug("Rejected message {} for agent {}: mailbox full ({})", message.id(), receiver, e.getCapacity());
            return Result.failure(e);
        } catch (CancelledException e) {
            logger.debug("Routing of message {} to agent {} interrupted", message.id(), receiver);
            return Result.failure(e);
        }
        history.record(message.id());
        return Result.success(message.id());
    }

    /**
     * Delivers a message, waiting at most {@code timeout} for space in a full mailbox.
     * A wait that runs out fails with {@link MailboxFullException}; a cancelled one with
     * {@link CancelledException}.
     *
     * @param message the message to deliver
     * @param timeout the longest time to wait for space
     * @param token cancels the wait
     * @return the message id, or the reason it was not delivered
     */
    public Result<MessageId> route(Message message, Duration timeout, CancellationToken token) {
        Objects.requireNonNull(message, "message cannot be null");
        Objects.requireNonNull(token, "token cannot be null");
        AgentId receiver = message.receiver();
        Mailbox<Message> mailbox = mailboxes.get(receiver);
        if (mailbox == null) {
            logger.warn("Failed to route message {} to agent {}: agent not registered", message.id(), receiver);
            return Result.failure(new UnknownAgentException(receiver));
        }
        SendResult sent = mailbox.send(message, timeout, token);
        switch (sent) {
            case ACCEPTED:
                history.record(message.id());
                return Result.success(message.id());
            case FULL:
            case TIMED_OUT:
                logger.debug("Rejected message {} for agent {}: mailbox full ({})", message.id(), receiver, sent);
                return Result.failure(new MailboxFullException(mailbox.capacity()));
            case CANCELLED:
                return Result.failure(new CancelledException("Routing of message " + message.id() + " cancelled"));
            case CLOSED:
            default:
                logger.warn("Failed to route message {} to agent {}: agent deregistered", message.id(), receiver);
                return Result.failure(new UnknownAgentException(receiver));
        }
    }

    /**
     * Checks whether a message was delivered by this router. Only successful deliveries
     * are recorded; ids older than the history bounds read as not routed.
     *
     * @param messageId the id returned by {@link #route(Message)}
     * @return true if the message was delivered and is still remembered
     */
    public boolean hasRouted(MessageId messageId) {
        Objects.requireNonNull(messageId, "messageId cannot be null");
        return history.contains(messageId);
    }

    /**
     * Sends a copy of the template to every target. Each copy gets a fresh id and is routed
     * independently: one failing target does not stop the others. A target listed twice
     * is sent one copy.
     *
     * @param template the message to copy; its receiver is ignored
     * @param targets the receivers
     * @return the outcome per target, in the order the targets were given
     */
    public Map<AgentId, Result<MessageId>> broadcast(Message template, Collection<AgentId> targets) {
        Objects.requireNonNull(template, "template cannot be null");
        Objects.requireNonNull(targets, "targets cannot be null");
        Map<AgentId, Result<MessageId>> results = new LinkedHashMap<>();
        for (AgentId target : new LinkedHashSet<>(targets)) {
            results.put(target, route(template.copyTo(target)));
        }
        return results;
    }

    // ========== TOPICS ==========

    /**
     * Subscribes a registered agent to a topic.
     *
     * @param agentId the subscriber
     * @param topic the topic name
     * @return true if the agent was not subscribed before
     * @throws UnknownAgentException if the agent is not registered
     */
    public boolean subscribe(AgentId agentId, String topic) {
        Objects.requireNonNull(agentId, "agentId cannot be null");
        Objects.requireNonNull(topic, "topic cannot be null");
        if (!isRegistered(agentId)) {
            throw new UnknownAgentException(agentId);
        }
        boolean added = topics.subscribe(topic, agentId);
        if (added) {
            logger.debug("Agent {} subscribed to topic {}", agentId, topic);
        }
        return added;
    }

    public boolean unsubscribe(AgentId agentId, String topic) {
        Objects.requireNonNull(agentId, "agentId cannot be null");
        Objects.requireNonNull(topic, "topic cannot be null");
        return topics.unsubscribe(topic, agentId);
    }

    /**
     * Returns a sorted snapshot of the topic's subscribers.
     */
    public Set<AgentId> subscribers(String topic) {
        Objects.requireNonNull(topic, "topic cannot be null");
        return topics.subscribers(topic);
    }

    public Set<String> topics() {
        return topics.topics();
    }

    /**
     * Broadcasts a copy of the template to the current subscribers of a topic.
     *
     * @param topic the topic name
     * @param template the message to copy; its receiver is ignored
     * @return the outcome per subscriber, empty if the topic has none
     */
    public Map<AgentId, Result<MessageId>> publish(String topic, Message template) {
        Set<AgentId> members = subscribers(topic);
        if (members.isEmpty()) {
            logger.debug("Topic {} has no subscribers, message {} not published", topic, template.id());
            return Collections.emptyMap();
        }
        return broadcast(template, members);
    }

    // ========== LIFECYCLE ==========

    /**
     * Deregisters every agent, closing their mailboxes. The delivery history is kept.
     *
     * @return the number of undelivered messages discarded
     */
    public int shutdown() {
        List<AgentId> agents = new ArrayList<>(mailboxes.keySet());
        int discarded = 0;
        for (AgentId agentId : agents) {
            discarded += deregister(agentId).size();
        }
        logger.info("Router shut down: {} agents deregistered, {} undelivered messages discarded",
            agents.size(), discarded);
        return discarded;
    }

    /**
     * Returns the approximate number of ids in the delivery history.
     */
    public long historySize() {
        return history.size();
    }
}
