package com.parleysystems.message;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable unit of communication between agents.
 * <p>
 * A message gets a fresh {@link MessageId} and creation timestamp when it is constructed.
 * {@code conversationId} links a request to its replies; {@code inReplyTo} links one reply
 * to the specific request it answers. Both are absent on a freshly built message and are
 * set by protocol layers through {@link #withConversationId(String)} and
 * {@link #withInReplyTo(MessageId)}, which keep the id because they annotate a message
 * that has not been sent yet. {@link #copyTo(AgentId)} and {@link #replyWith(Performative, String)}
 * produce new messages and therefore new ids.
 * <p>
 * The fabric does not check that {@code inReplyTo} references an earlier message of the
 * same conversation; that is the responsibility of the protocol using it.
 */
public final class Message {

    private final MessageId id;
    private final AgentId sender;
    private final AgentId receiver;
    private final Performative performative;
    private final String content;
    private final String conversationId;
    private final MessageId inReplyTo;
    private final Instant createdAt;

    /**
     * Creates a new message with a random id.
     *
     * @param sender the sending agent
     * @param receiver the receiving agent
     * @param performative the speech-act kind
     * @param content the payload
     */
    public Message(AgentId sender, AgentId receiver, Performative performative, String content) {
        this(MessageId.random(), sender, receiver, performative, content, null, null, Instant.now());
    }

    Message(MessageId id, AgentId sender, AgentId receiver, Performative performative,
            String content, String conversationId, MessageId inReplyTo, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.sender = Objects.requireNonNull(sender, "sender cannot be null");
        this.receiver = Objects.requireNonNull(receiver, "receiver cannot be null");
        this.performative = Objects.requireNonNull(performative, "performative cannot be null");
        this.content = Objects.requireNonNull(content, "content cannot be null");
        this.conversationId = conversationId;
        this.inReplyTo = inReplyTo;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt cannot be null");
    }

    public static MessageBuilder builder() {
        return new MessageBuilder();
    }

    public MessageId id() {
        return id;
    }

    public AgentId sender() {
        return sender;
    }

    public AgentId receiver() {
        return receiver;
    }

    public Performative performative() {
        return performative;
    }

    public String content() {
        return content;
    }

    public Optional<String> conversationId() {
        return Optional.ofNullable(conversationId);
    }

    public Optional<MessageId> inReplyTo() {
        return Optional.ofNullable(inReplyTo);
    }

    public Instant createdAt() {
        return createdAt;
    }

    /**
     * Returns a copy of this message tagged with the given conversation id.
     * The copy keeps this message's id and timestamp.
     */
    public Message withConversationId(String conversationId) {
        Objects.requireNonNull(conversationId, "conversationId cannot be null");
        return new Message(id, sender, receiver, performative, content, conversationId, inReplyTo, createdAt);
    }

    /**
     * Returns a copy of this message marked as answering {@code requestId}.
     * The copy keeps this message's id and timestamp.
     */
    public Message withInReplyTo(MessageId requestId) {
        Objects.requireNonNull(requestId, "requestId cannot be null");
        return new Message(id, sender, receiver, performative, content, conversationId, requestId, createdAt);
    }

    /**
     * Returns a new message with the same sender, performative, content and correlation
     * fields, addressed to {@code newReceiver}. The copy has its own id.
     */
    public Message copyTo(AgentId newReceiver) {
        return new Message(MessageId.random(), sender, newReceiver, performative, content,
            conversationId, inReplyTo, Instant.now());
    }

    /**
     * Builds a reply to this message: sender and receiver swapped, same conversation,
     * {@code inReplyTo} set to this message's id.
     */
    public Message replyWith(Performative replyPerformative, String replyContent) {
        return new Message(MessageId.random(), receiver, sender, replyPerformative, replyContent,
            conversationId, id, Instant.now());
    }

    /**
     * Returns true if this message answers {@code request}: same conversation id
     * and {@code inReplyTo} equal to the request's id.
     */
    public boolean isReplyTo(Message request) {
        return inReplyTo != null
            && inReplyTo.equals(request.id)
            && Objects.equals(conversationId, request.conversationId);
    }

    /**
     * Messages are equal when they carry the same id and the same field values.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Message other)) {
            return false;
        }
        return id.equals(other.id)
            && sender.equals(other.sender)
            && receiver.equals(other.receiver)
            && performative == other.performative
            && content.equals(other.content)
            && Objects.equals(conversationId, other.conversationId)
            && Objects.equals(inReplyTo, other.inReplyTo)
            && createdAt.equals(other.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, sender, receiver, performative, conversationId, inReplyTo);
    }

    @Override
    public String toString() {
        return "Message{" +
            "id=" + id +
            ", " + sender + " -> " + receiver +
            ", " + performative +
            (conversationId != null ? ", conversation=" + conversationId : "") +
            (inReplyTo != null ? ", inReplyTo=" + inReplyTo : "") +
            '}';
    }
}
