package com.parleysystems.message;

import java.time.Instant;

/**
 * Fluent builder for {@link Message}.
 * <p>
 * Sender, receiver, performative and content are required. Conversation id, reply
 * reference and the id generator are optional.
 *
 * <pre>{@code
 * Message request = Message.builder()
 *     .sender(alice)
 *     .receiver(bob)
 *     .performative(Performative.REQUEST)
 *     .content("ping")
 *     .conversationId("c-42")
 *     .build();
 * }</pre>
 */
public class MessageBuilder {

    private AgentId sender;
    private AgentId receiver;
    private Performative performative;
    private String content;
    private String conversationId;
    private MessageId inReplyTo;
    private IdGenerator idGenerator = IdGenerator.UUID;

    public MessageBuilder sender(AgentId sender) {
        this.sender = sender;
        return this;
    }

    public MessageBuilder receiver(AgentId receiver) {
        this.receiver = receiver;
        return this;
    }

    public MessageBuilder performative(Performative performative) {
        this.performative = performative;
        return this;
    }

    public MessageBuilder content(String content) {
        this.content = content;
        return this;
    }

    public MessageBuilder conversationId(String conversationId) {
        this.conversationId = conversationId;
        return this;
    }

    public MessageBuilder inReplyTo(MessageId inReplyTo) {
        this.inReplyTo = inReplyTo;
        return this;
    }

    /**
     * Sets the strategy used to create the message id. Defaults to {@link IdGenerator#UUID}.
     */
    public MessageBuilder idGenerator(IdGenerator idGenerator) {
        this.idGenerator = idGenerator;
        return this;
    }

    /**
     * Builds the message.
     *
     * @return the new message
     * @throws IllegalStateException if a required field has not been set
     */
    public Message build() {
        require(sender, "sender");
        require(receiver, "receiver");
        require(performative, "performative");
        require(content, "content");
        require(idGenerator, "idGenerator");
        return new Message(MessageId.generate(idGenerator), sender, receiver, performative, content,
            conversationId, inReplyTo, Instant.now());
    }

    private static void require(Object value, String field) {
        if (value == null) {
            throw new IllegalStateException(field + " required");
        }
    }
}
