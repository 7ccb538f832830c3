package com.parleysystems.message;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MessageBuilderTest {

    @Test
    void testBuildsMessage() {
        AgentId sender = AgentId.random();
        AgentId receiver = AgentId.random();

        Message msg = Message.builder()
            .sender(sender)
            .receiver(receiver)
            .performative(Performative.REQUEST)
            .content("Hello")
            .build();

        assertEquals(sender, msg.sender());
        assertEquals(receiver, msg.receiver());
        assertEquals(Performative.REQUEST, msg.performative());
        assertEquals("Hello", msg.content());
    }

    @Test
    void testAppliesOptionalCorrelationFields() {
        MessageId requestId = MessageId.random();

        Message msg = Message.builder()
            .sender(AgentId.of("a"))
            .receiver(AgentId.of("b"))
            .performative(Performative.INFORM)
            .content("answer")
            .conversationId("conv-9")
            .inReplyTo(requestId)
            .build();

        assertEquals("conv-9", msg.conversationId().orElseThrow());
        assertEquals(requestId, msg.inReplyTo().orElseThrow());
    }

    @Test
    void testUsesIdGenerator() {
        IdGenerator generator = IdGenerator.prefixed("msg");

        Message first = builderWithRequiredFields().idGenerator(generator).build();
        Message second = builderWithRequiredFields().idGenerator(generator).build();

        assertEquals("msg:1", first.id().value());
        assertEquals("msg:2", second.id().value());
    }

    @Test
    void testMissingRequiredFieldFails() {
        MessageBuilder builder = Message.builder()
            .sender(AgentId.of("a"))
            .performative(Performative.INFORM)
            .content("x");

        IllegalStateException e = assertThrows(IllegalStateException.class, builder::build);
        assertTrue(e.getMessage().contains("receiver"));
    }

    private static MessageBuilder builderWithRequiredFields() {
        return Message.builder()
            .sender(AgentId.of("a"))
            .receiver(AgentId.of("b"))
            .performative(Performative.INFORM)
            .content("x");
    }
}
