package com.parleysystems.message;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MessageTest {

    private final AgentId sender = AgentId.random();
    private final AgentId receiver = AgentId.random();

    @Test
    void testCreateMessage() {
        Message msg = new Message(sender, receiver, Performative.INFORM, "test");

        assertEquals(sender, msg.sender());
        assertEquals(receiver, msg.receiver());
        assertEquals(Performative.INFORM, msg.performative());
        assertEquals("test", msg.content());
        assertTrue(msg.conversationId().isEmpty());
        assertTrue(msg.inReplyTo().isEmpty());
        assertNotNull(msg.createdAt());
    }

    @Test
    void testEachMessageGetsDistinctId() {
        Message first = new Message(sender, receiver, Performative.INFORM, "a");
        Message second = new Message(sender, receiver, Performative.INFORM, "a");

        assertNotEquals(first.id(), second.id());
    }

    @Test
    void testRejectsNullFields() {
        assertThrows(NullPointerException.class,
            () -> new Message(null, receiver, Performative.INFORM, "x"));
        assertThrows(NullPointerException.class,
            () -> new Message(sender, null, Performative.INFORM, "x"));
        assertThrows(NullPointerException.class,
            () -> new Message(sender, receiver, null, "x"));
        assertThrows(NullPointerException.class,
            () -> new Message(sender, receiver, Performative.INFORM, null));
    }

    @Test
    void testWithConversationIdKeepsIdentity() {
        Message original = new Message(sender, receiver, Performative.REQUEST, "ping");
        Message tagged = original.withConversationId("conv-1");

        assertEquals(original.id(), tagged.id());
        assertEquals(original.createdAt(), tagged.createdAt());
        assertEquals("conv-1", tagged.conversationId().orElseThrow());
        assertTrue(original.conversationId().isEmpty(), "original must stay untouched");
    }

    @Test
    void testWithInReplyToKeepsIdentity() {
        MessageId requestId = MessageId.random();
        Message original = new Message(sender, receiver, Performative.INFORM, "pong");
        Message reply = original.withInReplyTo(requestId);

        assertEquals(original.id(), reply.id());
        assertEquals(requestId, reply.inReplyTo().orElseThrow());
    }

    @Test
    void testCopyToAssignsNewIdAndReceiver() {
        AgentId other = AgentId.random();
        Message original = new Message(sender, receiver, Performative.INFORM, "hello")
            .withConversationId("conv-2");

        Message copy = original.copyTo(other);

        assertNotEquals(original.id(), copy.id());
        assertEquals(other, copy.receiver());
        assertEquals(sender, copy.sender());
        assertEquals("hello", copy.content());
        assertEquals(Performative.INFORM, copy.performative());
        assertEquals("conv-2", copy.conversationId().orElseThrow());
    }

    @Test
    void testReplyWithSwapsPartiesAndCorrelates() {
        Message request = new Message(sender, receiver, Performative.REQUEST, "ping")
            .withConversationId("conv-3");

        Message reply = request.replyWith(Performative.INFORM, "pong");

        assertEquals(receiver, reply.sender());
        assertEquals(sender, reply.receiver());
        assertEquals("conv-3", reply.conversationId().orElseThrow());
        assertEquals(request.id(), reply.inReplyTo().orElseThrow());
        assertTrue(reply.isReplyTo(request));
    }

    @Test
    void testIsReplyToRequiresMatchingConversation() {
        Message request = new Message(sender, receiver, Performative.REQUEST, "ping")
            .withConversationId("conv-4");
        Message stray = new Message(receiver, sender, Performative.INFORM, "pong")
            .withInReplyTo(request.id())
            .withConversationId("other");

        assertFalse(stray.isReplyTo(request));
        assertFalse(request.isReplyTo(request));
    }

    @Test
    void testEqualityFollowsFields() {
        Message msg = new Message(sender, receiver, Performative.QUERY, "q");

        assertEquals(msg.withConversationId("c"), msg.withConversationId("c"));
        assertNotEquals(msg, msg.withConversationId("c"));
        assertNotEquals(msg, msg.copyTo(receiver));
    }
}
