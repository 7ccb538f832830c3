package com.parleysystems.test;

import com.parleysystems.mailbox.Mailbox;
import com.parleysystems.message.AgentId;
import com.parleysystems.message.Message;
import com.parleysystems.routing.Router;

import java.time.Duration;
import java.util.Objects;

/**
 * Read-only view of a mailbox's depth and capacity for assertions on backpressure.
 *
 * <pre>{@code
 * MailboxInspector inspector = MailboxInspector.of(router, agent);
 * assertTrue(inspector.fillRatio() < 0.8);
 * }</pre>
 */
public class MailboxInspector {

    private final Mailbox<?> mailbox;

    private MailboxInspector(Mailbox<?> mailbox) {
        this.mailbox = mailbox;
    }

    public static MailboxInspector of(Mailbox<?> mailbox) {
        return new MailboxInspector(Objects.requireNonNull(mailbox, "mailbox cannot be null"));
    }

    /**
     * Inspects the mailbox of a registered agent.
     *
     * @throws IllegalArgumentException if the agent is not registered
     */
    public static MailboxInspector of(Router router, AgentId agentId) {
        Mailbox<Message> mailbox = router.mailbox(agentId)
            .orElseThrow(() -> new IllegalArgumentException("Agent " + agentId + " is not registered"));
        return new MailboxInspector(mailbox);
    }

    public int size() {
        return mailbox.size();
    }

    public int capacity() {
        return mailbox.capacity();
    }

    public boolean isBounded() {
        return mailbox.capacity() != Mailbox.UNBOUNDED;
    }

    public boolean isEmpty() {
        return mailbox.isEmpty();
    }

    public boolean isClosed() {
        return mailbox.isClosed();
    }

    /**
     * Size over capacity, 0.0 for unbounded mailboxes.
     */
    public double fillRatio() {
        if (!isBounded()) {
            return 0.0;
        }
        return (double) mailbox.size() / mailbox.capacity();
    }

    public boolean isFull() {
        return isBounded() && mailbox.remainingCapacity() == 0;
    }

    public void awaitSize(int expected, Duration timeout) {
        AsyncAssertion.awaitValue(mailbox::size, expected, timeout);
    }

    public void awaitEmpty(Duration timeout) {
        AsyncAssertion.eventually(mailbox::isEmpty, timeout);
    }

    @Override
    public String toString() {
        return "MailboxInspector{size=" + size()
            + ", capacity=" + (isBounded() ? String.valueOf(capacity()) : "unbounded")
            + ", fillRatio=" + String.format("%.2f", fillRatio()) + "}";
    }
}
