package com.parleysystems.mailbox.config;

import com.parleysystems.mailbox.LinkedMailbox;
import com.parleysystems.mailbox.Mailbox;
import com.parleysystems.mailbox.MpscMailbox;
import com.parleysystems.mailbox.OverflowPolicy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class DefaultMailboxProviderTest {

    private final DefaultMailboxProvider<String> provider = new DefaultMailboxProvider<>();

    @Test
    void testDefaultIsUnboundedLinkedMailbox() {
        Mailbox<String> mailbox = provider.createMailbox(null);

        assertInstanceOf(LinkedMailbox.class, mailbox);
        assertEquals(Mailbox.UNBOUNDED, mailbox.capacity());
    }

    @Test
    void testBoundedConfigHonoursPolicy() {
        Mailbox<String> mailbox = provider.createMailbox(MailboxConfig.bounded(5, OverflowPolicy.REJECT_NEW));

        assertInstanceOf(LinkedMailbox.class, mailbox);
        assertEquals(5, mailbox.capacity());
        assertEquals(OverflowPolicy.REJECT_NEW, mailbox.overflowPolicy());
    }

    @Test
    void testHighThroughputConfigCreatesMpscMailbox() {
        Mailbox<String> mailbox = provider.createMailbox(MailboxConfig.highThroughput());

        assertInstanceOf(MpscMailbox.class, mailbox);
    }

    @Test
    void testBoundedMpscRejected() {
        MailboxConfig config = MailboxConfig.highThroughput().setCapacity(10);

        assertThrows(IllegalArgumentException.class, () -> provider.createMailbox(config));
    }

    @Test
    void testNonPositiveCapacityRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> provider.createMailbox(new MailboxConfig().setCapacity(0)));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testCustomStrategyIsUsed() {
        MailboxCreationStrategy<String> strategy = mock(MailboxCreationStrategy.class);
        Mailbox<String> custom = new LinkedMailbox<>(3);
        when(strategy.createMailbox(any())).thenReturn(custom);

        provider.withStrategy(MailboxType.LINKED, strategy);

        assertSame(custom, provider.createMailbox(MailboxConfig.unbounded()));
        verify(strategy).createMailbox(any(MailboxConfig.class));
    }
}
