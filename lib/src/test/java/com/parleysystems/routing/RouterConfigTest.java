package com.parleysystems.routing;

import com.parleysystems.mailbox.OverflowPolicy;
import com.parleysystems.mailbox.config.MailboxConfig;
import com.parleysystems.message.AgentId;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RouterConfigTest {

    @Test
    void shouldUseDefaults() {
        var config = new RouterConfig();

        assertEquals(RouterConfig.DEFAULT_HISTORY_MAX_SIZE, config.getHistoryMaxSize());
        assertEquals(RouterConfig.DEFAULT_HISTORY_RETENTION, config.getHistoryRetention());
        assertFalse(config.getDefaultMailboxConfig().isBounded());
    }

    @Test
    void shouldApplyDefaultMailboxConfigOnRegister() {
        var config = new RouterConfig()
            .setDefaultMailboxConfig(MailboxConfig.bounded(4, OverflowPolicy.DROP_OLDEST))
            .setHistoryRetention(null);
        var router = new Router(config);

        var mailbox = router.register(AgentId.of("A"));

        assertEquals(4, mailbox.capacity());
        assertEquals(OverflowPolicy.DROP_OLDEST, mailbox.overflowPolicy());
        assertNull(config.getHistoryRetention());
        router.shutdown();
    }

    @Test
    void shouldRejectInvalidBounds() {
        var config = new RouterConfig();

        assertThrows(IllegalArgumentException.class, () -> config.setHistoryMaxSize(0));
        assertThrows(IllegalArgumentException.class, () -> config.setHistoryRetention(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> config.setHistoryRetention(Duration.ofSeconds(-1)));
        assertThrows(NullPointerException.class, () -> config.setDefaultMailboxConfig(null));
    }
}
