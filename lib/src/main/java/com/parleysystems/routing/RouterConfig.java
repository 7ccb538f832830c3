package com.parleysystems.routing;

import com.parleysystems.mailbox.config.MailboxConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for a {@link Router}: the mailbox created on registration and
 * the bounds of the delivery history.
 */
public class RouterConfig {
    public static final long DEFAULT_HISTORY_MAX_SIZE = 100_000;
    public static final Duration DEFAULT_HISTORY_RETENTION = Duration.ofMinutes(10);

    private MailboxConfig defaultMailboxConfig;
    private long historyMaxSize;
    private Duration historyRetention;

    /**
     * Creates a new RouterConfig with default values: unbounded linked mailboxes,
     * a history of at most 100 000 ids kept for 10 minutes.
     */
    public RouterConfig() {
        this.defaultMailboxConfig = MailboxConfig.unbounded();
        this.historyMaxSize = DEFAULT_HISTORY_MAX_SIZE;
        this.historyRetention = DEFAULT_HISTORY_RETENTION;
    }

    /**
     * Sets the mailbox configuration used by {@link Router#register(com.parleysystems.message.AgentId)}.
     *
     * @param defaultMailboxConfig the mailbox configuration
     * @return This RouterConfig instance
     */
    public RouterConfig setDefaultMailboxConfig(MailboxConfig defaultMailboxConfig) {
        this.defaultMailboxConfig = Objects.requireNonNull(defaultMailboxConfig, "defaultMailboxConfig");
        return this;
    }

    public MailboxConfig getDefaultMailboxConfig() {
        return defaultMailboxConfig;
    }

    /**
     * Sets how many routed message ids the history keeps. Older ids are evicted first.
     *
     * @param historyMaxSize the maximum number of ids, must be positive
     * @return This RouterConfig instance
     */
    public RouterConfig setHistoryMaxSize(long historyMaxSize) {
        if (historyMaxSize <= 0) {
            throw new IllegalArgumentException("historyMaxSize must be positive: " + historyMaxSize);
        }
        this.historyMaxSize = historyMaxSize;
        return this;
    }

    public long getHistoryMaxSize() {
        return historyMaxSize;
    }

    /**
     * Sets how long a routed id is remembered. Null disables time-based eviction.
     *
     * @param historyRetention the retention window, or null
     * @return This RouterConfig instance
     */
    public RouterConfig setHistoryRetention(Duration historyRetention) {
        if (historyRetention != null && (historyRetention.isZero() || historyRetention.isNegative())) {
            throw new IllegalArgumentException("historyRetention must be positive: " + historyRetention);
        }
        this.historyRetention = historyRetention;
        return this;
    }

    public Duration getHistoryRetention() {
        return historyRetention;
    }

    @Override
    public String toString() {
        return "RouterConfig{" +
            "defaultMailboxConfig=" + defaultMailboxConfig +
            ", historyMaxSize=" + historyMaxSize +
            ", historyRetention=" + historyRetention +
            '}';
    }
}
