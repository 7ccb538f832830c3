package com.parleysystems.routing;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.parleysystems.message.MessageId;

import java.time.Duration;

/**
 * Remembers the ids of messages the router delivered, for {@link Router#hasRouted(MessageId)}.
 * <p>
 * The record is bounded by size and, optionally, by age. An evicted id reads as never routed:
 * callers must treat the history as a recent-delivery membership check, not an audit log.
 */
public class DeliveryHistory {

    private final Cache<MessageId, Boolean> routed;

    /**
     * Creates a history with the given bounds.
     *
     * @param maxSize the maximum number of ids kept
     * @param retention how long an id is kept after it was recorded, or null for no time limit
     */
    public DeliveryHistory(long maxSize, Duration retention) {
        this(maxSize, retention, Ticker.systemTicker());
    }

    DeliveryHistory(long maxSize, Duration retention, Ticker ticker) {
        // evict on the calling thread so size and expiry are exact after cleanUp
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
            .maximumSize(maxSize)
            .executor(Runnable::run)
            .ticker(ticker);
        if (retention != null) {
            builder.expireAfterWrite(retention);
        }
        this.routed = builder.build();
    }

    static DeliveryHistory from(RouterConfig config) {
        return new DeliveryHistory(config.getHistoryMaxSize(), config.getHistoryRetention());
    }

    /**
     * Records a successfully routed message id.
     *
     * @param messageId the id of the delivered message
     */
    public void record(MessageId messageId) {
        routed.put(messageId, Boolean.TRUE);
    }

    /**
     * Checks whether an id was recorded and has not been evicted.
     *
     * @param messageId the id of the message
     * @return true if the message was routed recently
     */
    public boolean contains(MessageId messageId) {
        return routed.getIfPresent(messageId) != null;
    }

    /**
     * Returns the approximate number of remembered ids.
     */
    public long size() {
        routed.cleanUp();
        return routed.estimatedSize();
    }

    public void clear() {
        routed.invalidateAll();
    }
}
