package com.parleysystems.core;

import java.time.Duration;

/**
 * Reported when no correlated reply was observed before the deadline of a request.
 */
public class ReplyTimeoutException extends MessagingException {

    private final String conversationId;
    private final Duration timeout;

    public ReplyTimeoutException(String conversationId, Duration timeout) {
        super(ErrorKind.REPLY_TIMEOUT,
            "No reply for conversation " + conversationId + " within " + timeout);
        this.conversationId = conversationId;
        this.timeout = timeout;
    }

    public String getConversationId() {
        return conversationId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
