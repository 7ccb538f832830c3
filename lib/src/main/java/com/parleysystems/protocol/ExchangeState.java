package com.parleysystems.protocol;

/**
 * Lifecycle of one request/reply exchange.
 * <p>
 * {@code IDLE -> REQUEST_SENT -> (REPLIED | TIMED_OUT | CANCELLED)}. Terminal states are final.
 */
public enum ExchangeState {
    IDLE,
    REQUEST_SENT,
    REPLIED,
    TIMED_OUT,
    CANCELLED;

    public boolean isTerminal() {
        return this == REPLIED || this == TIMED_OUT || this == CANCELLED;
    }
}
