package com.parleysystems.mailbox;

import java.time.Duration;

final class Durations {

    private Durations() {
    }

    /**
     * Converts a timeout to nanoseconds, saturating at {@link Long#MAX_VALUE}.
     * A null timeout means no deadline.
     */
    static long toNanos(Duration timeout) {
        if (timeout == null) {
            return Long.MAX_VALUE;
        }
        if (timeout.isNegative()) {
            return 0L;
        }
        try {
            return timeout.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
