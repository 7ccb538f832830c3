package com.parleysystems.test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Polling assertions for conditions that become true on another thread, such as a
 * mailbox filling up or a reply being filed.
 *
 * <pre>{@code
 * AsyncAssertion.eventually(() -> inbox.size() == 3, Duration.ofSeconds(2));
 * int size = AsyncAssertion.awaitValue(inbox::size, 3, Duration.ofSeconds(2));
 * }</pre>
 */
public final class AsyncAssertion {

    static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(20);

    private AsyncAssertion() {
    }

    public static void eventually(BooleanSupplier condition, Duration timeout) {
        eventually(condition, timeout, DEFAULT_POLL_INTERVAL);
    }

    /**
     * Waits until the condition holds.
     *
     * @param condition checked on the calling thread; an exception counts as false
     * @param timeout the maximum time to wait
     * @param pollInterval the pause between checks
     * @throws AssertionError if the condition does not hold within the timeout
     */
    public static void eventually(BooleanSupplier condition, Duration timeout, Duration pollInterval) {
        Objects.requireNonNull(condition, "condition cannot be null");
        RuntimeException lastError = null;
        Deadline deadline = new Deadline(timeout);
        do {
            try {
                if (condition.getAsBoolean()) {
                    return;
                }
            } catch (RuntimeException e) {
                lastError = e;
            }
        } while (deadline.pause(pollInterval));

        String message = "Condition did not become true within " + timeout;
        if (lastError != null) {
            throw new AssertionError(message + ". Last error: " + lastError.getMessage(), lastError);
        }
        throw new AssertionError(message);
    }

    public static <T> T awaitValue(Supplier<T> supplier, T expected, Duration timeout) {
        return awaitValue(supplier, expected, timeout, DEFAULT_POLL_INTERVAL);
    }

    /**
     * Waits until the supplier returns the expected value.
     *
     * @return the matching value
     * @throws AssertionError listing the distinct values seen if it never matches
     */
    public static <T> T awaitValue(Supplier<T> supplier, T expected, Duration timeout, Duration pollInterval) {
        Objects.requireNonNull(supplier, "supplier cannot be null");
        List<T> history = new ArrayList<>();
        Deadline deadline = new Deadline(timeout);
        do {
            T value = supplier.get();
            if (history.isEmpty() || !Objects.equals(value, history.get(history.size() - 1))) {
                history.add(value);
            }
            if (Objects.equals(expected, value)) {
                return value;
            }
        } while (deadline.pause(pollInterval));

        throw new AssertionError(String.format(
            "Value did not become %s within %s. Value history: %s", expected, timeout, history));
    }

    /**
     * Re-runs an assertion until it stops throwing {@link AssertionError}.
     */
    public static void eventuallyAssert(Runnable assertion, Duration timeout) {
        Objects.requireNonNull(assertion, "assertion cannot be null");
        AssertionError lastError;
        Deadline deadline = new Deadline(timeout);
        do {
            try {
                assertion.run();
                return;
            } catch (AssertionError e) {
                lastError = e;
            }
        } while (deadline.pause(DEFAULT_POLL_INTERVAL));

        throw new AssertionError(
            "Assertion did not succeed within " + timeout + ". Last error: " + lastError.getMessage(), lastError);
    }

    private static final class Deadline {
        private final long endNanos;

        Deadline(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout cannot be null");
            this.endNanos = System.nanoTime() + timeout.toNanos();
        }

        /**
         * Sleeps for the interval, or what is left of the deadline.
         *
         * @return false once the deadline has passed
         */
        boolean pause(Duration interval) {
            long remaining = endNanos - System.nanoTime();
            if (remaining <= 0L) {
                return false;
            }
            try {
                TimeUnit.NANOSECONDS.sleep(Math.min(remaining, interval.toNanos()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("Interrupted while waiting", e);
            }
            return true;
        }
    }
}
