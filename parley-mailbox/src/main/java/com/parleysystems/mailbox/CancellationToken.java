package com.parleysystems.mailbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-owned handle used to abort blocking mailbox and protocol operations.
 * <p>
 * A blocking call registers a wake-up callback with {@link #onCancel(Runnable)} for the
 * duration of its wait. Cancelling the token runs the callbacks, the call observes
 * {@link #isCancelled()} and returns a cancelled outcome without consuming anything.
 * A token is one-shot: once cancelled it stays cancelled.
 *
 * <pre>{@code
 * CancellationToken token = CancellationToken.create();
 * executor.submit(() -> mailbox.receive(Duration.ofMinutes(1), token));
 * token.cancel(); // the receive returns ReceiveResult.Cancelled
 * }</pre>
 */
public final class CancellationToken {
    private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

    /**
     * A token that is never cancelled. {@link #cancel()} on it is rejected.
     */
    public static final CancellationToken NONE = new CancellationToken(false);

    private static final Registration NO_OP = () -> { };

    private final boolean cancellable;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * Creates a new, not yet cancelled token.
     */
    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * Cancels the token and wakes every operation waiting on it.
     *
     * @return true if this call cancelled the token, false if it was already cancelled
     * @throws UnsupportedOperationException on {@link #NONE}
     */
    public boolean cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.NONE cannot be cancelled");
        }
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Listener listener : listeners) {
            listener.fire();
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Registers a callback to run once when the token is cancelled.
     * If the token is already cancelled the callback runs immediately on the calling thread.
     *
     * @param callback the callback
     * @return a registration that removes the callback when closed
     */
    public Registration onCancel(Runnable callback) {
        if (!cancellable) {
            return NO_OP;
        }
        Listener listener = new Listener(callback);
        listeners.add(listener);
        if (cancelled.get()) {
            listener.fire();
        }
        return () -> listeners.remove(listener);
    }

    @Override
    public String toString() {
        if (!cancellable) {
            return "CancellationToken.NONE";
        }
        return "CancellationToken{cancelled=" + cancelled.get() + "}";
    }

    /**
     * Handle for a registered cancellation callback.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    private static final class Listener {
        private final Runnable callback;
        private final AtomicBoolean fired = new AtomicBoolean(false);

        Listener(Runnable callback) {
            this.callback = callback;
        }

        void fire() {
            if (!fired.compareAndSet(false, true)) {
                return;
            }
            try {
                callback.run();
            } catch (RuntimeException e) {
                logger.warn("Cancellation callback failed", e);
            }
        }
    }
}
