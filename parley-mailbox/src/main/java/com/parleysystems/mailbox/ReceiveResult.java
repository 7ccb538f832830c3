package com.parleysystems.mailbox;

import java.util.Optional;

/**
 * Outcome of a receive with a deadline or cancellation token.
 * Anything other than {@link Received} means no message was consumed.
 *
 * @param <T> the message type
 */
public sealed interface ReceiveResult<T>
        permits ReceiveResult.Received, ReceiveResult.TimedOut, ReceiveResult.Cancelled, ReceiveResult.Closed {

    /**
     * A message was removed from the head of the mailbox.
     */
    record Received<T>(T value) implements ReceiveResult<T> {
    }

    /**
     * The deadline elapsed while the mailbox was empty.
     */
    record TimedOut<T>() implements ReceiveResult<T> {
    }

    /**
     * The wait was cancelled or the thread was interrupted.
     */
    record Cancelled<T>() implements ReceiveResult<T> {
    }

    /**
     * The mailbox was closed and empty.
     */
    record Closed<T>() implements ReceiveResult<T> {
    }

    static <T> ReceiveResult<T> received(T value) {
        return new Received<>(value);
    }

    static <T> ReceiveResult<T> timedOut() {
        return new TimedOut<>();
    }

    static <T> ReceiveResult<T> cancelled() {
        return new Cancelled<>();
    }

    static <T> ReceiveResult<T> closed() {
        return new Closed<>();
    }

    default boolean isReceived() {
        return this instanceof Received;
    }

    default Optional<T> asOptional() {
        if (this instanceof Received<T> received) {
            return Optional.of(received.value());
        }
        return Optional.empty();
    }
}
