package com.parleysystems.core;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a delivery or reply operation: either a value or the error that prevented it.
 * Sealed so callers can branch exhaustively on {@link Success} and {@link Failure}.
 *
 * @param <T> the value type
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    /**
     * Successful result containing a value.
     */
    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public T getOrElse(Function<Throwable, T> fn) {
            return value;
        }

        @Override
        public Optional<Throwable> error() {
            return Optional.empty();
        }
    }

    /**
     * Failed result containing the error.
     */
    record Failure<T>(Throwable cause) implements Result<T> {
        public Failure {
            if (cause == null) {
                throw new NullPointerException("Failure cause cannot be null");
            }
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getOrThrow() {
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new MessagingException(ErrorKind.SEND_FAILED, "Operation failed", cause);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElse(Function<Throwable, T> fn) {
            return fn.apply(cause);
        }

        @Override
        public Optional<Throwable> error() {
            return Optional.of(cause);
        }
    }

    boolean isSuccess();

    T getOrThrow();

    T getOrElse(T defaultValue);

    T getOrElse(Function<Throwable, T> fn);

    Optional<Throwable> error();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Returns the {@link ErrorKind} of a failure caused by a {@link MessagingException}.
     *
     * @return the error kind, or empty for successes and foreign errors
     */
    default Optional<ErrorKind> errorKind() {
        return error()
            .filter(MessagingException.class::isInstance)
            .map(e -> ((MessagingException) e).kind());
    }

    default <U> Result<U> map(Function<T, U> fn) {
        if (this instanceof Success<T> success) {
            try {
                return new Success<>(fn.apply(success.value()));
            } catch (Exception e) {
                return new Failure<>(e);
            }
        }
        return new Failure<>(((Failure<T>) this).cause());
    }

    default <U> Result<U> flatMap(Function<T, Result<U>> fn) {
        if (this instanceof Success<T> success) {
            try {
                return fn.apply(success.value());
            } catch (Exception e) {
                return new Failure<>(e);
            }
        }
        return new Failure<>(((Failure<T>) this).cause());
    }

    default Result<T> recover(Function<Throwable, T> fn) {
        if (this instanceof Failure<T> failure) {
            try {
                return new Success<>(fn.apply(failure.cause()));
            } catch (Exception e) {
                return new Failure<>(e);
            }
        }
        return this;
    }

    default void ifSuccess(Consumer<T> consumer) {
        if (this instanceof Success<T> success) {
            consumer.accept(success.value());
        }
    }

    default void ifFailure(Consumer<Throwable> consumer) {
        if (this instanceof Failure<T> failure) {
            consumer.accept(failure.cause());
        }
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(Throwable error) {
        return new Failure<>(error);
    }

    /**
     * Execute code that might throw and wrap the outcome in a Result.
     */
    static <T> Result<T> attempt(ThrowingSupplier<T> supplier) {
        try {
            return new Success<>(supplier.get());
        } catch (Exception e) {
            return new Failure<>(e);
        }
    }

    @FunctionalInterface
    interface ThrowingSupplier<T> {
        T get() throws Exception;
    }
}
