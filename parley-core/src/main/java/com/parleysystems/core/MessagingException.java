package com.parleysystems.core;

/**
 * Base exception for delivery and protocol failures.
 * Every failure surfaced by the fabric carries an {@link ErrorKind} so callers can
 * decide whether to retry without inspecting the concrete exception class.
 */
public class MessagingException extends RuntimeException {

    private final ErrorKind kind;

    /**
     * Creates a new MessagingException.
     *
     * @param kind the error kind
     * @param message the detail message
     */
    public MessagingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Creates a new MessagingException with a cause.
     *
     * @param kind the error kind
     * @param message the detail message
     * @param cause the cause of the exception
     */
    public MessagingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Returns the kind of failure.
     *
     * @return the error kind, never null
     */
    public ErrorKind kind() {
        return kind;
    }
}
