package com.parleysystems.core;

/**
 * Reported when the caller aborts a blocking operation through a cancellation token
 * or by interrupting the waiting thread.
 */
public class CancelledException extends MessagingException {

    public CancelledException(String message) {
        super(ErrorKind.CANCELLED, message);
    }

    public CancelledException(String message, Throwable cause) {
        super(ErrorKind.CANCELLED, message, cause);
    }
}
