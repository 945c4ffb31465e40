package com.heronix.decora.exception;

/**
 * Exception thrown when an authenticated operation is attempted before any
 * successful authentication.
 */
public class NotAuthenticatedException extends RuntimeException {

    public NotAuthenticatedException() {
        super("Not authenticated. Call authenticate first.");
    }

    public NotAuthenticatedException(String message) {
        super(message);
    }

    public NotAuthenticatedException(String message, Throwable cause) {
        super(message, cause);
    }
}
