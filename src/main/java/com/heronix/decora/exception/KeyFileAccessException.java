package com.heronix.decora.exception;

/**
 * Exception thrown when the key file cannot be read or written.
 */
public class KeyFileAccessException extends RuntimeException {

    public KeyFileAccessException(String message) {
        super(message);
    }

    public KeyFileAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
