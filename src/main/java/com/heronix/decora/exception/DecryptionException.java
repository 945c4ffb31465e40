package com.heronix.decora.exception;

/**
 * Exception thrown when an encrypted blob is malformed, truncated or fails padding checks.
 */
public class DecryptionException extends RuntimeException {

    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
