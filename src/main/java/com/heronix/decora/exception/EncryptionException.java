package com.heronix.decora.exception;

/**
 * Exception thrown when a credential value cannot be encrypted.
 */
public class EncryptionException extends RuntimeException {

    public EncryptionException(String message) {
        super(message);
    }

    public EncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
