package com.heronix.decora.exception;

/**
 * Exception thrown when an existing key file does not hold exactly 32 bytes.
 */
public class KeyCorruptException extends RuntimeException {

    public KeyCorruptException(String message) {
        super(message);
    }

    public KeyCorruptException(String message, Throwable cause) {
        super(message, cause);
    }

    public static KeyCorruptException wrongLength(String keyFile, int actualLength) {
        return new KeyCorruptException("Key file " + keyFile + " holds " + actualLength + " bytes, expected 32");
    }
}
