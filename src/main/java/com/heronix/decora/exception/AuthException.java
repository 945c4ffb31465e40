package com.heronix.decora.exception;

/**
 * Exception thrown when the authentication endpoint is unreachable, rejects the
 * credentials, or returns no access token.
 */
public class AuthException extends RuntimeException {

    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
