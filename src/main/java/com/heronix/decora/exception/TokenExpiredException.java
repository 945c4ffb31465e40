package com.heronix.decora.exception;

import java.time.Instant;

/**
 * Exception thrown when the cached session token has passed its expiration.
 */
public class TokenExpiredException extends RuntimeException {

    private final Instant expiredAt;

    public TokenExpiredException(String message) {
        this(message, (Instant) null);
    }

    public TokenExpiredException(String message, Throwable cause) {
        super(message, cause);
        this.expiredAt = null;
    }

    public TokenExpiredException(String message, Instant expiredAt) {
        super(message);
        this.expiredAt = expiredAt;
    }

    public static TokenExpiredException at(Instant expiredAt) {
        return new TokenExpiredException(
                "Authentication token expired at " + expiredAt + ". Authenticate again.", expiredAt);
    }

    /**
     * Expiration of the rejected token, or null when not known.
     */
    public Instant getExpiredAt() {
        return expiredAt;
    }
}
