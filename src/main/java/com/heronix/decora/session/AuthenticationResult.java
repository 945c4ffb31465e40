package com.heronix.decora.session;

import java.time.Instant;

/**
 * Outcome of a successful authentication.
 */
public record AuthenticationResult(String accessToken, long expiresIn, Instant expirationTime) {

    @Override
    public String toString() {
        return "AuthenticationResult[expiresIn=" + expiresIn + ", expirationTime=" + expirationTime + "]";
    }
}
