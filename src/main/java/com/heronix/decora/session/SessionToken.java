package com.heronix.decora.session;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable pairing of a bearer token with its UTC expiration.
 *
 * The pair is always replaced as a whole, never field by field.
 */
public record SessionToken(String accessToken, Instant expiresAt) {

    public SessionToken {
        Objects.requireNonNull(accessToken, "accessToken");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    /**
     * Valid only while now is strictly before the expiration.
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean needsRefresh(Instant now, Duration threshold) {
        return !now.plus(threshold).isBefore(expiresAt);
    }

    public Duration remaining(Instant now) {
        Duration remaining = Duration.between(now, expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    @Override
    public String toString() {
        return "SessionToken[expiresAt=" + expiresAt + "]";
    }
}
