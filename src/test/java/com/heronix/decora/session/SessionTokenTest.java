package com.heronix.decora.session;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.Test;

class SessionTokenTest {

    private static final Instant EXPIRES = Instant.parse("2024-05-01T13:00:00Z");

    @Test
    void remainingNeverNegative() {
        SessionToken token = new SessionToken("abc", EXPIRES);

        assertEquals(Duration.ofSeconds(10), token.remaining(EXPIRES.minusSeconds(10)));
        assertEquals(Duration.ZERO, token.remaining(EXPIRES.plusSeconds(10)));
    }

    @Test
    void toStringHidesAccessToken() {
        SessionToken token = new SessionToken("super-secret-token", EXPIRES);

        assertFalse(token.toString().contains("super-secret-token"));
    }
}
