package com.heronix.decora.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import com.heronix.decora.exception.AuthException;
import com.heronix.decora.exception.NotAuthenticatedException;
import com.heronix.decora.exception.TokenExpiredException;

import lombok.extern.slf4j.Slf4j;

/**
 * Owns the bearer-token session shared by every device call.
 *
 * The cached {@link SessionToken} is read and replaced only while holding
 * {@code tokenLock}. The credential exchange itself runs outside the lock and
 * the lock is taken only to commit its result, so two overlapping
 * authentications both succeed and whichever commits last wins.
 *
 * No retries: a failed authentication is reported to the caller immediately.
 */
@Slf4j
public class SessionTokenManager {

    public static final Duration DEFAULT_REFRESH_THRESHOLD = Duration.ofSeconds(300);
    public static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final AuthenticationEndpoint endpoint;
    private final Clock clock;
    private final Duration refreshThreshold;
    private final long defaultExpiresInSeconds;

    private final Object tokenLock = new Object();

    // guarded by tokenLock
    private SessionToken token;
    private int authenticationsInFlight;

    public SessionTokenManager(AuthenticationEndpoint endpoint, Clock clock) {
        this(endpoint, clock, DEFAULT_REFRESH_THRESHOLD, DEFAULT_EXPIRES_IN_SECONDS);
    }

    public SessionTokenManager(AuthenticationEndpoint endpoint, Clock clock,
                               Duration refreshThreshold, long defaultExpiresInSeconds) {
        this.endpoint = endpoint;
        this.clock = clock;
        this.refreshThreshold = refreshThreshold;
        this.defaultExpiresInSeconds = defaultExpiresInSeconds;
    }

    /**
     * Authenticate with the given credentials and cache the returned token.
     *
     * @throws IllegalArgumentException if username or password is blank
     * @throws AuthException if the exchange fails or the response has no access token
     */
    public AuthenticationResult authenticate(String username, String password) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username cannot be empty.");
        }
        if (password == null || password.isBlank()) {
            throw new IllegalArgumentException("Password cannot be empty.");
        }

        synchronized (tokenLock) {
            authenticationsInFlight++;
        }

        try {
            AuthenticationEndpoint.LoginResponse response = endpoint.login(username, password);

            String accessToken = response != null ? response.accessToken() : null;
            if (accessToken == null || accessToken.isEmpty()) {
                throw new AuthException("No access token returned from authentication endpoint.");
            }

            long expiresIn = response.expiresIn() != null ? response.expiresIn() : defaultExpiresInSeconds;
            SessionToken committed = new SessionToken(accessToken, clock.instant().plusSeconds(expiresIn));

            synchronized (tokenLock) {
                token = committed;
            }

            log.info("Authenticated as {}; token valid until {}", username, committed.expiresAt());
            return new AuthenticationResult(accessToken, expiresIn, committed.expiresAt());

        } catch (AuthException e) {
            log.warn("Authentication failed for {}: {}", username, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.warn("Authentication failed for {}: {}", username, e.getMessage());
            throw new AuthException("Failed to authenticate with the Decora API.", e);
        } finally {
            synchronized (tokenLock) {
                authenticationsInFlight--;
            }
        }
    }

    /**
     * True when no token is cached or the token expires within the refresh threshold.
     */
    public boolean needsRefresh() {
        SessionToken current = currentToken();
        return current == null || current.needsRefresh(clock.instant(), refreshThreshold);
    }

    /**
     * Guard for authenticated operations.
     *
     * @throws NotAuthenticatedException if no token is cached
     * @throws TokenExpiredException if the cached token has expired
     */
    public SessionToken validateAuthenticated() {
        SessionToken current = currentToken();
        if (current == null) {
            throw new NotAuthenticatedException();
        }
        if (current.isExpired(clock.instant())) {
            throw TokenExpiredException.at(current.expiresAt());
        }
        return current;
    }

    /**
     * Consistent copy of the cached token pair.
     */
    public Optional<SessionToken> snapshot() {
        return Optional.ofNullable(currentToken());
    }

    public SessionState state() {
        synchronized (tokenLock) {
            boolean inFlight = authenticationsInFlight > 0;
            if (token == null) {
                return inFlight ? SessionState.AUTHENTICATING : SessionState.UNAUTHENTICATED;
            }
            if (token.isExpired(clock.instant())) {
                return inFlight ? SessionState.AUTHENTICATING : SessionState.EXPIRED;
            }
            return SessionState.AUTHENTICATED;
        }
    }

    /**
     * Drop the cached token and return to UNAUTHENTICATED.
     */
    public void clear() {
        synchronized (tokenLock) {
            token = null;
        }
        log.info("Session token cleared");
    }

    public Duration getRefreshThreshold() {
        return refreshThreshold;
    }

    private SessionToken currentToken() {
        synchronized (tokenLock) {
            return token;
        }
    }
}
