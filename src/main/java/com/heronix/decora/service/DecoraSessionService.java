package com.heronix.decora.service;

import java.time.Instant;

import org.springframework.stereotype.Service;

import com.heronix.decora.config.DecoraProperties;
import com.heronix.decora.exception.ConfigLoadException;
import com.heronix.decora.exception.NotAuthenticatedException;
import com.heronix.decora.session.AuthenticationResult;
import com.heronix.decora.session.SessionState;
import com.heronix.decora.session.SessionToken;
import com.heronix.decora.session.SessionTokenManager;
import com.heronix.decora.store.ConfigStore;
import com.heronix.decora.store.ConnectionSettings;
import com.heronix.decora.store.LoadOutcome;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the Decora session usable for device calls.
 *
 * Credentials come from the stored configuration; the password is decrypted
 * only for the duration of a login.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DecoraSessionService {

    private final SessionTokenManager sessionTokenManager;
    private final ConfigStore configStore;
    private final ConnectionSettings connectionSettings;
    private final DecoraProperties properties;

    @PostConstruct
    void init() {
        if (!properties.getStorage().isLoadOnStartup()) {
            return;
        }

        try {
            LoadOutcome outcome = configStore.load();
            if (outcome == LoadOutcome.NOT_FOUND) {
                log.info("No configuration at {}; starting with an empty store", configStore.getConfigPath());
            } else {
                log.info("Loaded configuration from {}", configStore.getConfigPath());
            }
        } catch (ConfigLoadException e) {
            log.error("Configuration at {} could not be loaded: {}", configStore.getConfigPath(), e.getMessage());
        }
    }

    /**
     * Authenticate with the stored credentials if the cached token is missing
     * or about to expire, and return the usable token.
     *
     * @throws NotAuthenticatedException if a login is needed but no credentials are stored
     */
    public SessionToken ensureAuthenticated() {
        if (sessionTokenManager.needsRefresh()) {
            if (!connectionSettings.hasCredentials()) {
                throw new NotAuthenticatedException("No Decora credentials are configured.");
            }
            log.debug("Session token missing or near expiry; logging in again");
            sessionTokenManager.authenticate(connectionSettings.getUsername(), connectionSettings.getPassword());
        }
        return sessionTokenManager.validateAuthenticated();
    }

    /**
     * Log in with the stored credentials regardless of the current token.
     */
    public AuthenticationResult login() {
        if (!connectionSettings.hasCredentials()) {
            throw new NotAuthenticatedException("No Decora credentials are configured.");
        }
        return sessionTokenManager.authenticate(connectionSettings.getUsername(), connectionSettings.getPassword());
    }

    /**
     * Replace the stored credentials, persist them and drop the current session.
     */
    public void updateCredentials(String username, String password) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username cannot be empty.");
        }
        if (password == null || password.isBlank()) {
            throw new IllegalArgumentException("Password cannot be empty.");
        }

        connectionSettings.updateCredentials(username, password);
        configStore.save();
        sessionTokenManager.clear();

        log.info("Stored new Decora credentials for {}", username);
    }

    public void logout() {
        sessionTokenManager.clear();
    }

    public SessionStatus getStatus() {
        Instant expiresAt = sessionTokenManager.snapshot()
                .map(SessionToken::expiresAt)
                .orElse(null);

        return new SessionStatus(
                sessionTokenManager.state(),
                expiresAt,
                sessionTokenManager.needsRefresh(),
                connectionSettings.hasCredentials(),
                configStore.validate()
        );
    }

    public record SessionStatus(
            SessionState state,
            Instant expiresAt,
            boolean needsRefresh,
            boolean credentialsConfigured,
            boolean configurationValid
    ) {}
}
