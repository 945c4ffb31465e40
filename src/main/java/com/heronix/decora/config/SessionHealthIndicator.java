package com.heronix.decora.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.heronix.decora.service.DecoraSessionService;
import com.heronix.decora.session.SessionState;

import lombok.RequiredArgsConstructor;

/**
 * Spring Boot Actuator health indicator for the Decora session.
 *
 * Reports UP while a token is held or a login is in progress, UNKNOWN before
 * the first login, and OUT_OF_SERVICE once the token has expired.
 */
@Component
@RequiredArgsConstructor
public class SessionHealthIndicator implements HealthIndicator {

    private final DecoraSessionService sessionService;

    @Override
    public Health health() {
        DecoraSessionService.SessionStatus status = sessionService.getStatus();

        Health.Builder builder = switch (status.state()) {
            case AUTHENTICATED, AUTHENTICATING -> Health.up();
            case EXPIRED -> Health.outOfService();
            case UNAUTHENTICATED -> Health.unknown();
        };

        builder.withDetail("session", status.state().name())
                .withDetail("credentials", status.credentialsConfigured() ? "configured" : "missing")
                .withDetail("configuration", status.configurationValid() ? "valid" : "incomplete");

        if (status.state() == SessionState.AUTHENTICATED && status.expiresAt() != null) {
            builder.withDetail("expires-at", status.expiresAt().toString())
                    .withDetail("refresh-due", status.needsRefresh());
        }

        return builder.build();
    }
}
