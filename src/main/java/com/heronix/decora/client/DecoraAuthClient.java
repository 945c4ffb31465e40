package com.heronix.decora.client;

import java.time.Duration;
import java.util.Map;

import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.heronix.decora.config.DecoraProperties;
import com.heronix.decora.exception.AuthException;
import com.heronix.decora.session.AuthenticationEndpoint;

import lombok.extern.slf4j.Slf4j;

/**
 * Calls the Decora login endpoint.
 *
 * POST {base}/user/login with {"username", "password", "remember_me": true};
 * the response carries access_token and expires_in.
 */
@Slf4j
public class DecoraAuthClient implements AuthenticationEndpoint {

    private static final String LOGIN_PATH = "/user/login";

    private final WebClient webClient;
    private final Duration requestTimeout;

    public DecoraAuthClient(WebClient.Builder webClientBuilder, DecoraProperties properties) {
        this.requestTimeout = Duration.ofSeconds(properties.getApi().getTimeoutSeconds());
        this.webClient = webClientBuilder
                .baseUrl(trimTrailingSlash(properties.getApi().getBaseUrl()))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.USER_AGENT, properties.getApi().getUserAgent())
                .build();
    }

    @Override
    public LoginResponse login(String username, String password) {
        Map<String, Object> body = Map.of(
                "username", username,
                "password", password,
                "remember_me", true
        );

        try {
            Map<String, Object> response = webClient.post()
                    .uri(LOGIN_PATH)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                    .block(requestTimeout);

            if (response == null) {
                throw new AuthException("Empty response from authentication endpoint.");
            }

            Object token = response.get("access_token");
            Object expiresIn = response.get("expires_in");

            return new LoginResponse(
                    token != null ? token.toString() : null,
                    toLong(expiresIn)
            );

        } catch (WebClientResponseException e) {
            throw new AuthException("Authentication failed with status " + e.getStatusCode().value()
                    + ": " + e.getResponseBodyAsString(), e);
        } catch (WebClientRequestException e) {
            throw new AuthException("Failed to connect to Decora API.", e);
        } catch (IllegalStateException e) {
            // block(timeout) gave up waiting
            throw new AuthException("Authentication request timed out.", e);
        }
    }

    private Long toLong(Object value) {
        if (value == null) return null;
        if (value instanceof Number) return ((Number) value).longValue();
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric expires_in in login response");
            return null;
        }
    }

    static String trimTrailingSlash(String url) {
        if (url == null) {
            throw new IllegalArgumentException("Decora API base URL is required.");
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
