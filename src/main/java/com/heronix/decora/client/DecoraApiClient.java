package com.heronix.decora.client;

import java.time.Duration;
import java.util.List;
import java.util.function.Function;

import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.heronix.decora.config.DecoraProperties;
import com.heronix.decora.exception.ApiRequestException;
import com.heronix.decora.model.dto.DeviceInfo;
import com.heronix.decora.model.dto.DeviceState;
import com.heronix.decora.model.dto.DeviceStateRequest;
import com.heronix.decora.session.SessionToken;
import com.heronix.decora.session.SessionTokenManager;

import lombok.extern.slf4j.Slf4j;

/**
 * Low-level API client for the Decora device endpoints.
 *
 * Every call first checks the session with
 * {@link SessionTokenManager#validateAuthenticated()} and then sends the
 * cached bearer token. Failures surface immediately; nothing is retried.
 */
@Slf4j
public class DecoraApiClient {

    public static final int MIN_BRIGHTNESS = 0;
    public static final int MAX_BRIGHTNESS = 100;
    public static final int MIN_COLOR_TEMPERATURE = 2000;
    public static final int MAX_COLOR_TEMPERATURE = 6500;

    private final WebClient webClient;
    private final SessionTokenManager sessionTokenManager;
    private final Duration requestTimeout;

    public DecoraApiClient(WebClient.Builder webClientBuilder, DecoraProperties properties,
                           SessionTokenManager sessionTokenManager) {
        this.sessionTokenManager = sessionTokenManager;
        this.requestTimeout = Duration.ofSeconds(properties.getApi().getTimeoutSeconds());
        this.webClient = webClientBuilder
                .baseUrl(DecoraAuthClient.trimTrailingSlash(properties.getApi().getBaseUrl()))
                .defaultHeader(HttpHeaders.USER_AGENT, properties.getApi().getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    /**
     * List every device on the authenticated account.
     */
    public List<DeviceInfo> getDevices() {
        List<DeviceInfo> devices = execute("retrieve devices", token -> webClient.get()
                .uri("/devices")
                .headers(headers -> headers.setBearerAuth(token.accessToken()))
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<List<DeviceInfo>>() {})
                .block(requestTimeout));

        return devices != null ? devices : List.of();
    }

    public DeviceInfo getDevice(String deviceId) {
        requireDeviceId(deviceId);

        return execute("retrieve device " + deviceId, token -> webClient.get()
                .uri("/devices/{id}", deviceId)
                .headers(headers -> headers.setBearerAuth(token.accessToken()))
                .retrieve()
                .bodyToMono(DeviceInfo.class)
                .block(requestTimeout));
    }

    public DeviceState getDeviceState(String deviceId) {
        requireDeviceId(deviceId);

        return execute("retrieve device state for " + deviceId, token -> webClient.get()
                .uri("/devices/{id}/state", deviceId)
                .headers(headers -> headers.setBearerAuth(token.accessToken()))
                .retrieve()
                .bodyToMono(DeviceState.class)
                .block(requestTimeout));
    }

    /**
     * Send a state change and return the state reported back by the device.
     */
    public DeviceState setDeviceState(String deviceId, DeviceStateRequest state) {
        requireDeviceId(deviceId);
        if (state == null) {
            throw new IllegalArgumentException("State request cannot be null.");
        }

        return execute("set device state for " + deviceId, token -> webClient.put()
                .uri("/devices/{id}/state", deviceId)
                .headers(headers -> headers.setBearerAuth(token.accessToken()))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(state)
                .retrieve()
                .bodyToMono(DeviceState.class)
                .block(requestTimeout));
    }

    public DeviceState setDevicePower(String deviceId, boolean turnOn) {
        return setDeviceState(deviceId, DeviceStateRequest.builder()
                .power(turnOn ? "on" : "off")
                .build());
    }

    /**
     * @param brightness brightness level (0-100)
     */
    public DeviceState setDeviceBrightness(String deviceId, int brightness) {
        if (brightness < MIN_BRIGHTNESS || brightness > MAX_BRIGHTNESS) {
            throw new IllegalArgumentException("Brightness must be between 0 and 100.");
        }
        return setDeviceState(deviceId, DeviceStateRequest.builder()
                .brightness(brightness)
                .build());
    }

    /**
     * @param colorTemperature color temperature in Kelvin (2000-6500)
     */
    public DeviceState setDeviceColor(String deviceId, int colorTemperature) {
        if (colorTemperature < MIN_COLOR_TEMPERATURE || colorTemperature > MAX_COLOR_TEMPERATURE) {
            throw new IllegalArgumentException("Color temperature must be between 2000 and 6500 Kelvin.");
        }
        return setDeviceState(deviceId, DeviceStateRequest.builder()
                .colorTemperature(colorTemperature)
                .build());
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private <T> T execute(String action, Function<SessionToken, T> call) {
        SessionToken token = sessionTokenManager.validateAuthenticated();

        try {
            return call.apply(token);
        } catch (WebClientResponseException e) {
            log.error("Failed to {}: HTTP {}", action, e.getStatusCode().value());
            throw new ApiRequestException("Failed to " + action + ": " + e.getResponseBodyAsString(),
                    e.getStatusCode().value());
        } catch (WebClientRequestException e) {
            log.error("Failed to {}: {}", action, e.getMessage());
            throw new ApiRequestException("Failed to connect to Decora API.", e);
        } catch (IllegalStateException e) {
            log.error("Failed to {}: request timed out", action);
            throw new ApiRequestException("Request to Decora API timed out.", e);
        }
    }

    private static void requireDeviceId(String deviceId) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("Device ID cannot be empty.");
        }
    }
}
