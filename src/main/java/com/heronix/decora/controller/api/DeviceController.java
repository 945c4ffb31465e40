package com.heronix.decora.controller.api;

import java.util.List;
import java.util.Optional;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.decora.client.DecoraApiClient;
import com.heronix.decora.model.dto.DeviceInfo;
import com.heronix.decora.model.dto.DeviceState;
import com.heronix.decora.model.dto.DeviceStateRequest;
import com.heronix.decora.service.DecoraSessionService;
import com.heronix.decora.service.DeviceRegistryService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for Decora device control.
 */
@RestController
@RequestMapping("/api/v1/decora/devices")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Devices", description = "APIs for reading and controlling Decora devices")
public class DeviceController {

    private final DecoraApiClient apiClient;
    private final DecoraSessionService sessionService;
    private final DeviceRegistryService registryService;

    @GetMapping
    @Operation(summary = "List devices", description = "List every device on the Decora account")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Devices returned"),
        @ApiResponse(responseCode = "401", description = "No usable session"),
        @ApiResponse(responseCode = "502", description = "Decora API request failed")
    })
    public ResponseEntity<List<DeviceInfo>> listDevices() {
        sessionService.ensureAuthenticated();
        return ResponseEntity.ok(apiClient.getDevices());
    }

    @GetMapping("/{deviceId}")
    @Operation(summary = "Get device", description = "Get details for one device")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Device found"),
        @ApiResponse(responseCode = "404", description = "Device not found")
    })
    public ResponseEntity<DeviceInfo> getDevice(@PathVariable String deviceId) {
        sessionService.ensureAuthenticated();
        DeviceInfo device = apiClient.getDevice(deviceId);
        return device != null ? ResponseEntity.ok(device) : ResponseEntity.notFound().build();
    }

    @GetMapping("/{deviceId}/state")
    @Operation(summary = "Get device state")
    public ResponseEntity<DeviceState> getDeviceState(@PathVariable String deviceId) {
        sessionService.ensureAuthenticated();
        DeviceState state = apiClient.getDeviceState(deviceId);
        registryService.applyState(deviceId, state);
        return state != null ? ResponseEntity.ok(state) : ResponseEntity.notFound().build();
    }

    @PutMapping("/{deviceId}/state")
    @Operation(summary = "Set device state", description = "Send a partial state change to a device")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "State applied"),
        @ApiResponse(responseCode = "400", description = "Invalid state values")
    })
    public ResponseEntity<DeviceState> setDeviceState(
            @PathVariable String deviceId,
            @Valid @RequestBody DeviceStateRequest request) {

        log.info("API: Setting state of device {}", deviceId);

        sessionService.ensureAuthenticated();
        return respond(deviceId, apiClient.setDeviceState(deviceId, request));
    }

    @PostMapping("/{deviceId}/power")
    @Operation(summary = "Turn a device on or off")
    public ResponseEntity<DeviceState> setPower(
            @PathVariable String deviceId,
            @Valid @RequestBody PowerRequest request) {

        sessionService.ensureAuthenticated();
        return respond(deviceId, apiClient.setDevicePower(deviceId, request.on()));
    }

    @PostMapping("/{deviceId}/brightness")
    @Operation(summary = "Set brightness", description = "Set brightness level (0-100)")
    public ResponseEntity<DeviceState> setBrightness(
            @PathVariable String deviceId,
            @Valid @RequestBody LevelRequest request) {

        sessionService.ensureAuthenticated();
        return respond(deviceId, apiClient.setDeviceBrightness(deviceId, request.value()));
    }

    @PostMapping("/{deviceId}/color")
    @Operation(summary = "Set color temperature", description = "Set color temperature in Kelvin (2000-6500)")
    public ResponseEntity<DeviceState> setColor(
            @PathVariable String deviceId,
            @Valid @RequestBody LevelRequest request) {

        sessionService.ensureAuthenticated();
        return respond(deviceId, apiClient.setDeviceColor(deviceId, request.value()));
    }

    @GetMapping("/registered")
    @Operation(summary = "List registered devices", description = "Local device models known to the bridge")
    public ResponseEntity<List<DeviceRegistryService.DeviceStatus>> listRegistered() {
        List<DeviceRegistryService.DeviceStatus> statuses = registryService.getRegisteredDevices().stream()
                .map(device -> registryService.getDeviceStatus(device.getDeviceId()))
                .flatMap(Optional::stream)
                .toList();
        return ResponseEntity.ok(statuses);
    }

    @PostMapping("/sync")
    @Operation(summary = "Sync devices", description = "Register local models for the account's switches, dimmers and fans")
    public ResponseEntity<SyncResponse> syncDevices() {
        int added = registryService.syncDevices();
        return ResponseEntity.ok(new SyncResponse(added, registryService.getRegisteredDevices().size()));
    }

    private ResponseEntity<DeviceState> respond(String deviceId, DeviceState state) {
        registryService.applyState(deviceId, state);
        return ResponseEntity.ok(state);
    }

    // ========================================================================
    // REQUEST/RESPONSE TYPES
    // ========================================================================

    public record PowerRequest(@NotNull Boolean on) {}

    public record LevelRequest(@NotNull Integer value) {}

    public record SyncResponse(int added, int registered) {}
}
