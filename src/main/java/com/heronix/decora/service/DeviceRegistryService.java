package com.heronix.decora.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import org.springframework.stereotype.Service;

import com.heronix.decora.client.DecoraApiClient;
import com.heronix.decora.device.DecoraDevice;
import com.heronix.decora.device.DecoraDimmer;
import com.heronix.decora.device.DecoraFan;
import com.heronix.decora.device.DecoraSwitch;
import com.heronix.decora.device.DeviceEvent;
import com.heronix.decora.device.DeviceEventListener;
import com.heronix.decora.device.FanSpeed;
import com.heronix.decora.exception.ApiRequestException;
import com.heronix.decora.model.dto.DeviceInfo;
import com.heronix.decora.model.dto.DeviceState;
import com.heronix.decora.model.dto.DeviceStateRequest;
import com.heronix.decora.model.enums.DeviceType;
import com.heronix.decora.model.enums.ModuleErrorType;
import com.heronix.decora.model.enums.ModuleStatus;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * Orchestrates the local device models.
 *
 * Devices can only be added, removed or commanded while the module is
 * INITIALIZED or RUNNING. Failures are reported to {@link ModuleEventListener}s
 * and logged; the boolean operations return false instead of throwing.
 */
@Service
@Slf4j
public class DeviceRegistryService implements DeviceEventListener {

    private final DecoraApiClient apiClient;
    private final DecoraSessionService sessionService;

    private final Map<String, DecoraDevice> devices = new LinkedHashMap<>();
    private final List<ModuleEventListener> listeners = new CopyOnWriteArrayList<>();

    private volatile ModuleStatus status = ModuleStatus.UNINITIALIZED;

    public DeviceRegistryService(DecoraApiClient apiClient, DecoraSessionService sessionService) {
        this.apiClient = apiClient;
        this.sessionService = sessionService;
    }

    // ========================================================================
    // LIFECYCLE
    // ========================================================================

    @PostConstruct
    void start() {
        initialize();
    }

    public synchronized boolean initialize() {
        if (isReady()) {
            return true;
        }

        try {
            changeStatus(ModuleStatus.INITIALIZING);
            devices.values().forEach(DecoraDevice::initialize);
            changeStatus(ModuleStatus.INITIALIZED);
            log.info("Device registry initialized with {} device(s)", devices.size());
            return true;
        } catch (RuntimeException e) {
            changeStatus(ModuleStatus.ERROR);
            raiseError(ModuleErrorType.INITIALIZATION_ERROR, "Failed to initialize device registry: " + e.getMessage());
            return false;
        }
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (status == ModuleStatus.SHUTDOWN) {
            return;
        }

        try {
            for (DecoraDevice device : devices.values()) {
                device.removeListener(this);
                device.shutdown();
            }
            devices.clear();
            changeStatus(ModuleStatus.SHUTDOWN);
            log.info("Device registry shut down");
        } catch (RuntimeException e) {
            changeStatus(ModuleStatus.ERROR);
            raiseError(ModuleErrorType.SHUTDOWN_ERROR, "Failed to shut down device registry: " + e.getMessage());
        }
    }

    // ========================================================================
    // DEVICE MANAGEMENT
    // ========================================================================

    public synchronized boolean addDevice(DecoraDevice device) {
        Objects.requireNonNull(device, "device");
        if (!requireReady()) {
            return false;
        }
        if (devices.containsKey(device.getDeviceId())) {
            raiseError(ModuleErrorType.DEVICE_ERROR, "Device " + device.getDeviceId() + " is already registered");
            return false;
        }

        device.initialize();
        device.addListener(this);
        devices.put(device.getDeviceId(), device);
        changeStatus(ModuleStatus.RUNNING);

        log.info("Registered {}", device);
        return true;
    }

    public synchronized boolean removeDevice(String deviceId) {
        if (!requireReady()) {
            return false;
        }

        DecoraDevice device = devices.remove(deviceId);
        if (device == null) {
            raiseError(ModuleErrorType.DEVICE_ERROR, "Device " + deviceId + " is not registered");
            return false;
        }

        device.removeListener(this);
        device.shutdown();
        log.info("Removed device {}", deviceId);
        return true;
    }

    public synchronized Optional<DecoraDevice> getDevice(String deviceId) {
        return Optional.ofNullable(devices.get(deviceId));
    }

    public synchronized List<DecoraDevice> getRegisteredDevices() {
        return new ArrayList<>(devices.values());
    }

    public synchronized List<DecoraDevice> getDevicesByType(DeviceType type) {
        return devices.values().stream()
                .filter(device -> device.getDeviceType() == type)
                .toList();
    }

    /**
     * Summary of a registered device, or empty when the module is not ready
     * or the device is unknown.
     */
    public synchronized Optional<DeviceStatus> getDeviceStatus(String deviceId) {
        if (!requireReady()) {
            return Optional.empty();
        }

        DecoraDevice device = devices.get(deviceId);
        if (device == null) {
            return Optional.empty();
        }
        return Optional.of(DeviceStatus.of(device));
    }

    /**
     * Register a local model for every switch, dimmer and fan on the account.
     *
     * @return number of newly registered devices
     */
    public int syncDevices() {
        if (!requireReady()) {
            return 0;
        }

        sessionService.ensureAuthenticated();
        List<DeviceInfo> remote = apiClient.getDevices();

        int added = 0;
        for (DeviceInfo info : remote) {
            if (info.getId() == null || getDevice(info.getId()).isPresent()) {
                continue;
            }
            DecoraDevice device = createDevice(info);
            if (device != null && addDevice(device)) {
                added++;
            }
        }

        log.info("Synchronized {} remote device(s); {} newly registered", remote.size(), added);
        return added;
    }

    // ========================================================================
    // COMMANDS
    // ========================================================================

    /**
     * Send a state change to a registered device and mirror the reported
     * state locally.
     *
     * @return true if the device accepted the command
     */
    public boolean sendCommand(String deviceId, DeviceStateRequest request) {
        if (!requireReady()) {
            return false;
        }
        if (getDevice(deviceId).isEmpty()) {
            raiseError(ModuleErrorType.DEVICE_ERROR, "Device " + deviceId + " is not registered");
            return false;
        }

        try {
            sessionService.ensureAuthenticated();
            DeviceState reported = apiClient.setDeviceState(deviceId, request);
            applyState(deviceId, reported != null ? reported : fromRequest(request));
            return true;
        } catch (ApiRequestException e) {
            raiseError(ModuleErrorType.COMMUNICATION_ERROR,
                    "Decora API rejected command for device " + deviceId + ": " + e.getMessage());
            return false;
        } catch (RuntimeException e) {
            raiseError(ModuleErrorType.COMMAND_ERROR,
                    "Failed to send command to device " + deviceId + ": " + e.getMessage());
            return false;
        }
    }

    /**
     * Update the local model of a device from a state reported by the API.
     * Unknown devices are ignored.
     */
    public synchronized void applyState(String deviceId, DeviceState state) {
        DecoraDevice device = devices.get(deviceId);
        if (device == null || state == null) {
            return;
        }

        String power = state.getPower();
        Integer brightness = state.getBrightness();

        if (device instanceof DecoraSwitch sw) {
            if ("on".equalsIgnoreCase(power)) {
                sw.turnOn();
            } else if ("off".equalsIgnoreCase(power)) {
                sw.turnOff();
            }
        } else if (device instanceof DecoraDimmer dimmer) {
            if ("off".equalsIgnoreCase(power)) {
                dimmer.setBrightness(dimmer.getMinBrightness());
            } else if (brightness != null) {
                dimmer.setBrightness(Math.max(dimmer.getMinBrightness(),
                        Math.min(brightness, dimmer.getMaxBrightness())));
            }
        } else if (device instanceof DecoraFan fan) {
            if ("off".equalsIgnoreCase(power)) {
                fan.turnOff();
            } else if (brightness != null) {
                fan.setSpeed(FanSpeed.fromPercentage(brightness));
            }
        }
    }

    // ========================================================================
    // EVENTS
    // ========================================================================

    @Override
    public void onDeviceEvent(DecoraDevice device, DeviceEvent event) {
        log.info("Device {} changed: {}", device.getDeviceId(), event);
    }

    public void addListener(ModuleEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(ModuleEventListener listener) {
        listeners.remove(listener);
    }

    public ModuleStatus getStatus() {
        return status;
    }

    public boolean isReady() {
        return status == ModuleStatus.INITIALIZED || status == ModuleStatus.RUNNING;
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private boolean requireReady() {
        if (isReady()) {
            return true;
        }
        raiseError(ModuleErrorType.MODULE_NOT_INITIALIZED, "Device registry is not initialized");
        return false;
    }

    private void changeStatus(ModuleStatus next) {
        ModuleStatus previous = status;
        if (previous == next) {
            return;
        }
        status = next;
        log.debug("Device registry status {} -> {}", previous, next);
        for (ModuleEventListener listener : listeners) {
            listener.onStatusChanged(previous, next);
        }
    }

    private void raiseError(ModuleErrorType type, String message) {
        log.error("{}: {}", type, message);
        ModuleEventListener.ModuleError error = new ModuleEventListener.ModuleError(type, message, Instant.now());
        for (ModuleEventListener listener : listeners) {
            listener.onError(error);
        }
    }

    private static DecoraDevice createDevice(DeviceInfo info) {
        String name = info.getName() != null ? info.getName() : info.getId();
        return switch (DeviceType.fromApiType(info.getType())) {
            case SWITCH -> new DecoraSwitch(info.getId(), name);
            case DIMMER -> new DecoraDimmer(info.getId(), name);
            case FAN -> new DecoraFan(info.getId(), name);
            default -> null;
        };
    }

    private static DeviceState fromRequest(DeviceStateRequest request) {
        return DeviceState.builder()
                .power(request.getPower())
                .brightness(request.getBrightness())
                .colorTemperature(request.getColorTemperature())
                .build();
    }

    /**
     * Point-in-time view of a registered device.
     */
    public record DeviceStatus(
            String deviceId,
            String name,
            DeviceType type,
            boolean online,
            Instant lastCommunication,
            String description
    ) {
        static DeviceStatus of(DecoraDevice device) {
            return new DeviceStatus(device.getDeviceId(), device.getDeviceName(), device.getDeviceType(),
                    device.isOnline(), device.getLastCommunication(), device.toString());
        }
    }
}
