package com.heronix.decora.device;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import com.heronix.decora.model.enums.DeviceType;

import lombok.extern.slf4j.Slf4j;

/**
 * Base class for Decora devices tracked by the bridge.
 *
 * Subclasses hold the last known state of one physical device and publish a
 * {@link DeviceEvent} to registered listeners whenever that state changes.
 */
@Slf4j
public abstract class DecoraDevice {

    private final String deviceId;
    private final String deviceName;
    private final DeviceType deviceType;
    private final List<DeviceEventListener> listeners = new CopyOnWriteArrayList<>();

    private volatile boolean online;
    private volatile Instant lastCommunication;

    protected DecoraDevice(String deviceId, String deviceName, DeviceType deviceType) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.deviceName = Objects.requireNonNull(deviceName, "deviceName");
        this.deviceType = Objects.requireNonNull(deviceType, "deviceType");
        this.online = false;
        this.lastCommunication = Instant.now();
    }

    /**
     * Bring the device online.
     */
    public void initialize() {
        online = true;
        touch();
    }

    /**
     * Take the device offline and reset it to its idle state.
     */
    public void shutdown() {
        online = false;
        resetState();
        touch();
    }

    /**
     * Reset device-specific state on shutdown. No events are published.
     */
    protected abstract void resetState();

    public void addListener(DeviceEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(DeviceEventListener listener) {
        listeners.remove(listener);
    }

    protected void publish(DeviceEvent event) {
        for (DeviceEventListener listener : listeners) {
            try {
                listener.onDeviceEvent(this, event);
            } catch (RuntimeException e) {
                log.warn("Listener failed for device {} event {}: {}", deviceId, event, e.getMessage());
            }
        }
    }

    protected void touch() {
        lastCommunication = Instant.now();
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getDeviceName() {
        return deviceName;
    }

    public DeviceType getDeviceType() {
        return deviceType;
    }

    public boolean isOnline() {
        return online;
    }

    public Instant getLastCommunication() {
        return lastCommunication;
    }

    @Override
    public String toString() {
        return "Device: " + deviceName + " (" + deviceId + ") - Type: " + deviceType.getDisplayName()
                + " - Status: " + (online ? "online" : "offline");
    }
}
