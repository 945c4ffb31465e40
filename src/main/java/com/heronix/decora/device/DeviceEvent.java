package com.heronix.decora.device;

import java.time.Instant;

/**
 * State change published by a {@link DecoraDevice}.
 */
public interface DeviceEvent {

    String deviceId();

    Instant timestamp();

    /**
     * Switch turned on or off.
     */
    record SwitchStateChanged(String deviceId, boolean on, int loadLevel, Instant timestamp)
            implements DeviceEvent {}

    /**
     * Dimmer brightness moved from one level to another.
     */
    record DimmerBrightnessChanged(String deviceId, int previousLevel, int currentLevel, Instant timestamp)
            implements DeviceEvent {}

    /**
     * Fan speed stepped from one setting to another.
     */
    record FanSpeedChanged(String deviceId, FanSpeed previousSpeed, FanSpeed currentSpeed, Instant timestamp)
            implements DeviceEvent {}
}
