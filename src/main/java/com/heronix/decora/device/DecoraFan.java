package com.heronix.decora.device;

import java.time.Instant;
import java.util.Objects;

import com.heronix.decora.model.enums.DeviceType;

/**
 * Four-speed fan controller.
 */
public class DecoraFan extends DecoraDevice {

    private FanSpeed currentSpeed = FanSpeed.OFF;

    public DecoraFan(String deviceId, String deviceName) {
        super(deviceId, deviceName, DeviceType.FAN);
    }

    public synchronized void setSpeed(FanSpeed speed) {
        Objects.requireNonNull(speed, "speed");

        FanSpeed previousSpeed = currentSpeed;
        currentSpeed = speed;
        touch();

        if (previousSpeed != currentSpeed) {
            publish(new DeviceEvent.FanSpeedChanged(getDeviceId(), previousSpeed, currentSpeed, Instant.now()));
        }
    }

    public void turnOff() {
        setSpeed(FanSpeed.OFF);
    }

    /**
     * Step to the next speed, wrapping from HIGH back to OFF.
     */
    public synchronized void cycleSpeed() {
        setSpeed(currentSpeed.next());
    }

    public synchronized FanSpeed getCurrentSpeed() {
        return currentSpeed;
    }

    public synchronized boolean isRunning() {
        return currentSpeed != FanSpeed.OFF;
    }

    public synchronized int getSpeedPercentage() {
        return currentSpeed.percentage();
    }

    @Override
    protected synchronized void resetState() {
        currentSpeed = FanSpeed.OFF;
    }
}
