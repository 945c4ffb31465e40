package com.heronix.decora.device;

import java.time.Instant;

import com.heronix.decora.model.enums.DeviceType;

/**
 * On/off switch. Load level is 100 when on and 0 when off.
 */
public class DecoraSwitch extends DecoraDevice {

    private boolean on;
    private int loadLevel;

    public DecoraSwitch(String deviceId, String deviceName) {
        super(deviceId, deviceName, DeviceType.SWITCH);
    }

    public synchronized void turnOn() {
        if (!on) {
            on = true;
            loadLevel = 100;
            touch();
            publish(new DeviceEvent.SwitchStateChanged(getDeviceId(), true, loadLevel, Instant.now()));
        }
    }

    public synchronized void turnOff() {
        if (on) {
            on = false;
            loadLevel = 0;
            touch();
            publish(new DeviceEvent.SwitchStateChanged(getDeviceId(), false, loadLevel, Instant.now()));
        }
    }

    public synchronized void toggle() {
        if (on) {
            turnOff();
        } else {
            turnOn();
        }
    }

    public synchronized boolean isOn() {
        return on;
    }

    public synchronized int getLoadLevel() {
        return loadLevel;
    }

    @Override
    protected synchronized void resetState() {
        on = false;
        loadLevel = 0;
    }
}
