package com.heronix.decora.device;

/**
 * Receives state changes from devices.
 */
@FunctionalInterface
public interface DeviceEventListener {

    void onDeviceEvent(DecoraDevice device, DeviceEvent event);
}
