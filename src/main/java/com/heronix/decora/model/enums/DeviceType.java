package com.heronix.decora.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Decora device families known to the bridge.
 */
@Getter
@RequiredArgsConstructor
public enum DeviceType {

    DIMMER("Dimmer"),

    SWITCH("Switch"),

    FAN("Fan Speed Controller"),

    OCCUPANCY("Occupancy Sensor"),

    DAYLIGHT("Daylight Sensor"),

    UNKNOWN("Unknown");

    /**
     * Display name for the device type
     */
    private final String displayName;

    /**
     * Map the cloud's free-form type string to a device type.
     */
    public static DeviceType fromApiType(String type) {
        if (type == null) {
            return UNKNOWN;
        }
        String normalized = type.trim().toUpperCase();
        for (DeviceType candidate : values()) {
            if (candidate.name().equals(normalized)) {
                return candidate;
            }
        }
        return UNKNOWN;
    }
}
