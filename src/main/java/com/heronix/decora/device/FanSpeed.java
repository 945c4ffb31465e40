package com.heronix.decora.device;

/**
 * Fan speed settings, in cycling order.
 */
public enum FanSpeed {
    OFF,
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Speed as a percentage: 33 per step above OFF.
     */
    public int percentage() {
        return ordinal() * 33;
    }

    /**
     * Nearest speed for a 0-100 level: 0 is OFF, up to 33 LOW, up to 66 MEDIUM, above that HIGH.
     */
    public static FanSpeed fromPercentage(int percentage) {
        if (percentage <= 0) {
            return OFF;
        }
        if (percentage <= 33) {
            return LOW;
        }
        if (percentage <= 66) {
            return MEDIUM;
        }
        return HIGH;
    }

    public FanSpeed next() {
        FanSpeed[] speeds = values();
        return speeds[(ordinal() + 1) % speeds.length];
    }
}
