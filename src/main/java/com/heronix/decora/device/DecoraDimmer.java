package com.heronix.decora.device;

import java.time.Instant;

import com.heronix.decora.model.enums.DeviceType;

/**
 * Dimmable load. Any brightness above zero counts as on.
 */
public class DecoraDimmer extends DecoraDevice {

    public static final int DEFAULT_STEP = 10;
    public static final int DEFAULT_FADE_TIME_MS = 500;

    private final int minBrightness;
    private final int maxBrightness;

    private int brightnessLevel;
    private int fadeTimeMs = DEFAULT_FADE_TIME_MS;

    public DecoraDimmer(String deviceId, String deviceName) {
        this(deviceId, deviceName, 0, 100);
    }

    public DecoraDimmer(String deviceId, String deviceName, int minBrightness, int maxBrightness) {
        super(deviceId, deviceName, DeviceType.DIMMER);
        if (minBrightness < 0 || maxBrightness > 100 || minBrightness > maxBrightness) {
            throw new IllegalArgumentException("Brightness range must lie within 0-100.");
        }
        this.minBrightness = minBrightness;
        this.maxBrightness = maxBrightness;
    }

    /**
     * @throws IllegalArgumentException if level is outside [minBrightness, maxBrightness]
     */
    public synchronized void setBrightness(int level) {
        if (level < minBrightness || level > maxBrightness) {
            throw new IllegalArgumentException(
                    "Brightness level must be between " + minBrightness + " and " + maxBrightness);
        }

        int previousLevel = brightnessLevel;
        brightnessLevel = level;
        touch();

        if (previousLevel != brightnessLevel) {
            publish(new DeviceEvent.DimmerBrightnessChanged(getDeviceId(), previousLevel, brightnessLevel, Instant.now()));
        }
    }

    public synchronized void increaseBrightness(int increment) {
        setBrightness(Math.min(brightnessLevel + increment, maxBrightness));
    }

    public void increaseBrightness() {
        increaseBrightness(DEFAULT_STEP);
    }

    public synchronized void decreaseBrightness(int decrement) {
        setBrightness(Math.max(brightnessLevel - decrement, minBrightness));
    }

    public void decreaseBrightness() {
        decreaseBrightness(DEFAULT_STEP);
    }

    public synchronized int getBrightnessLevel() {
        return brightnessLevel;
    }

    public synchronized boolean isOn() {
        return brightnessLevel > 0;
    }

    public synchronized int getFadeTimeMs() {
        return fadeTimeMs;
    }

    public synchronized void setFadeTimeMs(int fadeTimeMs) {
        if (fadeTimeMs < 0) {
            throw new IllegalArgumentException("Fade time cannot be negative.");
        }
        this.fadeTimeMs = fadeTimeMs;
    }

    public int getMinBrightness() {
        return minBrightness;
    }

    public int getMaxBrightness() {
        return maxBrightness;
    }

    @Override
    protected synchronized void resetState() {
        brightnessLevel = 0;
    }
}
