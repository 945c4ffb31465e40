package com.heronix.decora.model.dto;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Current state of a device as reported by the Decora API.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeviceState {

    /**
     * "on" or "off"
     */
    @JsonProperty("power")
    private String power;

    /**
     * Brightness percentage (0-100).
     */
    @JsonProperty("brightness")
    private Integer brightness;

    /**
     * Color temperature in Kelvin.
     */
    @JsonProperty("color_temperature")
    private Integer colorTemperature;

    @JsonProperty("hue")
    private Integer hue;

    @JsonProperty("saturation")
    private Integer saturation;

    @JsonProperty("on_off")
    private Boolean onOff;

    @JsonProperty("timestamp")
    private OffsetDateTime timestamp;

    /**
     * Human readable summary, e.g. "Power: on | Brightness: 40%".
     */
    public String describe() {
        List<String> parts = new ArrayList<>();
        parts.add("Power: " + power);
        if (brightness != null) parts.add("Brightness: " + brightness + "%");
        if (colorTemperature != null) parts.add("ColorTemp: " + colorTemperature + "K");
        if (hue != null) parts.add("Hue: " + hue);
        if (saturation != null) parts.add("Saturation: " + saturation + "%");
        return String.join(" | ", parts);
    }
}
