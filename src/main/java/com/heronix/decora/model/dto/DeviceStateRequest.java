package com.heronix.decora.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for changing a device's state. Only non-null fields are sent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeviceStateRequest {

    @JsonProperty("power")
    private String power;

    @Min(0)
    @Max(100)
    @JsonProperty("brightness")
    private Integer brightness;

    @Min(2000)
    @Max(6500)
    @JsonProperty("color_temperature")
    private Integer colorTemperature;

    @JsonProperty("hue")
    private Integer hue;

    @JsonProperty("saturation")
    private Integer saturation;
}
