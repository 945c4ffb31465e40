package com.heronix.decora.model.dto;

import java.time.OffsetDateTime;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Device description returned by the Decora API device endpoints.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeviceInfo {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    /**
     * Device type as reported by the cloud (e.g. "dimmer", "switch").
     */
    @JsonProperty("type")
    private String type;

    @JsonProperty("model")
    private String model;

    @JsonProperty("location")
    private String location;

    @JsonProperty("state")
    private DeviceState state;

    @JsonProperty("capabilities")
    private List<String> capabilities;

    @JsonProperty("status")
    private String status;

    @JsonProperty("last_updated")
    private OffsetDateTime lastUpdated;
}
