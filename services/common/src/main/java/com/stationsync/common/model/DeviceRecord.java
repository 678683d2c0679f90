package com.stationsync.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Telemetry platform device that receives the processed data of one station.
 * The auth token is the device's push credential and is never blank.
 */
public record DeviceRecord(
    @NotBlank
    @JsonProperty("deviceId")
    String deviceId,

    @NotBlank
    @JsonProperty("deviceName")
    String deviceName,

    @NotBlank
    @JsonProperty("authToken")
    String authToken
) {
    public DeviceRecord {
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("Device id is required");
        }
        if (authToken == null || authToken.isBlank()) {
            throw new IllegalArgumentException("Device token is required for device " + deviceId);
        }
    }

    /**
     * Token shortened for logs and status views.
     */
    public String maskedToken() {
        return authToken.length() > 10 ? authToken.substring(0, 10) + "..." : authToken;
    }

    @Override
    public String toString() {
        return "DeviceRecord[deviceId=" + deviceId + ", deviceName=" + deviceName
                + ", authToken=" + maskedToken() + "]";
    }
}
