package com.stationsync.synchronizer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.stationsync.common.model.DeviceRecord;

/**
 * A cached device with its token masked.
 */
public record DeviceView(
    @JsonProperty("deviceId")
    String deviceId,

    @JsonProperty("deviceName")
    String deviceName,

    @JsonProperty("token")
    String token
) {
    public static DeviceView from(DeviceRecord device) {
        return new DeviceView(device.deviceId(), device.deviceName(), device.maskedToken());
    }
}
