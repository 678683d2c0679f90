package com.stationsync.synchronizer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SyncControlResponse(
    @JsonProperty("status")
    String status,

    @JsonProperty("message")
    String message
) {
    public static SyncControlResponse of(String status, String message) {
        return new SyncControlResponse(status, message);
    }
}
