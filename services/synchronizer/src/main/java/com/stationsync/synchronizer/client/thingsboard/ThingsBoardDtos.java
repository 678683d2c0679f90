package com.stationsync.synchronizer.client.thingsboard;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.stationsync.synchronizer.client.PlatformDevice;

/**
 * Request and response bodies of the ThingsBoard tenant REST API.
 */
public final class ThingsBoardDtos {

    private ThingsBoardDtos() {}

    public record LoginRequest(
        @JsonProperty("username")
        String username,

        @JsonProperty("password")
        String password
    ) {
        @Override
        public String toString() {
            return "LoginRequest[username=" + username + "]";
        }
    }

    public record LoginResponse(
        @JsonProperty("token")
        String token,

        @JsonProperty("refreshToken")
        String refreshToken
    ) {
    }

    public record EntityId(
        @JsonProperty("id")
        String id,

        @JsonProperty("entityType")
        String entityType
    ) {
    }

    public record Device(
        @JsonProperty("id")
        EntityId id,

        @JsonProperty("name")
        String name,

        @JsonProperty("type")
        String type
    ) {
        PlatformDevice toPlatformDevice() {
            return new PlatformDevice(id != null ? id.id() : null, name, type);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CreateDeviceRequest(
        @JsonProperty("name")
        String name,

        @JsonProperty("type")
        String type,

        @JsonProperty("label")
        String label
    ) {
    }

    public record DeviceCredentials(
        @JsonProperty("credentialsType")
        String credentialsType,

        @JsonProperty("credentialsId")
        String credentialsId
    ) {
    }
}
