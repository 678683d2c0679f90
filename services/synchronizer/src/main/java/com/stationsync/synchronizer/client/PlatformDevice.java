package com.stationsync.synchronizer.client;

/**
 * Device as listed by the telemetry platform, before its credentials are fetched.
 */
public record PlatformDevice(String id, String name, String type) {
}
