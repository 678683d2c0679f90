package com.stationsync.synchronizer.client;

import com.stationsync.common.model.TelemetryRecord;
import com.stationsync.synchronizer.exception.PlatformAuthenticationException;
import com.stationsync.synchronizer.exception.TelemetryPlatformException;

import java.util.List;
import java.util.Optional;

/**
 * Device directory and timeseries ingestion of the telemetry platform.
 * Every method except {@link #pushTimeseries} requires a prior {@link #authenticate()}.
 * Failures surface as {@link TelemetryPlatformException}.
 */
public interface TelemetryPlatform {

    /**
     * Logs in with the configured tenant credentials, unless a session is already held.
     *
     * @throws PlatformAuthenticationException if the credentials are rejected
     */
    void authenticate();

    boolean isAuthenticated();

    Optional<PlatformDevice> findDevice(String name);

    PlatformDevice createDevice(String name, String type, String label);

    /**
     * Access token of the device, or empty when the platform returned none.
     */
    Optional<String> getToken(String deviceId);

    /**
     * Pushes one batch to the device identified by {@code token}. Returns normally only on 2xx.
     */
    void pushTimeseries(String token, List<TelemetryRecord> batch);
}
