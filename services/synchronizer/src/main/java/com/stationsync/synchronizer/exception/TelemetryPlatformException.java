package com.stationsync.synchronizer.exception;

/**
 * A telemetry platform call failed: timeout, transport error or non-2xx response.
 */
public class TelemetryPlatformException extends SyncException {

    public TelemetryPlatformException(String message) {
        super(message);
    }

    public TelemetryPlatformException(String message, Throwable cause) {
        super(message, cause);
    }
}
