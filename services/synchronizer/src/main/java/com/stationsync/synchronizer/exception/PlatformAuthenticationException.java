package com.stationsync.synchronizer.exception;

/**
 * Login to the telemetry platform was rejected. Fatal: a cycle cannot start without it.
 */
public class PlatformAuthenticationException extends TelemetryPlatformException {

    public PlatformAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
