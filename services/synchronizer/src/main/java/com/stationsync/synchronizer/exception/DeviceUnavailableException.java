package com.stationsync.synchronizer.exception;

/**
 * Device lookup, creation or token retrieval failed. Aborts the current run only.
 */
public class DeviceUnavailableException extends SyncException {

    public DeviceUnavailableException(String message) {
        super(message);
    }

    public DeviceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
