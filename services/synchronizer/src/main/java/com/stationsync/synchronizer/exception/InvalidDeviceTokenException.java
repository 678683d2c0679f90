package com.stationsync.synchronizer.exception;

public class InvalidDeviceTokenException extends SyncException {

    public InvalidDeviceTokenException(String deviceName) {
        super("Device " + deviceName + " has no usable auth token");
    }
}
