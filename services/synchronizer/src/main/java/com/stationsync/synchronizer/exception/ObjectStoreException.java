package com.stationsync.synchronizer.exception;

/**
 * Listing or reading an object-store key failed.
 */
public class ObjectStoreException extends SyncException {

    public ObjectStoreException(String message) {
        super(message);
    }

    public ObjectStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
