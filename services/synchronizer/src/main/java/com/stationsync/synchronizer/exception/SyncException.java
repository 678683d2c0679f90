package com.stationsync.synchronizer.exception;

/**
 * Base type for failures raised by the synchronization pipeline and its collaborators.
 */
public class SyncException extends RuntimeException {

    public SyncException(String message) {
        super(message);
    }

    public SyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
