package com.stationsync.synchronizer.exception;

/**
 * An object-store payload could not be decoded into a tabular dataset.
 */
public class DatasetFormatException extends SyncException {

    public DatasetFormatException(String message) {
        super(message);
    }

    public DatasetFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
