package com.stationsync.synchronizer.exception;

/**
 * The experiment store could not be queried. The affected group is skipped for the current cycle.
 */
public class ExperimentStoreException extends SyncException {

    public ExperimentStoreException(String message) {
        super(message);
    }

    public ExperimentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
