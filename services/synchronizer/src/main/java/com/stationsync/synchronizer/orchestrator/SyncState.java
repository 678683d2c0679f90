package com.stationsync.synchronizer.orchestrator;

/**
 * What the synchronizer is doing right now.
 */
public enum SyncState {
    IDLE,
    POLLING,
    RESOLVING,
    DEVICE_LOOKUP,
    DATA_LOOKUP,
    TRANSFORMING,
    DELIVERING,
    STOPPED
}
