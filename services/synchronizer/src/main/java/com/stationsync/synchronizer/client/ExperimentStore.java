package com.stationsync.synchronizer.client;

import com.stationsync.common.model.RunRecord;
import com.stationsync.synchronizer.exception.ExperimentStoreException;

import java.util.List;

/**
 * Read access to the experiment-tracking store.
 */
public interface ExperimentStore {

    /**
     * Names of all experiment groups visible to this client.
     */
    List<String> listGroups();

    /**
     * Most recent runs of a group, newest first, at most {@code maxResults}.
     * An unknown group yields an empty list.
     *
     * @throws ExperimentStoreException if the store cannot be queried
     */
    List<RunRecord> getRuns(String group, int maxResults);
}
