package com.stationsync.synchronizer.discovery;

import com.stationsync.common.model.RunRecord;
import com.stationsync.synchronizer.client.ExperimentStore;
import com.stationsync.synchronizer.config.SyncProperties;
import com.stationsync.synchronizer.exception.ExperimentStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Finds runs started after the group's checkpoint.
 */
@Service
@Slf4j
public class RunDiscoveryService {

    private final ExperimentStore experimentStore;
    private final int maxRunsPerPoll;

    public RunDiscoveryService(ExperimentStore experimentStore, SyncProperties properties) {
        this.experimentStore = experimentStore;
        this.maxRunsPerPoll = properties.getMaxRunsPerPoll();
    }

    /**
     * Returns the runs of {@code group} newer than its checkpoint, newest first, and
     * advances the checkpoint past them. Polling again without new runs returns nothing.
     *
     * @throws ExperimentStoreException if the store cannot be queried; the checkpoint is untouched
     */
    public List<RunRecord> poll(String group, SyncCheckpoint checkpoint) {
        long since = checkpoint.get(group);
        List<RunRecord> fresh = experimentStore.getRuns(group, maxRunsPerPoll).stream()
                .filter(run -> run.startTime() > since)
                .toList();

        if (fresh.isEmpty()) {
            log.debug("No new runs in '{}' since {}", group, since);
            return fresh;
        }

        long newest = fresh.stream().mapToLong(RunRecord::startTime).max().getAsLong();
        checkpoint.advance(group, newest);
        log.info("Found {} new runs in '{}', checkpoint {} -> {}", fresh.size(), group, since, newest);
        return fresh;
    }

    public List<String> availableGroups() {
        return experimentStore.listGroups();
    }
}
