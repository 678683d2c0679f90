package com.stationsync.synchronizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.stationsync.common.dto.sync.SyncCycleSummary;
import com.stationsync.synchronizer.orchestrator.SyncState;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncStatusResponse {
    boolean running;
    SyncState state;
    List<String> groups;
    Long intervalSeconds;
    Map<String, Long> checkpoints;
    int cachedDevices;
    SyncCycleSummary lastCycle;
    String lastError;
}
