package com.stationsync.common.dto.sync;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.stationsync.common.model.RunOutcome;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated result of one poll cycle across all configured experiment groups.
 * Groups whose poll failed are listed with the error message and were skipped for this cycle.
 */
public record SyncCycleSummary(
    @JsonProperty("startedAt")
    Instant startedAt,

    @JsonProperty("finishedAt")
    Instant finishedAt,

    @JsonProperty("outcomes")
    List<RunOutcome> outcomes,

    @JsonProperty("failedGroups")
    Map<String, String> failedGroups
) {
    public SyncCycleSummary {
        outcomes = outcomes != null ? List.copyOf(outcomes) : List.of();
        failedGroups = failedGroups != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(failedGroups))
                : Map.of();
    }

    @JsonProperty("total")
    public int total() {
        return outcomes.size();
    }

    @JsonProperty("successful")
    public long successful() {
        return outcomes.stream().filter(RunOutcome::success).count();
    }

    @JsonProperty("failed")
    public long failed() {
        return total() - successful();
    }

    @JsonProperty("recordsSent")
    public long recordsSent() {
        return outcomes.stream().mapToLong(RunOutcome::recordsSent).sum();
    }
}
