package com.stationsync.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One recorded execution in the experiment store, as seen by a single poll.
 *
 * Example JSON:
 * {
 *   "runId": "4f1c0e...",
 *   "runName": "processed_data_PETROLINA_20240101",
 *   "startTime": 1704067200000,
 *   "tags": {"station": "PETROLINA"},
 *   "params": {"station_name": "PETROLINA"}
 * }
 */
public record RunRecord(
    @NotBlank
    @JsonProperty("runId")
    String runId,

    @JsonProperty("runName")
    String runName,

    @JsonProperty("startTime")
    long startTime,

    @JsonProperty("tags")
    Map<String, String> tags,

    @JsonProperty("params")
    Map<String, String> params
) {
    public RunRecord {
        tags = tags != null ? Collections.unmodifiableMap(new LinkedHashMap<>(tags)) : Map.of();
        params = params != null ? Collections.unmodifiableMap(new LinkedHashMap<>(params)) : Map.of();
    }

    /**
     * Returns the tag value, or empty when the tag is absent or blank.
     */
    public Optional<String> tag(String key) {
        return nonBlank(tags.get(key));
    }

    /**
     * Returns the param value, or empty when the param is absent or blank.
     */
    public Optional<String> param(String key) {
        return nonBlank(params.get(key));
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }
}
