package com.stationsync.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One timestamped set of measurements, in the shape the telemetry platform accepts.
 * Values are either {@link Double} or {@link String}.
 *
 * Example JSON:
 * {
 *   "ts": 1704067200000,
 *   "values": {"temperatura": 23.5, "umidade": 81.0}
 * }
 */
public record TelemetryRecord(
    @JsonProperty("ts")
    long timestampMillis,

    @NotEmpty
    @JsonProperty("values")
    Map<String, Object> values
) {
    @JsonCreator
    public TelemetryRecord(
        @JsonProperty("ts") long timestampMillis,
        @JsonProperty("values") Map<String, Object> values
    ) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("Telemetry record at " + timestampMillis + " has no values");
        }
        this.timestampMillis = timestampMillis;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Instant timestamp() {
        return Instant.ofEpochMilli(timestampMillis);
    }
}
