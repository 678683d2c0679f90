package com.stationsync.synchronizer.transform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Source column to telemetry key. An empty mapping forwards every column under its own name.
 */
public record ColumnMapping(Map<String, String> columns) {

    private static final ColumnMapping ALL = new ColumnMapping(Map.of());

    public ColumnMapping {
        columns = columns != null ? Collections.unmodifiableMap(new LinkedHashMap<>(columns)) : Map.of();
    }

    public static ColumnMapping all() {
        return ALL;
    }

    public static ColumnMapping of(Map<String, String> columns) {
        return columns == null || columns.isEmpty() ? ALL : new ColumnMapping(columns);
    }

    public boolean forwardsAll() {
        return columns.isEmpty();
    }
}
