package com.stationsync.synchronizer.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Header and rows of one tabular result file. Values are kept as raw strings.
 */
public record Dataset(List<String> columns, List<Map<String, String>> rows) {

    public Dataset {
        columns = List.copyOf(columns);
        rows = rows.stream()
                .map(row -> Collections.unmodifiableMap(new LinkedHashMap<>(row)))
                .toList();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }
}
