package com.stationsync.synchronizer.transform;

import com.stationsync.synchronizer.config.SyncProperties;

import java.time.ZoneId;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Where the timestamp of a row comes from: a single datetime column, or a date column
 * combined with an hour column. Local values are read in {@code zone}.
 */
public record TimestampRule(List<String> timestampColumns, String dateColumn, String hourColumn, ZoneId zone) {

    public TimestampRule {
        timestampColumns = timestampColumns != null ? List.copyOf(timestampColumns) : List.of();
        zone = zone != null ? zone : ZoneId.of("UTC");
    }

    public static TimestampRule from(SyncProperties.Transform settings) {
        return new TimestampRule(settings.getTimestampColumns(), settings.getDateColumn(),
                settings.getHourColumn(), ZoneId.of(settings.getZone()));
    }

    /**
     * First configured timestamp column present in the header.
     */
    public Optional<String> timestampColumnIn(List<String> header) {
        return timestampColumns.stream().filter(header::contains).findFirst();
    }

    public boolean hasDateAndHourIn(List<String> header) {
        return dateColumn != null && hourColumn != null
                && header.contains(dateColumn) && header.contains(hourColumn);
    }

    /**
     * Every column this rule may read a timestamp from; never forwarded as a value.
     */
    public Set<String> reservedColumns() {
        Set<String> reserved = new LinkedHashSet<>(timestampColumns);
        if (dateColumn != null) {
            reserved.add(dateColumn);
        }
        if (hourColumn != null) {
            reserved.add(hourColumn);
        }
        return reserved;
    }
}
