package com.stationsync.synchronizer.transform;

import com.stationsync.common.model.TelemetryRecord;
import com.stationsync.synchronizer.config.SyncProperties;
import com.stationsync.synchronizer.source.Dataset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Turns the rows of a result file into telemetry records.
 *
 * <p>The timestamp source is chosen once per dataset from its header: a datetime column,
 * else a date plus hour column pair, else the time of the transformation. Rows whose
 * timestamp cannot be read, or that keep no value, are dropped.
 */
@Component
@Slf4j
public class TabularTransformer {

    private final Set<String> missingMarkers;
    private final ColumnMapping defaultMapping;
    private final TimestampRule defaultRule;
    private final Clock clock;

    @Autowired
    public TabularTransformer(SyncProperties properties) {
        this(properties.getTransform(), Clock.systemUTC());
    }

    public TabularTransformer(SyncProperties.Transform settings, Clock clock) {
        this.missingMarkers = Set.copyOf(settings.getMissingMarkers());
        this.defaultMapping = settings.isForwardAllColumns()
                ? ColumnMapping.all()
                : ColumnMapping.of(settings.getValueColumns());
        this.defaultRule = TimestampRule.from(settings);
        this.clock = clock;
    }

    public List<TelemetryRecord> transform(Dataset dataset) {
        return transform(dataset, defaultMapping, defaultRule);
    }

    public List<TelemetryRecord> transform(Dataset dataset, ColumnMapping mapping, TimestampRule rule) {
        Set<String> timeColumns = new LinkedHashSet<>();
        Function<Map<String, String>, Optional<Instant>> timestampOf = timestampSource(dataset, rule, timeColumns);
        Map<String, String> targets = targets(dataset, mapping, rule);

        List<TelemetryRecord> records = new ArrayList<>(dataset.size());
        int droppedTime = 0;
        int droppedEmpty = 0;
        for (Map<String, String> row : dataset.rows()) {
            Optional<Instant> timestamp = timestampOf.apply(row);
            if (timestamp.isEmpty()) {
                droppedTime++;
                continue;
            }
            Map<String, Object> values = values(row, targets, timeColumns);
            if (values.isEmpty()) {
                droppedEmpty++;
                continue;
            }
            records.add(new TelemetryRecord(timestamp.get().toEpochMilli(), values));
        }

        log.debug("Transformed {} of {} rows ({} without timestamp, {} without values)",
                records.size(), dataset.size(), droppedTime, droppedEmpty);
        return records;
    }

    /**
     * The {@code limit} most recent records in timestamp order, or all of them when
     * {@code limit} is not positive.
     */
    public static List<TelemetryRecord> mostRecent(List<TelemetryRecord> records, int limit) {
        if (limit <= 0 || records.size() <= limit) {
            return records;
        }
        List<TelemetryRecord> sorted = records.stream()
                .sorted(Comparator.comparingLong(TelemetryRecord::timestampMillis))
                .toList();
        return sorted.subList(sorted.size() - limit, sorted.size());
    }

    private Function<Map<String, String>, Optional<Instant>> timestampSource(
            Dataset dataset, TimestampRule rule, Set<String> consumed) {
        Optional<String> column = rule.timestampColumnIn(dataset.columns());
        if (column.isPresent()) {
            String name = column.get();
            consumed.add(name);
            return row -> TimestampParser.parseDateTime(row.get(name), rule.zone());
        }
        if (rule.hasDateAndHourIn(dataset.columns())) {
            consumed.add(rule.dateColumn());
            consumed.add(rule.hourColumn());
            return row -> TimestampParser.parseDateAndHour(
                    row.get(rule.dateColumn()), row.get(rule.hourColumn()), rule.zone());
        }
        Instant now = clock.instant();
        log.debug("No timestamp columns in {}, using transformation time {}", dataset.columns(), now);
        return row -> Optional.of(now);
    }

    private static Map<String, String> targets(Dataset dataset, ColumnMapping mapping, TimestampRule rule) {
        if (!mapping.forwardsAll()) {
            return mapping.columns();
        }
        Set<String> reserved = rule.reservedColumns();
        Map<String, String> identity = new LinkedHashMap<>();
        for (String column : dataset.columns()) {
            if (!reserved.contains(column)) {
                identity.put(column, column);
            }
        }
        return identity;
    }

    private Map<String, Object> values(Map<String, String> row, Map<String, String> targets, Set<String> timeColumns) {
        Map<String, Object> values = new LinkedHashMap<>();
        targets.forEach((source, target) -> {
            if (timeColumns.contains(source)) {
                return;
            }
            String raw = row.get(source);
            if (raw == null) {
                return;
            }
            String trimmed = raw.trim();
            if (trimmed.isEmpty() || missingMarkers.contains(trimmed)) {
                return;
            }
            values.put(target, convert(trimmed));
        });
        return values;
    }

    /**
     * Decimal comma or point to a double; anything else is kept as text.
     */
    static Object convert(String value) {
        try {
            return new BigDecimal(value.replace(',', '.')).doubleValue();
        } catch (NumberFormatException e) {
            return value;
        }
    }
}
