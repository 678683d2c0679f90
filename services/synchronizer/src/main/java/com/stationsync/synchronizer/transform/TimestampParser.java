package com.stationsync.synchronizer.transform;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalQuery;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Lenient parsing of the date and time notations found in station result files.
 */
final class TimestampParser {

    private static final String UTC_SUFFIX = " utc";

    private static final Pattern DECIMAL_HOUR = Pattern.compile("\\d+\\.\\d+");

    private static final List<DateTimeFormatter> OFFSET_DATE_TIMES = List.of(
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            new DateTimeFormatterBuilder()
                    .append(DateTimeFormatter.ISO_LOCAL_DATE)
                    .appendLiteral(' ')
                    .append(DateTimeFormatter.ISO_LOCAL_TIME)
                    .appendOffsetId()
                    .toFormatter(Locale.ROOT));

    private static final List<DateTimeFormatter> DATE_TIMES = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss][.SSS]"),
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm[:ss]"),
            DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm[:ss]"));

    private static final List<DateTimeFormatter> DATES = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            DateTimeFormatter.ofPattern("dd/MM/yyyy"));

    private TimestampParser() {}

    static Optional<Instant> parseDateTime(String value, ZoneId zone) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String text = value.trim();

        for (DateTimeFormatter format : OFFSET_DATE_TIMES) {
            Optional<OffsetDateTime> offset = attempt(text, format, OffsetDateTime::from);
            if (offset.isPresent()) {
                return Optional.of(offset.get().toInstant());
            }
        }
        for (DateTimeFormatter format : DATE_TIMES) {
            Optional<LocalDateTime> local = attempt(text, format, LocalDateTime::from);
            if (local.isPresent()) {
                return Optional.of(local.get().atZone(zone).toInstant());
            }
        }
        return parseDate(text).map(date -> date.atStartOfDay(zone).toInstant());
    }

    static Optional<Instant> parseDateAndHour(String date, String hour, ZoneId zone) {
        if (date == null || hour == null) {
            return Optional.empty();
        }
        String hourText = hour.trim();
        ZoneId effectiveZone = zone;
        if (hourText.toLowerCase(Locale.ROOT).endsWith(UTC_SUFFIX)) {
            hourText = hourText.substring(0, hourText.length() - UTC_SUFFIX.length()).trim();
            effectiveZone = ZoneOffset.UTC;
        }

        Optional<LocalDate> day = parseDate(date.trim());
        Optional<LocalTime> time = parseHour(hourText);
        if (day.isEmpty() || time.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(day.get().atTime(time.get()).atZone(effectiveZone).toInstant());
    }

    /**
     * {@code H}, {@code HH}, {@code HHmm} (also {@code Hmm}) or {@code HH:mm[:ss]}.
     * A decimal such as {@code 13.0} is truncated to its integer part.
     */
    static Optional<LocalTime> parseHour(String hour) {
        if (hour.isEmpty()) {
            return Optional.empty();
        }
        String text = DECIMAL_HOUR.matcher(hour).matches() ? hour.substring(0, hour.indexOf('.')) : hour;
        try {
            if (text.contains(":")) {
                return Optional.of(LocalTime.parse(text.length() == 4 ? "0" + text : text));
            }
            if (!text.chars().allMatch(Character::isDigit) || text.length() > 4) {
                return Optional.empty();
            }
            if (text.length() <= 2) {
                return Optional.of(LocalTime.of(Integer.parseInt(text), 0));
            }
            String padded = text.length() == 3 ? "0" + text : text;
            return Optional.of(LocalTime.of(Integer.parseInt(padded.substring(0, 2)),
                    Integer.parseInt(padded.substring(2))));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static Optional<LocalDate> parseDate(String text) {
        for (DateTimeFormatter format : DATES) {
            Optional<LocalDate> date = attempt(text, format, LocalDate::from);
            if (date.isPresent()) {
                return date;
            }
        }
        return Optional.empty();
    }

    private static <T> Optional<T> attempt(String text, DateTimeFormatter format, TemporalQuery<T> query) {
        try {
            return Optional.of(format.parse(text, query));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
