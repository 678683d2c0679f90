package com.stationsync.synchronizer.station;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The built-in strategies, in the order {@link StationResolver} tries them.
 */
public final class StationNameStrategies {

    static final String PROCESSED_DATA_PREFIX = "processed_data_";

    static final List<String> NAME_KEYWORDS = List.of("imputacao", "imputation", "estacao", "station");

    private StationNameStrategies() {}

    public static List<StationNameStrategy> defaults() {
        return List.of(
                tag("station"),
                tag("station_name"),
                param("station_name"),
                processedDataRunName(),
                keywordRunName());
    }

    public static StationNameStrategy tag(String key) {
        return run -> run.tag(key);
    }

    public static StationNameStrategy param(String key) {
        return run -> run.param(key);
    }

    /**
     * {@code processed_data_<STATION>_<timestamp>}: the station is everything between the
     * prefix and the trailing all-digit tokens, so multi-token names like
     * {@code SAO_JOAO} survive.
     */
    public static StationNameStrategy processedDataRunName() {
        return run -> {
            String name = run.runName();
            if (name == null || !name.startsWith(PROCESSED_DATA_PREFIX)) {
                return Optional.empty();
            }
            List<String> tokens = Arrays.asList(name.split("_"));
            int end = tokens.size();
            while (end > 2 && isDigits(tokens.get(end - 1))) {
                end--;
            }
            return nonBlank(String.join("_", tokens.subList(2, end)));
        };
    }

    /**
     * The token following the first token that contains one of {@link #NAME_KEYWORDS}.
     * Keywords are tried in order; a keyword found in the last token moves on to the next keyword.
     */
    public static StationNameStrategy keywordRunName() {
        return run -> {
            String name = run.runName();
            if (name == null) {
                return Optional.empty();
            }
            String[] tokens = name.split("_");
            for (String keyword : NAME_KEYWORDS) {
                for (int i = 0; i < tokens.length; i++) {
                    if (tokens[i].toLowerCase(Locale.ROOT).contains(keyword)) {
                        if (i + 1 < tokens.length) {
                            Optional<String> station = nonBlank(tokens[i + 1]);
                            if (station.isPresent()) {
                                return station;
                            }
                        }
                        break;
                    }
                }
            }
            return Optional.empty();
        };
    }

    private static boolean isDigits(String token) {
        return !token.isEmpty() && token.chars().allMatch(Character::isDigit);
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }
}
