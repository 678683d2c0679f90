package com.stationsync.synchronizer.source;

import com.stationsync.synchronizer.client.ObjectStore;
import com.stationsync.synchronizer.config.SyncProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Finds the processed result file of a station in the object store.
 *
 * <p>Files are named {@code <results-prefix><file-prefix><STATION>[_Modelo_<model>].csv}, with
 * the station written either with underscores or with spaces. Matches are sorted by key, so
 * the base file comes before its model variants.
 */
@Component
@Slf4j
public class DataSourceLocator {

    private final ObjectStore objectStore;
    private final SyncProperties.Source settings;

    public DataSourceLocator(ObjectStore objectStore, SyncProperties properties) {
        this.objectStore = objectStore;
        this.settings = properties.getSource();
    }

    public Optional<String> find(String station) {
        return find(station, settings.getModel());
    }

    public Optional<String> find(String station, String model) {
        List<String> keys = objectStore.listKeys(prefix(station.replace(' ', '_')));
        if (keys.isEmpty()) {
            keys = objectStore.listKeys(prefix(station.replace('_', ' ')));
        }

        String extension = settings.getExtension().toLowerCase(Locale.ROOT);
        List<String> candidates = keys.stream()
                .filter(key -> key.toLowerCase(Locale.ROOT).endsWith(extension))
                .sorted()
                .toList();
        if (candidates.isEmpty()) {
            log.debug("No {} file found for station {}", extension, station);
            return Optional.empty();
        }

        if (model != null && !model.isBlank()) {
            Optional<String> variant = candidates.stream().filter(key -> key.contains(model)).findFirst();
            if (variant.isPresent()) {
                return variant;
            }
            log.debug("No '{}' variant for station {}, using {}", model, station, candidates.get(0));
        }
        return Optional.of(candidates.get(0));
    }

    private String prefix(String station) {
        return settings.getResultsPrefix() + settings.getFilePrefix() + station;
    }
}
