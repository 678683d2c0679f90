package com.stationsync.synchronizer.station;

import com.stationsync.common.model.RunRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Infers the station a run belongs to. The first strategy with a non-blank answer wins.
 */
@Component
@Slf4j
public class StationResolver {

    private final List<StationNameStrategy> strategies;

    @Autowired
    public StationResolver() {
        this(StationNameStrategies.defaults());
    }

    public StationResolver(List<StationNameStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public Optional<String> resolve(RunRecord run) {
        for (int i = 0; i < strategies.size(); i++) {
            Optional<String> station = strategies.get(i).extract(run);
            if (station.isPresent()) {
                log.debug("Run {} resolved to station '{}' by strategy #{}", run.runId(), station.get(), i + 1);
                return station;
            }
        }
        log.debug("No strategy resolved a station for run {} ('{}')", run.runId(), run.runName());
        return Optional.empty();
    }
}
