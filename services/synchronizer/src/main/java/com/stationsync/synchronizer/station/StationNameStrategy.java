package com.stationsync.synchronizer.station;

import com.stationsync.common.model.RunRecord;

import java.util.Optional;

/**
 * One way of reading a station name out of run metadata.
 */
@FunctionalInterface
public interface StationNameStrategy {

    Optional<String> extract(RunRecord run);
}
