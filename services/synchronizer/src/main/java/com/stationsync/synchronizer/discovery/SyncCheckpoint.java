package com.stationsync.synchronizer.discovery;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Highest run start time already synchronized, per experiment group. Held in memory only,
 * so a restart re-delivers the newest runs of every group.
 */
@Component
public class SyncCheckpoint {

    private final Map<String, Long> lastStartTimes = new ConcurrentHashMap<>();

    public long get(String group) {
        return lastStartTimes.getOrDefault(group, 0L);
    }

    /**
     * Moves the checkpoint of {@code group} forward; never backward.
     */
    public void advance(String group, long startTime) {
        lastStartTimes.merge(group, startTime, Math::max);
    }

    public Map<String, Long> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(lastStartTimes));
    }

    public void clear() {
        lastStartTimes.clear();
    }
}
