package com.stationsync.synchronizer.device;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.stationsync.common.model.DeviceRecord;
import com.stationsync.synchronizer.client.PlatformDevice;
import com.stationsync.synchronizer.client.TelemetryPlatform;
import com.stationsync.synchronizer.config.SyncProperties;
import com.stationsync.synchronizer.exception.DeviceUnavailableException;
import com.stationsync.synchronizer.exception.TelemetryPlatformException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Maps stations to their "processed" devices on the telemetry platform, creating missing devices.
 *
 * <p>Resolved devices are cached by device name for the lifetime of the directory. Only fully
 * resolved devices (id and token) are cached, so a failed lookup is retried on the next call.
 */
@Component
@Slf4j
public class DeviceDirectory {

    private final TelemetryPlatform platform;
    private final SyncProperties.Device settings;
    private final Cache<String, DeviceRecord> cache = Caffeine.newBuilder().build();
    private final Counter devicesCreated;

    public DeviceDirectory(TelemetryPlatform platform, SyncProperties properties, MeterRegistry meterRegistry) {
        this.platform = platform;
        this.settings = properties.getDevice();
        this.devicesCreated = Counter.builder("sync.devices.created")
                .description("Number of processed-data devices created on the platform")
                .register(meterRegistry);
    }

    /**
     * Returns the device for {@code station}, creating it on the platform if it does not exist.
     *
     * @throws DeviceUnavailableException if the device cannot be found, created or has no token
     */
    public DeviceRecord getOrCreate(String station) {
        String deviceName = deviceName(station);
        DeviceRecord cached = cache.getIfPresent(deviceName);
        if (cached != null) {
            return cached;
        }

        try {
            PlatformDevice device = lookup(deviceName).orElseGet(() -> create(station, deviceName));
            String token = platform.getToken(device.id())
                    .orElseThrow(() -> new DeviceUnavailableException("Device '" + deviceName + "' has no access token"));
            DeviceRecord record = new DeviceRecord(device.id(), deviceName, token);
            cache.put(deviceName, record);
            log.info("Device '{}' ready for station {} (token {})", deviceName, station, record.maskedToken());
            return record;
        } catch (TelemetryPlatformException | IllegalArgumentException e) {
            throw new DeviceUnavailableException("Device '" + deviceName + "' unavailable: " + e.getMessage(), e);
        }
    }

    public String deviceName(String station) {
        return station.replace('_', ' ') + settings.getNameSuffix();
    }

    public List<DeviceRecord> cachedDevices() {
        return cache.asMap().values().stream()
                .sorted(Comparator.comparing(DeviceRecord::deviceName))
                .toList();
    }

    public int size() {
        return cache.asMap().size();
    }

    public void clear() {
        cache.invalidateAll();
        log.info("Device cache cleared");
    }

    private Optional<PlatformDevice> lookup(String deviceName) {
        return platform.findDevice(deviceName).filter(device -> device.id() != null && !device.id().isBlank());
    }

    private PlatformDevice create(String station, String deviceName) {
        String label = settings.getLabelPrefix() + station.replace('_', ' ');
        PlatformDevice created = platform.createDevice(deviceName, settings.getType(), label);
        devicesCreated.increment();
        return created;
    }
}
