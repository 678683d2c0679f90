package com.stationsync.synchronizer.delivery;

import com.stationsync.common.model.BatchResult;
import com.stationsync.common.model.DeviceRecord;
import com.stationsync.common.model.TelemetryRecord;
import com.stationsync.synchronizer.client.TelemetryPlatform;
import com.stationsync.synchronizer.config.SyncProperties;
import com.stationsync.synchronizer.exception.InvalidDeviceTokenException;
import com.stationsync.synchronizer.support.Sleeper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Pushes telemetry to a device in fixed-size chunks.
 *
 * <p>Each chunk is one platform call and succeeds or fails as a whole. Failed chunks are
 * counted, not retried, and delivery goes on with the next chunk.
 */
@Service
public class BatchDeliveryService {

    private static final Logger log = LoggerFactory.getLogger(BatchDeliveryService.class);

    private final TelemetryPlatform platform;
    private final Sleeper sleeper;
    private final int defaultBatchSize;
    private final Duration chunkDelay;

    // Metrics
    private final Counter recordsDelivered;
    private final Counter recordsFailed;
    private final Timer pushLatency;

    public BatchDeliveryService(
            TelemetryPlatform platform,
            Sleeper sleeper,
            SyncProperties properties,
            MeterRegistry meterRegistry) {
        this.platform = platform;
        this.sleeper = sleeper;
        this.defaultBatchSize = properties.getBatchSize();
        this.chunkDelay = properties.getChunkDelay();

        this.recordsDelivered = Counter.builder("sync.records.delivered")
                .description("Number of telemetry records accepted by the platform")
                .register(meterRegistry);

        this.recordsFailed = Counter.builder("sync.records.failed")
                .description("Number of telemetry records in chunks the platform did not accept")
                .register(meterRegistry);

        this.pushLatency = Timer.builder("sync.push.latency")
                .description("Time taken to push one chunk to the platform")
                .register(meterRegistry);
    }

    public BatchResult deliver(DeviceRecord device, List<TelemetryRecord> records) {
        return deliver(device, records, defaultBatchSize);
    }

    /**
     * Delivers {@code records} in chunks of {@code batchSize}.
     *
     * @throws IllegalArgumentException if {@code batchSize < 1}
     * @throws InvalidDeviceTokenException if the device has no usable token
     */
    public BatchResult deliver(DeviceRecord device, List<TelemetryRecord> records, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be at least 1, got " + batchSize);
        }
        if (device == null || device.authToken() == null || device.authToken().isBlank()) {
            throw new InvalidDeviceTokenException(device != null ? device.deviceName() : null);
        }

        BatchResult result = BatchResult.empty();
        int size = records.size();
        int chunks = (int) ((size + (long) batchSize - 1) / batchSize);
        int number = 0;
        int from = 0;
        while (from < size) {
            if (number > 0 && !pause()) {
                int remaining = size - from;
                log.warn("Delivery to {} interrupted, {} records not sent", device.deviceName(), remaining);
                recordsFailed.increment(remaining);
                return result.plus(BatchResult.failed(remaining));
            }
            int to = (int) Math.min(size, (long) from + batchSize);
            number++;
            result = result.plus(push(device, records.subList(from, to), number, chunks));
            from = to;
        }

        log.info("Delivered {} of {} records to {} ({} chunks)",
                result.success(), records.size(), device.deviceName(), chunks);
        return result;
    }

    private BatchResult push(DeviceRecord device, List<TelemetryRecord> chunk, int number, int chunks) {
        Timer.Sample sample = Timer.start();
        try {
            platform.pushTimeseries(device.authToken(), chunk);
            recordsDelivered.increment(chunk.size());
            log.debug("Chunk {}/{} of {} records sent to {}", number, chunks, chunk.size(), device.deviceName());
            return BatchResult.succeeded(chunk.size());
        } catch (RuntimeException e) {
            recordsFailed.increment(chunk.size());
            log.warn("Chunk {}/{} of {} records to {} failed: {}",
                    number, chunks, chunk.size(), device.deviceName(), e.getMessage());
            return BatchResult.failed(chunk.size());
        } finally {
            sample.stop(pushLatency);
        }
    }

    private boolean pause() {
        try {
            sleeper.sleep(chunkDelay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
