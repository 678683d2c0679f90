package com.stationsync.synchronizer.orchestrator;

import com.stationsync.common.dto.sync.SyncCycleSummary;
import com.stationsync.common.model.BatchResult;
import com.stationsync.common.model.DeviceRecord;
import com.stationsync.common.model.FailureKind;
import com.stationsync.common.model.RunOutcome;
import com.stationsync.common.model.RunRecord;
import com.stationsync.common.model.TelemetryRecord;
import com.stationsync.synchronizer.client.ObjectStore;
import com.stationsync.synchronizer.client.TelemetryPlatform;
import com.stationsync.synchronizer.config.SyncProperties;
import com.stationsync.synchronizer.delivery.BatchDeliveryService;
import com.stationsync.synchronizer.device.DeviceDirectory;
import com.stationsync.synchronizer.discovery.RunDiscoveryService;
import com.stationsync.synchronizer.discovery.SyncCheckpoint;
import com.stationsync.synchronizer.exception.DatasetFormatException;
import com.stationsync.synchronizer.exception.DeviceUnavailableException;
import com.stationsync.synchronizer.exception.ObjectStoreException;
import com.stationsync.synchronizer.exception.PlatformAuthenticationException;
import com.stationsync.synchronizer.source.DataSourceLocator;
import com.stationsync.synchronizer.source.Dataset;
import com.stationsync.synchronizer.source.DatasetReader;
import com.stationsync.synchronizer.station.StationResolver;
import com.stationsync.synchronizer.support.Sleeper;
import com.stationsync.synchronizer.transform.TabularTransformer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives runs through discovery, station resolution, device lookup, data lookup,
 * transformation and delivery.
 *
 * <p>Only one worker touches the device cache and checkpoints at a time: a manual
 * {@link #syncOnce} and the background loop exclude each other through the running flag.
 * Every run ends in exactly one {@link RunOutcome}; a failing group is reported in the
 * cycle summary and the remaining groups still run. Only a rejected platform login
 * stops a cycle.
 */
@Service
@Slf4j
public class SyncOrchestrator {

    static final String WORKER_NAME = "station-sync-worker";

    private final RunDiscoveryService discovery;
    private final SyncCheckpoint checkpoint;
    private final StationResolver stationResolver;
    private final DeviceDirectory deviceDirectory;
    private final DataSourceLocator dataSourceLocator;
    private final ObjectStore objectStore;
    private final DatasetReader datasetReader;
    private final TabularTransformer transformer;
    private final BatchDeliveryService delivery;
    private final TelemetryPlatform platform;
    private final Sleeper sleeper;
    private final SyncProperties properties;

    // Metrics
    private final MeterRegistry meterRegistry;
    private final Timer cycleDuration;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean stopRequested;
    private volatile SyncState state = SyncState.IDLE;
    private volatile CountDownLatch stopSignal = new CountDownLatch(0);
    private volatile Thread worker;
    private volatile List<String> activeGroups = List.of();
    private volatile Duration activeInterval;
    private volatile SyncCycleSummary lastSummary;
    private volatile String lastError;

    public SyncOrchestrator(
            RunDiscoveryService discovery,
            SyncCheckpoint checkpoint,
            StationResolver stationResolver,
            DeviceDirectory deviceDirectory,
            DataSourceLocator dataSourceLocator,
            ObjectStore objectStore,
            DatasetReader datasetReader,
            TabularTransformer transformer,
            BatchDeliveryService delivery,
            TelemetryPlatform platform,
            Sleeper sleeper,
            SyncProperties properties,
            MeterRegistry meterRegistry) {
        this.discovery = discovery;
        this.checkpoint = checkpoint;
        this.stationResolver = stationResolver;
        this.deviceDirectory = deviceDirectory;
        this.dataSourceLocator = dataSourceLocator;
        this.objectStore = objectStore;
        this.datasetReader = datasetReader;
        this.transformer = transformer;
        this.delivery = delivery;
        this.platform = platform;
        this.sleeper = sleeper;
        this.properties = properties;
        this.meterRegistry = meterRegistry;

        this.cycleDuration = Timer.builder("sync.cycle.duration")
                .description("Time taken by one poll cycle over all groups")
                .register(meterRegistry);
    }

    /**
     * Logs in to the platform and runs one cycle on the caller's thread.
     *
     * @throws PlatformAuthenticationException if the platform rejects the login
     * @throws IllegalStateException if the background loop or another sync is running
     */
    public SyncCycleSummary syncOnce(List<String> groups) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A synchronization is already running");
        }
        try {
            stopRequested = false;
            platform.authenticate();
            SyncCycleSummary summary = runCycle(groups);
            lastSummary = summary;
            return summary;
        } finally {
            state = SyncState.IDLE;
            running.set(false);
        }
    }

    /**
     * One pass over {@code groups}. The platform session must already be established.
     */
    public SyncCycleSummary runCycle(List<String> groups) {
        Instant startedAt = Instant.now();
        Timer.Sample sample = Timer.start(meterRegistry);
        List<RunOutcome> outcomes = new ArrayList<>();
        Map<String, String> failedGroups = new LinkedHashMap<>();

        log.info("Sync cycle started for groups {}", groups);
        for (String group : groups) {
            if (stopRequested) {
                break;
            }
            state = SyncState.POLLING;
            List<RunRecord> runs;
            try {
                runs = discovery.poll(group, checkpoint);
            } catch (RuntimeException e) {
                log.warn("Skipping group '{}': {}", group, e.getMessage());
                failedGroups.put(group, e.getMessage());
                continue;
            }
            if (!processRuns(runs, outcomes)) {
                break;
            }
        }
        state = SyncState.IDLE;
        sample.stop(cycleDuration);

        SyncCycleSummary summary = new SyncCycleSummary(startedAt, Instant.now(), outcomes, failedGroups);
        log.info("Sync cycle finished: {} runs, {} successful, {} records sent, {} groups failed",
                summary.total(), summary.successful(), summary.recordsSent(), failedGroups.size());
        return summary;
    }

    /**
     * Runs the sync loop on a background worker.
     *
     * @return {@code false} if a sync is already running
     */
    public boolean start(List<String> groups, Duration interval, boolean continuous) {
        if (!running.compareAndSet(false, true)) {
            return false;
        }
        stopRequested = false;
        lastError = null;
        activeGroups = List.copyOf(groups);
        activeInterval = interval;
        stopSignal = new CountDownLatch(1);

        Thread thread = new Thread(() -> loop(activeGroups, interval, continuous), WORKER_NAME);
        thread.setDaemon(true);
        worker = thread;
        thread.start();
        log.info("Sync started for groups {} every {} (continuous={})", groups, interval, continuous);
        return true;
    }

    /**
     * Asks the worker to stop. The run in flight completes; the wait between cycles is cut short.
     *
     * @return {@code false} if nothing was running
     */
    public boolean stop() {
        if (!running.get()) {
            return false;
        }
        stopRequested = true;
        stopSignal.countDown();
        log.info("Stop requested, state {}", state);
        return true;
    }

    /**
     * Waits for the background worker to exit.
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        Thread current = worker;
        if (current == null) {
            return true;
        }
        current.join(timeout.toMillis());
        return !current.isAlive();
    }

    public boolean isRunning() {
        return running.get();
    }

    public SyncState getState() {
        return state;
    }

    public List<String> getActiveGroups() {
        return activeGroups;
    }

    public Optional<Duration> getActiveInterval() {
        return Optional.ofNullable(activeInterval);
    }

    public Optional<SyncCycleSummary> getLastSummary() {
        return Optional.ofNullable(lastSummary);
    }

    public Optional<String> getLastError() {
        return Optional.ofNullable(lastError);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startOnBoot() {
        if (properties.isAutoStart()) {
            start(properties.getGroups(), properties.getInterval(), true);
        }
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        if (stop()) {
            awaitTermination(Duration.ofSeconds(10));
        }
    }

    private void loop(List<String> groups, Duration interval, boolean continuous) {
        try {
            while (!stopRequested) {
                try {
                    platform.authenticate();
                } catch (PlatformAuthenticationException e) {
                    log.error("Sync loop halted, platform login failed: {}", e.getMessage());
                    lastError = e.getMessage();
                    break;
                }
                try {
                    lastSummary = runCycle(groups);
                } catch (RuntimeException e) {
                    log.error("Sync cycle aborted: {}", e.getMessage(), e);
                    lastError = e.getMessage();
                }
                if (!continuous || stopRequested) {
                    break;
                }
                state = SyncState.IDLE;
                if (stopSignal.await(interval.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Sync worker interrupted");
        } finally {
            state = stopRequested ? SyncState.STOPPED : SyncState.IDLE;
            running.set(false);
            log.info("Sync worker exited in state {}", state);
        }
    }

    /**
     * Runs already polled but cut off by a stop are recorded as {@link FailureKind#STOPPED},
     * since the checkpoint has moved past them.
     *
     * @return {@code false} when the cycle must end early
     */
    private boolean processRuns(List<RunRecord> runs, List<RunOutcome> outcomes) {
        for (int i = 0; i < runs.size(); i++) {
            if (stopRequested) {
                skipRemaining(runs.subList(i, runs.size()), outcomes);
                return false;
            }
            outcomes.add(processRun(runs.get(i)));
            if (i < runs.size() - 1 && !stopRequested && !pauseBetweenRuns()) {
                skipRemaining(runs.subList(i + 1, runs.size()), outcomes);
                return false;
            }
        }
        return true;
    }

    private void skipRemaining(List<RunRecord> skipped, List<RunOutcome> outcomes) {
        if (skipped.isEmpty()) {
            return;
        }
        log.warn("Sync stopped with {} polled runs unprocessed: {}", skipped.size(),
                skipped.stream().map(RunRecord::runId).toList());
        for (RunRecord run : skipped) {
            outcomes.add(record(RunOutcome.stopped(run)));
        }
    }

    RunOutcome processRun(RunRecord run) {
        String station = null;
        boolean deviceFound = false;
        boolean dataFound = false;
        RunOutcome outcome;
        try {
            state = SyncState.RESOLVING;
            Optional<String> resolved = stationResolver.resolve(run);
            if (resolved.isEmpty()) {
                log.warn("Skipping run {} ('{}'): station not resolvable", run.runId(), run.runName());
                return record(RunOutcome.unresolvable(run));
            }
            station = resolved.get();

            state = SyncState.DEVICE_LOOKUP;
            DeviceRecord device;
            try {
                device = deviceDirectory.getOrCreate(station);
            } catch (DeviceUnavailableException e) {
                log.warn("Skipping run {} of {}: {}", run.runId(), station, e.getMessage());
                return record(RunOutcome.deviceUnavailable(run, station, e.getMessage()));
            }
            deviceFound = true;

            state = SyncState.DATA_LOOKUP;
            Optional<String> key = dataSourceLocator.find(station);
            if (key.isEmpty()) {
                log.warn("Skipping run {} of {}: no processed dataset", run.runId(), station);
                return record(RunOutcome.dataNotFound(run, station));
            }
            dataFound = true;

            state = SyncState.TRANSFORMING;
            List<TelemetryRecord> records;
            try {
                records = load(key.get());
            } catch (ObjectStoreException | DatasetFormatException e) {
                log.warn("Skipping run {} of {}: {}", run.runId(), station, e.getMessage());
                return record(RunOutcome.dataUnreadable(run, station, e.getMessage()));
            }

            state = SyncState.DELIVERING;
            BatchResult result = delivery.deliver(device, records);
            outcome = RunOutcome.delivered(run, station, result);
            log.info("Run {} of {}: {} records sent, {} failed", run.runId(), station,
                    result.success(), result.failed());
        } catch (RuntimeException e) {
            log.error("Run {} of {} failed unexpectedly: {}", run.runId(), station, e.getMessage(), e);
            outcome = RunOutcome.unexpected(run, station, deviceFound, dataFound, e.getMessage());
        }
        return record(outcome);
    }

    private List<TelemetryRecord> load(String key) {
        Dataset dataset = datasetReader.read(objectStore.getObject(key));
        if (dataset.isEmpty()) {
            throw new DatasetFormatException("Dataset " + key + " has no rows");
        }
        List<TelemetryRecord> records = transformer.transform(dataset);
        if (records.isEmpty()) {
            throw new DatasetFormatException("Dataset " + key + " has no valid records in " + dataset.size() + " rows");
        }
        List<TelemetryRecord> capped = TabularTransformer.mostRecent(records, properties.getMaxRecordsPerRun());
        if (capped.size() < records.size()) {
            log.debug("Keeping the {} most recent of {} records from {}", capped.size(), records.size(), key);
        }
        return capped;
    }

    private RunOutcome record(RunOutcome outcome) {
        String result = outcome.complete() ? "complete"
                : outcome.success() ? "partial"
                : outcome.failure().getValue();
        Counter.builder("sync.runs.processed")
                .description("Number of runs processed, by result")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
        return outcome;
    }

    private boolean pauseBetweenRuns() {
        try {
            sleeper.sleep(properties.getRunDelay());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
