package com.stationsync.synchronizer.controller;

import com.stationsync.common.dto.sync.SyncCycleSummary;
import com.stationsync.synchronizer.config.SyncProperties;
import com.stationsync.synchronizer.device.DeviceDirectory;
import com.stationsync.synchronizer.discovery.RunDiscoveryService;
import com.stationsync.synchronizer.discovery.SyncCheckpoint;
import com.stationsync.synchronizer.dto.DeviceView;
import com.stationsync.synchronizer.dto.StartSyncRequest;
import com.stationsync.synchronizer.dto.SyncControlResponse;
import com.stationsync.synchronizer.dto.SyncStatusResponse;
import com.stationsync.synchronizer.orchestrator.SyncOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;

/**
 * Control surface of the synchronizer.
 *
 * Endpoints:
 * - POST /api/v1/sync/start - start the background loop
 * - POST /api/v1/sync/stop - stop it after the run in flight
 * - POST /api/v1/sync/sync-now - run one cycle and return its summary
 * - GET /api/v1/sync/status, /devices, /groups - inspection
 * - DELETE /api/v1/sync/cache - forget devices and checkpoints
 */
@RestController
@RequestMapping("/api/v1/sync")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Station Sync", description = "Control of the MLflow to ThingsBoard synchronization")
public class SyncController {

    private final SyncOrchestrator orchestrator;
    private final DeviceDirectory deviceDirectory;
    private final SyncCheckpoint checkpoint;
    private final RunDiscoveryService discovery;
    private final SyncProperties properties;

    @PostMapping("/start")
    @Operation(summary = "Start synchronization", description = "Start polling the given experiment groups on a background worker")
    public ResponseEntity<SyncControlResponse> start(@Valid @RequestBody(required = false) StartSyncRequest request) {
        StartSyncRequest effective = request != null ? request : new StartSyncRequest();
        List<String> groups = groupsOrDefault(effective.getGroups());
        Duration interval = effective.getIntervalSeconds() != null
                ? Duration.ofSeconds(effective.getIntervalSeconds())
                : properties.getInterval();

        if (!orchestrator.start(groups, interval, effective.isContinuous())) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(SyncControlResponse.of("ALREADY_RUNNING", "Synchronization is already running"));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(SyncControlResponse.of("STARTED", "Synchronizing " + groups + " every " + interval.toSeconds() + "s"));
    }

    @PostMapping("/stop")
    @Operation(summary = "Stop synchronization", description = "Stop the background worker after the run in flight")
    public ResponseEntity<SyncControlResponse> stop() {
        if (!orchestrator.stop()) {
            return ResponseEntity.ok(SyncControlResponse.of("NOT_RUNNING", "Synchronization is not running"));
        }
        return ResponseEntity.ok(SyncControlResponse.of("STOPPING", "Synchronization will stop after the current run"));
    }

    @PostMapping("/sync-now")
    @Operation(summary = "Synchronize once", description = "Run one cycle over the given groups and return its summary")
    public Mono<ResponseEntity<SyncCycleSummary>> syncNow(@RequestParam(required = false) List<String> groups) {
        List<String> effective = groupsOrDefault(groups);
        log.debug("Manual sync requested for {}", effective);
        return Mono.fromCallable(() -> orchestrator.syncOnce(effective))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/status")
    @Operation(summary = "Synchronization status", description = "Worker state, checkpoints and last cycle")
    public ResponseEntity<SyncStatusResponse> status() {
        return ResponseEntity.ok(SyncStatusResponse.builder()
                .running(orchestrator.isRunning())
                .state(orchestrator.getState())
                .groups(orchestrator.isRunning() ? orchestrator.getActiveGroups() : properties.getGroups())
                .intervalSeconds(orchestrator.getActiveInterval().map(Duration::toSeconds).orElse(null))
                .checkpoints(checkpoint.snapshot())
                .cachedDevices(deviceDirectory.size())
                .lastCycle(orchestrator.getLastSummary().orElse(null))
                .lastError(orchestrator.getLastError().orElse(null))
                .build());
    }

    @GetMapping("/devices")
    @Operation(summary = "Cached devices", description = "Devices resolved so far, with masked tokens")
    public ResponseEntity<List<DeviceView>> devices() {
        return ResponseEntity.ok(deviceDirectory.cachedDevices().stream().map(DeviceView::from).toList());
    }

    @GetMapping("/groups")
    @Operation(summary = "Experiment groups", description = "Experiment groups available in the tracking server")
    public Mono<ResponseEntity<List<String>>> groups() {
        return Mono.fromCallable(discovery::availableGroups)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @DeleteMapping("/cache")
    @Operation(summary = "Reset caches", description = "Forget cached devices and checkpoints; rejected while running")
    public ResponseEntity<SyncControlResponse> clearCache() {
        if (orchestrator.isRunning()) {
            throw new IllegalStateException("Stop the synchronization before clearing caches");
        }
        deviceDirectory.clear();
        checkpoint.clear();
        return ResponseEntity.ok(SyncControlResponse.of("CLEARED", "Device cache and checkpoints cleared"));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }

    private List<String> groupsOrDefault(List<String> groups) {
        return groups == null || groups.isEmpty() ? properties.getGroups() : groups;
    }
}
