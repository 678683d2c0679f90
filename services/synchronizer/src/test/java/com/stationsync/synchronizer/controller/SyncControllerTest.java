package com.stationsync.synchronizer.controller;

import com.stationsync.common.dto.sync.SyncCycleSummary;
import com.stationsync.common.model.BatchResult;
import com.stationsync.common.model.DeviceRecord;
import com.stationsync.common.model.RunOutcome;
import com.stationsync.common.model.RunRecord;
import com.stationsync.synchronizer.config.SyncProperties;
import com.stationsync.synchronizer.device.DeviceDirectory;
import com.stationsync.synchronizer.discovery.RunDiscoveryService;
import com.stationsync.synchronizer.discovery.SyncCheckpoint;
import com.stationsync.synchronizer.exception.PlatformAuthenticationException;
import com.stationsync.synchronizer.orchestrator.SyncOrchestrator;
import com.stationsync.synchronizer.orchestrator.SyncState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(SyncController.class)
class SyncControllerTest {

    private static final List<String> DEFAULT_GROUPS = List.of("data-pipeline", "Imputacao por Estacao");

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private SyncOrchestrator orchestrator;

    @MockBean
    private DeviceDirectory deviceDirectory;

    @MockBean
    private SyncCheckpoint checkpoint;

    @MockBean
    private RunDiscoveryService discovery;

    @MockBean
    private SyncProperties properties;

    @BeforeEach
    void setUp() {
        when(properties.getGroups()).thenReturn(DEFAULT_GROUPS);
        when(properties.getInterval()).thenReturn(Duration.ofSeconds(60));
    }

    @Test
    void shouldStartWithRequestedGroupsAndInterval() {
        when(orchestrator.start(List.of("data-pipeline"), Duration.ofSeconds(120), true)).thenReturn(true);

        webTestClient.post()
                .uri("/api/v1/sync/start")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                    {"groups": ["data-pipeline"], "intervalSeconds": 120}
                    """)
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.status").isEqualTo("STARTED");
    }

    @Test
    void shouldRejectIntervalOutOfRange() {
        webTestClient.post()
                .uri("/api/v1/sync/start")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                    {"intervalSeconds": 5}
                    """)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Validation Failed")
                .jsonPath("$.details[0]").value(startsWith("intervalSeconds"));

        verify(orchestrator, never()).start(anyList(), any(), anyBoolean());
    }

    @Test
    void shouldReportConflictWhenAlreadyRunning() {
        when(orchestrator.start(DEFAULT_GROUPS, Duration.ofSeconds(60), true)).thenReturn(false);

        webTestClient.post()
                .uri("/api/v1/sync/start")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{}")
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.status").isEqualTo("ALREADY_RUNNING");
    }

    @Test
    void shouldReturnCycleSummaryOnSyncNow() {
        RunRecord run = new RunRecord("run-1", "processed_data_CARUARU_20240101", 1L, Map.of(), Map.of());
        SyncCycleSummary summary = new SyncCycleSummary(Instant.EPOCH, Instant.EPOCH,
                List.of(RunOutcome.delivered(run, "CARUARU", new BatchResult(150, 50))), Map.of());
        when(orchestrator.syncOnce(List.of("data-pipeline"))).thenReturn(summary);

        webTestClient.post()
                .uri("/api/v1/sync/sync-now?groups=data-pipeline")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.recordsSent").isEqualTo(150)
                .jsonPath("$.outcomes[0].success").isEqualTo(true)
                .jsonPath("$.outcomes[0].complete").isEqualTo(false)
                .jsonPath("$.outcomes[0].failure").isEqualTo("delivery_failed");
    }

    @Test
    void shouldMapRejectedPlatformLoginToBadGateway() {
        when(orchestrator.syncOnce(DEFAULT_GROUPS))
                .thenThrow(new PlatformAuthenticationException("401 Unauthorized", null));

        webTestClient.post()
                .uri("/api/v1/sync/sync-now")
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.message").isEqualTo("Telemetry platform rejected the login");
    }

    @Test
    void shouldRefuseToClearCacheWhileRunning() {
        when(orchestrator.isRunning()).thenReturn(true);

        webTestClient.delete()
                .uri("/api/v1/sync/cache")
                .exchange()
                .expectStatus().isEqualTo(409);

        verify(deviceDirectory, never()).clear();
        verify(checkpoint, never()).clear();
    }

    @Test
    void shouldListCachedDevicesWithMaskedTokens() {
        when(deviceDirectory.cachedDevices())
                .thenReturn(List.of(new DeviceRecord("dev-1", "CARUARU - Processed", "A1B2C3D4E5F6G7H8")));

        webTestClient.get()
                .uri("/api/v1/sync/devices")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].deviceName").isEqualTo("CARUARU - Processed")
                .jsonPath("$[0].token").isEqualTo("A1B2C3D4E5...");
    }

    @Test
    void shouldReportStatus() {
        when(orchestrator.isRunning()).thenReturn(true);
        when(orchestrator.getState()).thenReturn(SyncState.DELIVERING);
        when(orchestrator.getActiveGroups()).thenReturn(List.of("data-pipeline"));
        when(orchestrator.getActiveInterval()).thenReturn(Optional.of(Duration.ofSeconds(300)));
        when(orchestrator.getLastSummary()).thenReturn(Optional.empty());
        when(orchestrator.getLastError()).thenReturn(Optional.empty());
        when(checkpoint.snapshot()).thenReturn(Map.of("data-pipeline", 1704067200000L));
        when(deviceDirectory.size()).thenReturn(3);

        webTestClient.get()
                .uri("/api/v1/sync/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.running").isEqualTo(true)
                .jsonPath("$.state").isEqualTo("DELIVERING")
                .jsonPath("$.intervalSeconds").isEqualTo(300)
                .jsonPath("$.checkpoints['data-pipeline']").isEqualTo(1704067200000L)
                .jsonPath("$.cachedDevices").isEqualTo(3);
    }
}
