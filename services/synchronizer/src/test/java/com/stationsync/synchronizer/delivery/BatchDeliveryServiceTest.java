package com.stationsync.synchronizer.delivery;

import com.stationsync.common.model.BatchResult;
import com.stationsync.common.model.DeviceRecord;
import com.stationsync.common.model.TelemetryRecord;
import com.stationsync.synchronizer.client.TelemetryPlatform;
import com.stationsync.synchronizer.config.SyncProperties;
import com.stationsync.synchronizer.exception.InvalidDeviceTokenException;
import com.stationsync.synchronizer.exception.TelemetryPlatformException;
import com.stationsync.synchronizer.support.Sleeper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class BatchDeliveryServiceTest {

    private static final DeviceRecord DEVICE = new DeviceRecord("dev-1", "CARUARU - Processed", "token-123");

    @Mock
    private TelemetryPlatform platform;

    private final List<Duration> pauses = new ArrayList<>();
    private SimpleMeterRegistry meterRegistry;
    private BatchDeliveryService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        Sleeper recording = pauses::add;
        service = new BatchDeliveryService(platform, recording, new SyncProperties(), meterRegistry);
    }

    @Test
    void shouldSplitIntoChunksAndPauseOnlyBetweenThem() {
        BatchResult result = service.deliver(DEVICE, records(250), 100);

        assertThat(result.success()).isEqualTo(250);
        assertThat(result.failed()).isZero();
        verify(platform, times(3)).pushTimeseries(eq("token-123"), anyList());
        verify(platform).pushTimeseries(eq("token-123"), argThat(chunk -> chunk.size() == 50));
        assertThat(pauses).containsExactly(Duration.ofMillis(100), Duration.ofMillis(100));
    }

    @Test
    void shouldCountFailedChunkAndContinue() {
        // Given: the second of four chunks is rejected
        List<TelemetryRecord> records = records(200);
        doNothing().doThrow(new TelemetryPlatformException("HTTP 500")).doNothing().doNothing()
                .when(platform).pushTimeseries(eq("token-123"), anyList());

        // When
        BatchResult result = service.deliver(DEVICE, records, 50);

        // Then
        assertThat(result.success()).isEqualTo(150);
        assertThat(result.failed()).isEqualTo(50);
        assertThat(result.total()).isEqualTo(records.size());
        verify(platform, times(4)).pushTimeseries(eq("token-123"), anyList());
        assertThat(meterRegistry.counter("sync.records.delivered").count()).isEqualTo(150.0);
        assertThat(meterRegistry.counter("sync.records.failed").count()).isEqualTo(50.0);
    }

    @Test
    void shouldReportEveryRecordFailedWhenPlatformIsDown() {
        doThrow(new TelemetryPlatformException("connection refused"))
                .when(platform).pushTimeseries(eq("token-123"), anyList());

        BatchResult result = service.deliver(DEVICE, records(30), 7);

        assertThat(result).isEqualTo(new BatchResult(0, 30));
    }

    @Test
    void shouldSendEverythingInOneChunkWhenBatchSizeIsHuge() {
        BatchResult result = service.deliver(DEVICE, records(2), Integer.MAX_VALUE);

        assertThat(result).isEqualTo(new BatchResult(2, 0));
        verify(platform, times(1)).pushTimeseries(eq("token-123"), argThat(chunk -> chunk.size() == 2));
        assertThat(pauses).isEmpty();
    }

    @Test
    void shouldCountUnsentRecordsAsFailedWhenPauseIsInterrupted() {
        // Given: the pause before the second chunk is interrupted
        Sleeper interrupting = delay -> {
            throw new InterruptedException("stop");
        };
        BatchDeliveryService interrupted = new BatchDeliveryService(platform, interrupting, new SyncProperties(), meterRegistry);

        try {
            // When
            BatchResult result = interrupted.deliver(DEVICE, records(250), 100);

            // Then
            assertThat(result.success()).isEqualTo(100);
            assertThat(result.failed()).isEqualTo(150);
            assertThat(result.total()).isEqualTo(250);
            verify(platform, times(1)).pushTimeseries(eq("token-123"), anyList());
            assertThat(meterRegistry.counter("sync.records.failed").count()).isEqualTo(150.0);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void shouldReturnEmptyResultForNoRecords() {
        assertThat(service.deliver(DEVICE, List.of(), 10)).isEqualTo(BatchResult.empty());
        verifyNoInteractions(platform);
    }

    @Test
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> service.deliver(DEVICE, records(1), 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.deliver(null, records(1), 10))
                .isInstanceOf(InvalidDeviceTokenException.class);
        verifyNoInteractions(platform);
    }

    private static List<TelemetryRecord> records(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> new TelemetryRecord(1_704_067_200_000L + i * 3_600_000L, Map.<String, Object>of("temperatura", 20.0 + i)))
                .toList();
    }
}
