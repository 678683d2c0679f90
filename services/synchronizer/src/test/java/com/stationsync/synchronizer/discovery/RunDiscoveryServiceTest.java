package com.stationsync.synchronizer.discovery;

import com.stationsync.common.model.RunRecord;
import com.stationsync.synchronizer.client.ExperimentStore;
import com.stationsync.synchronizer.config.SyncProperties;
import com.stationsync.synchronizer.exception.ExperimentStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RunDiscoveryServiceTest {

    private static final String GROUP = "data-pipeline";

    @Mock
    private ExperimentStore experimentStore;

    private SyncCheckpoint checkpoint;
    private RunDiscoveryService discovery;

    @BeforeEach
    void setUp() {
        checkpoint = new SyncCheckpoint();
        discovery = new RunDiscoveryService(experimentStore, new SyncProperties());
    }

    @Test
    void shouldReturnNewRunsOnceAndAdvanceCheckpoint() {
        when(experimentStore.getRuns(GROUP, 100)).thenReturn(List.of(run("b", 200L), run("a", 100L)));

        List<RunRecord> first = discovery.poll(GROUP, checkpoint);
        List<RunRecord> second = discovery.poll(GROUP, checkpoint);

        assertThat(first).extracting(RunRecord::runId).containsExactly("b", "a");
        assertThat(second).isEmpty();
        assertThat(checkpoint.get(GROUP)).isEqualTo(200L);
    }

    @Test
    void shouldExcludeRunAtCheckpointBoundary() {
        checkpoint.advance(GROUP, 200L);
        when(experimentStore.getRuns(GROUP, 100)).thenReturn(List.of(run("c", 300L), run("b", 200L), run("a", 100L)));

        assertThat(discovery.poll(GROUP, checkpoint)).extracting(RunRecord::runId).containsExactly("c");
        assertThat(checkpoint.get(GROUP)).isEqualTo(300L);
    }

    @Test
    void shouldLeaveCheckpointUntouchedOnStoreFailure() {
        checkpoint.advance(GROUP, 50L);
        when(experimentStore.getRuns(GROUP, 100)).thenThrow(new ExperimentStoreException("unreachable"));

        assertThatThrownBy(() -> discovery.poll(GROUP, checkpoint)).isInstanceOf(ExperimentStoreException.class);
        assertThat(checkpoint.get(GROUP)).isEqualTo(50L);
    }

    @Test
    void checkpointShouldNeverMoveBackward() {
        checkpoint.advance(GROUP, 500L);
        checkpoint.advance(GROUP, 100L);

        assertThat(checkpoint.get(GROUP)).isEqualTo(500L);
        assertThat(checkpoint.get("other")).isZero();
        assertThat(checkpoint.snapshot()).containsOnlyKeys(GROUP);
    }

    private static RunRecord run(String id, long startTime) {
        return new RunRecord(id, "processed_data_X_" + startTime, startTime, Map.of(), Map.of());
    }
}
