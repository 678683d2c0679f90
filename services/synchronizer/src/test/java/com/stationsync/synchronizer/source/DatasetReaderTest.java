package com.stationsync.synchronizer.source;

import com.stationsync.synchronizer.exception.DatasetFormatException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatasetReaderTest {

    private final DatasetReader reader = new DatasetReader(StandardCharsets.UTF_8);

    @Test
    void shouldReadCommaSeparatedFile() {
        Dataset dataset = reader.read(bytes("""
                timestamp,temperatura,umidade
                2024-01-01 00:00:00,23.5,80
                2024-01-01 01:00:00,22.9,82
                """));

        assertThat(dataset.columns()).containsExactly("timestamp", "temperatura", "umidade");
        assertThat(dataset.size()).isEqualTo(2);
        assertThat(dataset.rows().get(1)).containsEntry("temperatura", "22.9");
    }

    @Test
    void shouldDetectSemicolonSeparatorWithDecimalCommas() {
        Dataset dataset = reader.read(bytes("""
                data;hora;temperatura
                2024-01-01;0000 UTC;23,5

                2024-01-01;0100 UTC;-9999
                """));

        assertThat(dataset.columns()).containsExactly("data", "hora", "temperatura");
        assertThat(dataset.size()).isEqualTo(2);
        assertThat(dataset.rows().get(0)).containsEntry("temperatura", "23,5");
    }

    @Test
    void shouldStripByteOrderMarkAndTrimHeaders() {
        Dataset dataset = reader.read(bytes("\uFEFFtimestamp , chuva\n2024-01-01 00:00,0\n"));

        assertThat(dataset.hasColumn("timestamp")).isTrue();
        assertThat(dataset.rows().get(0)).containsEntry("chuva", "0");
    }

    @Test
    void shouldKeepHeaderOnlyFileAsEmptyDataset() {
        Dataset dataset = reader.read(bytes("timestamp,temperatura\n"));

        assertThat(dataset.isEmpty()).isTrue();
    }

    @Test
    void shouldRejectEmptyContent() {
        assertThatThrownBy(() -> reader.read(new byte[0]))
                .isInstanceOf(DatasetFormatException.class);
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
