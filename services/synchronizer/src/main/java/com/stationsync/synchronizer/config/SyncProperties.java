package com.stationsync.synchronizer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pipeline settings bound from {@code sync.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "sync")
public class SyncProperties {

    private List<String> groups = new ArrayList<>(List.of("data-pipeline", "Imputacao por Estacao"));

    private Duration interval = Duration.ofSeconds(60);

    private int maxRunsPerPoll = 100;

    /** Pause between two runs of the same cycle. */
    private Duration runDelay = Duration.ofSeconds(2);

    private int batchSize = 100;

    private Duration chunkDelay = Duration.ofMillis(100);

    /** Most recent records kept per run; 0 disables the cap. */
    private int maxRecordsPerRun = 1000;

    private boolean autoStart = false;

    private Device device = new Device();

    private Source source = new Source();

    private Transform transform = new Transform();

    @Data
    public static class Device {
        private String nameSuffix = " - Processed";
        private String type = "weather_station_processed";
        private String labelPrefix = "Processed data - ";
    }

    @Data
    public static class Source {
        private String resultsPrefix = "dados_imputados/resultados/";
        private String filePrefix = "dados_para_update_neon_";
        private String extension = ".csv";
        /** Preferred model variant; blank picks the first file. */
        private String model;
        private String charset = "UTF-8";
    }

    @Data
    public static class Transform {
        private List<String> timestampColumns = new ArrayList<>(List.of("timestamp", "datetime"));
        private String dateColumn = "data";
        private String hourColumn = "hora";
        /** Source column to telemetry key. */
        private Map<String, String> valueColumns = new LinkedHashMap<>(Map.of(
                "temperatura", "temperatura",
                "umidade", "umidade",
                "velocidade_vento", "velocidade_vento"));
        /** Ignores {@code valueColumns} and sends every non-time column under its own name. */
        private boolean forwardAllColumns = false;
        private List<String> missingMarkers = new ArrayList<>(List.of("-9999", "NaN"));
        private String zone = "UTC";
    }
}
