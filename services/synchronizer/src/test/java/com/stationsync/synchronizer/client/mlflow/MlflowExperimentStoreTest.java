package com.stationsync.synchronizer.client.mlflow;

import com.stationsync.common.model.RunRecord;
import com.stationsync.synchronizer.config.JacksonConfig;
import com.stationsync.synchronizer.exception.ExperimentStoreException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MlflowExperimentStoreTest {

    private static final String EXPERIMENT = """
            {"experiment": {"experiment_id": "7", "name": "data-pipeline", "lifecycle_stage": "active"}}
            """;

    private static final String RUNS = """
            {"runs": [
              {"info": {"run_id": "r2", "run_name": "processed_data_CARUARU_20240102", "start_time": 1704153600000},
               "data": {"tags": [{"key": "station", "value": "CARUARU"}], "params": [{"key": "model", "value": "LSTM"}]}},
              {"info": {"run_id": "r1", "start_time": 1704067200000},
               "data": {"tags": [{"key": "mlflow.runName", "value": "processed_data_RECIFE_20240101"}]}}
            ]}
            """;

    private static final ExchangeStrategies STRATEGIES = new JacksonConfig().jsonExchangeStrategies();

    private final List<ClientRequest> requests = new ArrayList<>();

    @Test
    void shouldMapRunsOfNamedExperiment() {
        MlflowExperimentStore store = store(request -> {
            String path = request.url().getPath();
            if (path.endsWith("/experiments/get-by-name")) {
                return json(HttpStatus.OK, EXPERIMENT);
            }
            return json(HttpStatus.OK, RUNS);
        });

        List<RunRecord> runs = store.getRuns("data-pipeline", 100);

        assertThat(runs).extracting(RunRecord::runId).containsExactly("r2", "r1");
        assertThat(runs.get(0).tag("station")).contains("CARUARU");
        assertThat(runs.get(0).param("model")).contains("LSTM");
        assertThat(runs.get(1).runName()).isEqualTo("processed_data_RECIFE_20240101");
        assertThat(runs.get(1).startTime()).isEqualTo(1704067200000L);

        assertThat(requests.get(0).url().getQuery()).isEqualTo("experiment_name=data-pipeline");
        assertThat(requests.get(1).method()).isEqualTo(HttpMethod.POST);
        assertThat(requests.get(1).url().getPath()).isEqualTo("/api/2.0/mlflow/runs/search");
    }

    @Test
    void shouldReturnNoRunsForUnknownExperiment() {
        MlflowExperimentStore store = store(request -> json(HttpStatus.NOT_FOUND,
                "{\"error_code\": \"RESOURCE_DOES_NOT_EXIST\"}"));

        assertThat(store.getRuns("missing", 100)).isEmpty();
        assertThat(requests).hasSize(1);
    }

    @Test
    void shouldWrapServerErrors() {
        MlflowExperimentStore store = store(request -> request.url().getPath().endsWith("/experiments/get-by-name")
                ? json(HttpStatus.OK, EXPERIMENT)
                : json(HttpStatus.INTERNAL_SERVER_ERROR, "{}"));

        assertThatThrownBy(() -> store.getRuns("data-pipeline", 100))
                .isInstanceOf(ExperimentStoreException.class)
                .hasMessageContaining("runs/search");
    }

    @Test
    void shouldListActiveExperimentsOnly() {
        MlflowExperimentStore store = store(request -> json(HttpStatus.OK, """
                {"experiments": [
                  {"experiment_id": "0", "name": "Default", "lifecycle_stage": "active"},
                  {"experiment_id": "3", "name": "old", "lifecycle_stage": "deleted"},
                  {"experiment_id": "7", "name": "Imputacao por Estacao", "lifecycle_stage": "active"}
                ]}
                """));

        assertThat(store.listGroups()).containsExactly("Default", "Imputacao por Estacao");
    }

    private MlflowExperimentStore store(Function<ClientRequest, Mono<ClientResponse>> responder) {
        WebClient client = WebClient.builder()
                .baseUrl("http://mlflow.test")
                .exchangeStrategies(STRATEGIES)
                .exchangeFunction(request -> {
                    requests.add(request);
                    return responder.apply(request);
                })
                .build();
        return new MlflowExperimentStore(client, Duration.ofSeconds(5));
    }

    static Mono<ClientResponse> json(HttpStatus status, String body) {
        return Mono.just(ClientResponse.create(status, STRATEGIES)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }
}
