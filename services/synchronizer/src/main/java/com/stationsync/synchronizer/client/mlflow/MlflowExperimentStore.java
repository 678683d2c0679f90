package com.stationsync.synchronizer.client.mlflow;

import com.stationsync.common.model.RunRecord;
import com.stationsync.synchronizer.client.ExperimentStore;
import com.stationsync.synchronizer.exception.ExperimentStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ExperimentStore} backed by the MLflow tracking server REST API.
 * Groups are MLflow experiments, addressed by name.
 */
@Component
@Slf4j
public class MlflowExperimentStore implements ExperimentStore {

    private static final String API = "/api/2.0/mlflow";
    private static final int EXPERIMENT_PAGE_SIZE = 1000;

    private final WebClient mlflowWebClient;
    private final Duration timeout;

    public MlflowExperimentStore(
            @Qualifier("mlflowWebClient") WebClient mlflowWebClient,
            @Value("${mlflow.timeout:30s}") Duration timeout) {
        this.mlflowWebClient = mlflowWebClient;
        this.timeout = timeout;
    }

    @Override
    public List<String> listGroups() {
        List<String> names = new ArrayList<>();
        String pageToken = null;
        do {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("max_results", EXPERIMENT_PAGE_SIZE);
            if (pageToken != null) {
                body.put("page_token", pageToken);
            }
            MlflowResponses.SearchExperiments page = call("experiments/search",
                    mlflowWebClient.post()
                            .uri(API + "/experiments/search")
                            .bodyValue(body)
                            .retrieve()
                            .bodyToMono(MlflowResponses.SearchExperiments.class));
            if (page == null) {
                break;
            }
            page.experimentsOrEmpty().stream()
                    .filter(MlflowExperiment::isActive)
                    .map(MlflowExperiment::name)
                    .forEach(names::add);
            pageToken = page.nextPageToken();
        } while (pageToken != null && !pageToken.isBlank());
        return names;
    }

    @Override
    public List<RunRecord> getRuns(String group, int maxResults) {
        Optional<MlflowExperiment> experiment = findExperiment(group);
        if (experiment.isEmpty()) {
            log.warn("Experiment '{}' not found, no runs to poll", group);
            return List.of();
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("experiment_ids", List.of(experiment.get().experimentId()));
        body.put("max_results", maxResults);
        body.put("order_by", List.of("attributes.start_time DESC"));

        MlflowResponses.SearchRuns response = call("runs/search",
                mlflowWebClient.post()
                        .uri(API + "/runs/search")
                        .bodyValue(body)
                        .retrieve()
                        .bodyToMono(MlflowResponses.SearchRuns.class));
        if (response == null) {
            return List.of();
        }

        List<RunRecord> runs = response.runsOrEmpty().stream()
                .filter(run -> run.info() != null && run.info().runId() != null)
                .map(MlflowRun::toRunRecord)
                .toList();
        log.debug("Fetched {} runs of experiment '{}' ({})", runs.size(), group, experiment.get().experimentId());
        return runs;
    }

    Optional<MlflowExperiment> findExperiment(String name) {
        try {
            MlflowResponses.GetExperiment response = mlflowWebClient.get()
                    .uri(uri -> uri.path(API + "/experiments/get-by-name")
                            .queryParam("experiment_name", name)
                            .build())
                    .retrieve()
                    .bodyToMono(MlflowResponses.GetExperiment.class)
                    .timeout(timeout)
                    .block();
            return Optional.ofNullable(response).map(MlflowResponses.GetExperiment::experiment);
        } catch (WebClientResponseException.NotFound e) {
            return Optional.empty();
        } catch (RuntimeException e) {
            throw new ExperimentStoreException("Failed to look up experiment '" + name + "': " + e.getMessage(), e);
        }
    }

    private <T> T call(String operation, Mono<T> request) {
        try {
            return request.timeout(timeout).block();
        } catch (RuntimeException e) {
            throw new ExperimentStoreException("MLflow " + operation + " failed: " + e.getMessage(), e);
        }
    }
}
