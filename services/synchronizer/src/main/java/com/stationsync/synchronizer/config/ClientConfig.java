package com.stationsync.synchronizer.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;
import java.time.Duration;

/**
 * Connections to the three external systems: MLflow, ThingsBoard and the S3-compatible results bucket.
 */
@Configuration
public class ClientConfig {

    @Value("${mlflow.tracking-uri}")
    private String mlflowTrackingUri;

    @Value("${thingsboard.url}")
    private String thingsboardUrl;

    @Value("${s3.region:us-east-1}")
    private String s3Region;

    @Value("${s3.endpoint:}")
    private String s3Endpoint;

    @Value("${s3.access-key:}")
    private String s3AccessKey;

    @Value("${s3.secret-key:}")
    private String s3SecretKey;

    @Value("${s3.timeout:30s}")
    private Duration s3Timeout;

    @Bean
    public WebClient mlflowWebClient(ExchangeStrategies jsonExchangeStrategies) {
        return jsonClient(mlflowTrackingUri, jsonExchangeStrategies);
    }

    @Bean
    public WebClient thingsboardWebClient(ExchangeStrategies jsonExchangeStrategies) {
        return jsonClient(thingsboardUrl, jsonExchangeStrategies);
    }

    @Bean(destroyMethod = "close")
    public S3Client s3Client() {
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(s3Region))
                .credentialsProvider(credentialsProvider())
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(s3Timeout)
                        .build());

        // MinIO and other self-hosted stores need path-style addressing
        if (!s3Endpoint.isBlank()) {
            builder.endpointOverride(URI.create(s3Endpoint)).forcePathStyle(true);
        }
        return builder.build();
    }

    private AwsCredentialsProvider credentialsProvider() {
        if (s3AccessKey.isBlank() || s3SecretKey.isBlank()) {
            return DefaultCredentialsProvider.create();
        }
        return StaticCredentialsProvider.create(AwsBasicCredentials.create(s3AccessKey, s3SecretKey));
    }

    private static WebClient jsonClient(String baseUrl, ExchangeStrategies strategies) {
        return WebClient.builder()
                .baseUrl(stripTrailingSlash(baseUrl))
                .exchangeStrategies(strategies)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
