package com.stationsync.synchronizer.client.thingsboard;

import com.stationsync.common.model.TelemetryRecord;
import com.stationsync.synchronizer.client.PlatformDevice;
import com.stationsync.synchronizer.client.TelemetryPlatform;
import com.stationsync.synchronizer.exception.PlatformAuthenticationException;
import com.stationsync.synchronizer.exception.TelemetryPlatformException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * {@link TelemetryPlatform} backed by the ThingsBoard REST API.
 *
 * <p>Tenant calls carry the session JWT in {@code X-Authorization}. A 401 on a tenant call
 * means the JWT expired: the session is dropped, renewed once and the call repeated.
 * Telemetry pushes use the device access token in the URL and need no session.
 */
@Component
@Slf4j
public class ThingsBoardClient implements TelemetryPlatform {

    static final String AUTH_HEADER = "X-Authorization";

    private final WebClient thingsboardWebClient;
    private final String username;
    private final String password;
    private final Duration timeout;

    private volatile String jwt;

    public ThingsBoardClient(
            @Qualifier("thingsboardWebClient") WebClient thingsboardWebClient,
            @Value("${thingsboard.username}") String username,
            @Value("${thingsboard.password}") String password,
            @Value("${thingsboard.timeout:30s}") Duration timeout) {
        this.thingsboardWebClient = thingsboardWebClient;
        this.username = username;
        this.password = password;
        this.timeout = timeout;
    }

    @Override
    public void authenticate() {
        if (jwt == null) {
            login();
        }
    }

    @Override
    public boolean isAuthenticated() {
        return jwt != null;
    }

    @Override
    public Optional<PlatformDevice> findDevice(String name) {
        return withSession("find device '" + name + "'", session -> {
            try {
                ThingsBoardDtos.Device device = thingsboardWebClient.get()
                        .uri(uri -> uri.path("/api/tenant/devices").queryParam("deviceName", name).build())
                        .header(AUTH_HEADER, bearer(session))
                        .retrieve()
                        .bodyToMono(ThingsBoardDtos.Device.class)
                        .timeout(timeout)
                        .block();
                return Optional.ofNullable(device).map(ThingsBoardDtos.Device::toPlatformDevice);
            } catch (WebClientResponseException.NotFound e) {
                return Optional.empty();
            }
        });
    }

    @Override
    public PlatformDevice createDevice(String name, String type, String label) {
        ThingsBoardDtos.Device created = withSession("create device '" + name + "'", session ->
                thingsboardWebClient.post()
                        .uri("/api/device")
                        .header(AUTH_HEADER, bearer(session))
                        .bodyValue(new ThingsBoardDtos.CreateDeviceRequest(name, type, label))
                        .retrieve()
                        .bodyToMono(ThingsBoardDtos.Device.class)
                        .timeout(timeout)
                        .block());
        if (created == null || created.id() == null) {
            throw new TelemetryPlatformException("Platform returned no id for created device '" + name + "'");
        }
        log.info("Created device '{}' ({}) of type {}", name, created.id().id(), type);
        return created.toPlatformDevice();
    }

    @Override
    public Optional<String> getToken(String deviceId) {
        ThingsBoardDtos.DeviceCredentials credentials = withSession("fetch credentials of " + deviceId, session ->
                thingsboardWebClient.get()
                        .uri("/api/device/{id}/credentials", deviceId)
                        .header(AUTH_HEADER, bearer(session))
                        .retrieve()
                        .bodyToMono(ThingsBoardDtos.DeviceCredentials.class)
                        .timeout(timeout)
                        .block());
        return Optional.ofNullable(credentials)
                .map(ThingsBoardDtos.DeviceCredentials::credentialsId)
                .filter(token -> !token.isBlank());
    }

    @Override
    public void pushTimeseries(String token, List<TelemetryRecord> batch) {
        try {
            thingsboardWebClient.post()
                    .uri("/api/v1/{token}/telemetry", token)
                    .bodyValue(batch)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            throw new TelemetryPlatformException("Telemetry push of " + batch.size() + " records failed: " + e.getMessage(), e);
        }
    }

    private void login() {
        try {
            ThingsBoardDtos.LoginResponse response = thingsboardWebClient.post()
                    .uri("/api/auth/login")
                    .bodyValue(new ThingsBoardDtos.LoginRequest(username, password))
                    .retrieve()
                    .bodyToMono(ThingsBoardDtos.LoginResponse.class)
                    .timeout(timeout)
                    .block();
            if (response == null || response.token() == null || response.token().isBlank()) {
                throw new PlatformAuthenticationException("Login as '" + username + "' returned no token", null);
            }
            jwt = response.token();
            log.info("Authenticated with ThingsBoard as '{}'", username);
        } catch (PlatformAuthenticationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PlatformAuthenticationException("Login as '" + username + "' failed: " + e.getMessage(), e);
        }
    }

    private <T> T withSession(String operation, Function<String, T> call) {
        authenticate();
        try {
            return call.apply(jwt);
        } catch (WebClientResponseException.Unauthorized e) {
            log.info("Session expired during {}, logging in again", operation);
            jwt = null;
            login();
            return retry(operation, call);
        } catch (RuntimeException e) {
            throw new TelemetryPlatformException("Failed to " + operation + ": " + e.getMessage(), e);
        }
    }

    private <T> T retry(String operation, Function<String, T> call) {
        try {
            return call.apply(jwt);
        } catch (RuntimeException e) {
            throw new TelemetryPlatformException("Failed to " + operation + ": " + e.getMessage(), e);
        }
    }

    private static String bearer(String session) {
        return "Bearer " + session;
    }
}
