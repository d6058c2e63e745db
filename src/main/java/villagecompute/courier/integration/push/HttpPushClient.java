/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.courier.integration.push;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.courier.integration.GatewayResult;

/**
 * Push gateway speaking the FCM HTTP send protocol.
 *
 * <p>
 * The endpoint answers 200 even for per-token failures and reports them in {@code results[0].error}. Token errors
 * ({@code NotRegistered}, {@code InvalidRegistration}, {@code MismatchSenderId}) mean the device is gone and are
 * reported as invalid targets; {@code Unavailable} and {@code InternalServerError} are transient.
 *
 * <p>
 * <b>Configuration:</b>
 * <ul>
 * <li>{@code courier.push.endpoint} - Send endpoint URL</li>
 * <li>{@code courier.push.server-key} - Server key; when absent every send fails with "push gateway not
 * configured"</li>
 * </ul>
 */
@ApplicationScoped
public class HttpPushClient implements PushGateway {

    private static final Logger LOG = Logger.getLogger(HttpPushClient.class);

    private static final int TIMEOUT_SECONDS = 10;

    private static final Set<String> INVALID_TOKEN_ERRORS = Set.of("NotRegistered", "InvalidRegistration",
            "MismatchSenderId", "MissingRegistration");

    private static final Set<String> TRANSIENT_ERRORS = Set.of("Unavailable", "InternalServerError",
            "DeviceMessageRateExceeded", "TopicsMessageRateExceeded");

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @ConfigProperty(
            name = "courier.push.endpoint",
            defaultValue = "https://fcm.googleapis.com/fcm/send")
    String endpoint;

    @ConfigProperty(
            name = "courier.push.server-key")
    Optional<String> serverKey;

    @Inject
    public HttpPushClient(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    }

    @Override
    public GatewayResult sendPush(String deviceToken, String title, String body, Map<String, String> data) {
        if (serverKey.isEmpty() || serverKey.get().isBlank()) {
            return GatewayResult.unknownFailure("push gateway not configured");
        }
        if (deviceToken == null || deviceToken.isBlank()) {
            return GatewayResult.invalidTarget("empty device token");
        }

        try {
            Map<String, Object> notification = new LinkedHashMap<>();
            notification.put("title", title);
            notification.put("body", body);

            Map<String, Object> message = new LinkedHashMap<>();
            message.put("to", deviceToken);
            message.put("notification", notification);
            message.put("data", data != null ? data : Map.of());

            HttpRequest request = HttpRequest.newBuilder().uri(URI.create(endpoint))
                    .header("Authorization", "key=" + serverKey.get()).header("Content-Type", "application/json")
                    .timeout(Duration.ofSeconds(TIMEOUT_SECONDS))
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(message))).build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                LOG.warnf("Push send rejected with HTTP %d", response.statusCode());
                return GatewayResult.fromHttpStatus(response.statusCode(), response.body());
            }
            return parseSendResult(response.body());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return GatewayResult.transientFailure("interrupted while sending push");
        } catch (IOException e) {
            LOG.warnf(e, "Push send failed for token %s...", abbreviateToken(deviceToken));
            return GatewayResult.transientFailure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    GatewayResult parseSendResult(String responseBody) throws IOException {
        JsonNode root = objectMapper.readTree(responseBody);
        if (root.path("success").asInt(0) > 0) {
            return GatewayResult.ok();
        }
        String error = root.path("results").path(0).path("error").asText("");
        if (INVALID_TOKEN_ERRORS.contains(error)) {
            return GatewayResult.invalidTarget(error);
        }
        if (TRANSIENT_ERRORS.contains(error)) {
            return GatewayResult.transientFailure(error);
        }
        return GatewayResult.unknownFailure(error.isEmpty() ? "push send not acknowledged" : error);
    }

    private static String abbreviateToken(String token) {
        return token.length() <= 12 ? token : token.substring(0, 12);
    }
}
