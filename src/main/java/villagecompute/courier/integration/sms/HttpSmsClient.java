/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.courier.integration.sms;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.courier.config.NotificationConfig;
import villagecompute.courier.integration.GatewayResult;

/**
 * SMS gateway posting form-encoded messages to a Twilio-style messages endpoint.
 *
 * <p>
 * A 400 response whose JSON {@code code} marks the number as unusable (21211 invalid number, 21614 not a mobile
 * number, 21610 unsubscribed) is an invalid target; other statuses follow
 * {@link GatewayResult#fromHttpStatus(int, String)}.
 *
 * <p>
 * <b>Configuration:</b> {@code courier.sms.endpoint}, {@code courier.sms.api-key}, {@code courier.sms.from-number}.
 * With any of them missing every send fails with "sms gateway not configured".
 */
@ApplicationScoped
public class HttpSmsClient implements SmsGateway {

    private static final Logger LOG = Logger.getLogger(HttpSmsClient.class);

    private static final int TIMEOUT_SECONDS = 10;

    private static final Set<Integer> INVALID_NUMBER_CODES = Set.of(21211, 21614, 21610);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @ConfigProperty(
            name = "courier.sms.endpoint")
    Optional<String> endpoint;

    @ConfigProperty(
            name = "courier.sms.api-key")
    Optional<String> apiKey;

    @ConfigProperty(
            name = "courier.sms.from-number")
    Optional<String> fromNumber;

    @Inject
    public HttpSmsClient(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    }

    @Override
    public GatewayResult sendSms(String phoneNumber, String body) {
        if (endpoint.isEmpty() || apiKey.isEmpty() || fromNumber.isEmpty()) {
            return GatewayResult.unknownFailure("sms gateway not configured");
        }
        if (!NotificationConfig.isValidPhoneNumber(phoneNumber)) {
            return GatewayResult.invalidTarget("invalid phone number");
        }

        String form = "To=" + encode(phoneNumber) + "&From=" + encode(fromNumber.get()) + "&Body=" + encode(body);
        HttpRequest request = HttpRequest.newBuilder().uri(URI.create(endpoint.get()))
                .header("Authorization", "Bearer " + apiKey.get())
                .header("Content-Type", "application/x-www-form-urlencoded")
                .timeout(Duration.ofSeconds(TIMEOUT_SECONDS)).POST(HttpRequest.BodyPublishers.ofString(form)).build();

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() == 400 && isInvalidNumber(response.body())) {
                return GatewayResult.invalidTarget("HTTP 400: " + response.body());
            }
            GatewayResult result = GatewayResult.fromHttpStatus(response.statusCode(), response.body());
            if (!result.success()) {
                LOG.warnf("SMS send to %s rejected: %s", phoneNumber, result.error());
            }
            return result;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return GatewayResult.transientFailure("interrupted while sending sms");
        } catch (IOException e) {
            LOG.warnf(e, "SMS send to %s failed", phoneNumber);
            return GatewayResult.transientFailure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private boolean isInvalidNumber(String responseBody) {
        try {
            JsonNode root = objectMapper.readTree(responseBody);
            return INVALID_NUMBER_CODES.contains(root.path("code").asInt(0));
        } catch (IOException e) {
            LOG.debugf("SMS error body is not JSON: %s", e.getMessage());
            return false;
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
