package com.flagship.order_payments.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Obtains access tokens from the AzamPay authenticator. Used as the token source of {@link GatewayTokenCache}.
 */
@Slf4j
@RequiredArgsConstructor
public class AzamPayTokenClient {

    static final String TOKEN_PATH = "/AppRegistration/GenerateToken";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final AzamPaySettings settings;
    private final Clock clock;

    /**
     * @throws GatewayException INVALID_CREDENTIALS when the authenticator rejects the client,
     *                          TRANSIENT on network or server errors, MALFORMED_RESPONSE otherwise
     */
    public GatewayAccessToken fetchToken() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("appName", settings.getAppName());
        body.put("clientId", settings.getClientId());
        body.put("clientSecret", settings.getClientSecret());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(settings.getAuthBaseUrl() + TOKEN_PATH, HttpMethod.POST,
                new HttpEntity<>(body, headers), String.class);
        } catch (HttpStatusCodeException e) {
            GatewayException.Reason reason = e.getStatusCode().is4xxClientError()
                ? GatewayException.Reason.INVALID_CREDENTIALS
                : GatewayException.Reason.TRANSIENT;
            throw new GatewayException(reason, "Token request failed with HTTP " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new GatewayException(GatewayException.Reason.TRANSIENT, "Token request failed: " + e.getMessage(), e);
        }

        return parse(response.getBody());
    }

    private GatewayAccessToken parse(String responseBody) {
        JsonNode root;
        try {
            root = responseBody == null ? null : objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new GatewayException(GatewayException.Reason.MALFORMED_RESPONSE, "Token response is not JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new GatewayException(GatewayException.Reason.MALFORMED_RESPONSE, "Token response is empty");
        }
        if (!root.path("success").asBoolean(false)) {
            throw new GatewayException(GatewayException.Reason.INVALID_CREDENTIALS,
                "Authenticator refused the client: " + root.path("message").asText("no message"));
        }

        JsonNode data = root.path("data");
        String accessToken = data.path("accessToken").asText(null);
        if (accessToken == null || accessToken.isBlank()) {
            throw new GatewayException(GatewayException.Reason.MALFORMED_RESPONSE, "Token response has no accessToken");
        }
        return new GatewayAccessToken(accessToken, parseExpiry(data.path("expire").asText(null)));
    }

    /**
     * The authenticator sends either an ISO instant or a local date-time in UTC.
     */
    private Instant parseExpiry(String expire) {
        if (expire != null && !expire.isBlank()) {
            try {
                return Instant.parse(expire);
            } catch (DateTimeParseException e) {
                try {
                    return LocalDateTime.parse(expire).toInstant(ZoneOffset.UTC);
                } catch (DateTimeParseException notLocalDateTime) {
                    log.warn("Unrecognized token expiry '{}', assuming {}", expire, settings.getTokenDefaultTtl());
                }
            }
        }
        return clock.instant().plus(settings.getTokenDefaultTtl());
    }
}
