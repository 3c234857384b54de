package com.flagship.order_payments.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link PaymentGateway} backed by the AzamPay mobile network checkout API.
 *
 * Non-2xx answers and bodies without a boolean "success" are reported as declined results.
 * A 401 drops the cached token and the request is sent once more with a fresh one.
 */
@Slf4j
@RequiredArgsConstructor
public class AzamPayGateway implements PaymentGateway {

    static final String CHECKOUT_PATH = "/azampay/mno/checkout";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final AzamPaySettings settings;
    private final GatewayTokenCache tokenCache;

    @Override
    public GatewayResult submit(GatewayPaymentRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("accountNumber", request.getPhoneNumber());
        body.put("amount", request.getAmount().toPlainString());
        body.put("currency", settings.getCurrency());
        body.put("externalId", request.getExternalReference());
        body.put("provider", request.getProvider().getGatewayName());

        String token = tokenCache.getToken();
        try {
            return checkout(body, token);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value()) {
                log.info("Checkout rejected our access token, retrying with a fresh one");
                tokenCache.invalidate(token);
                try {
                    return checkout(body, tokenCache.getToken());
                } catch (HttpStatusCodeException retryFailure) {
                    return declined(retryFailure);
                } catch (ResourceAccessException retryFailure) {
                    throw unreachable(request, retryFailure);
                }
            }
            return declined(e);
        } catch (ResourceAccessException e) {
            throw unreachable(request, e);
        }
    }

    private static GatewayException unreachable(GatewayPaymentRequest request, ResourceAccessException e) {
        return new GatewayException(GatewayException.Reason.TRANSIENT,
            "Checkout request for " + request.getExternalReference() + " failed: " + e.getMessage(), e);
    }

    private GatewayResult checkout(Map<String, Object> body, String token) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setBearerAuth(token);

        ResponseEntity<String> response = restTemplate.exchange(
            settings.getCheckoutBaseUrl() + CHECKOUT_PATH, HttpMethod.POST, new HttpEntity<>(body, headers), String.class);
        return interpret(response.getBody());
    }

    private GatewayResult interpret(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return GatewayResult.declined("Empty checkout response");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            log.warn("Unparseable checkout response: {}", e.getOriginalMessage());
            return GatewayResult.declined("Malformed checkout response");
        }

        JsonNode success = root.get("success");
        if (success == null || !success.isBoolean()) {
            return GatewayResult.declined("Malformed checkout response");
        }

        String message = textOrNull(root, "message");
        if (!success.booleanValue()) {
            return GatewayResult.declined(message != null ? message : "Checkout declined");
        }

        return GatewayResult.confirmed(textOrNull(root, "transactionId"), message);
    }

    private GatewayResult declined(HttpStatusCodeException e) {
        log.warn("Checkout answered HTTP {}: {}", e.getStatusCode().value(), e.getResponseBodyAsString());
        return GatewayResult.declined("Checkout answered HTTP " + e.getStatusCode().value());
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
