package com.flagship.order_payments.webhook;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives payment status callbacks from the gateway.
 * Errors are answered by {@link GatewayCallbackExceptionHandler}.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class GatewayCallbackController {

    private final GatewayCallbackHandler callbackHandler;

    @PostMapping("/api/payments/webhook")
    public ResponseEntity<GatewayCallbackResponse> receiveCallback(@RequestBody GatewayCallbackRequest request) {
        Long orderId = parseOrderId(request.getExternalId());
        if (request.getTransactionStatus() == null || request.getTransactionStatus().isBlank()) {
            throw new IllegalArgumentException("transactionStatus is required");
        }

        CallbackOutcome outcome = callbackHandler.handleCallback(
            orderId, request.getTransactionStatus(), request.getTransactionId(), request.getMessage());
        log.debug("Callback for order {} processed: {}", orderId, outcome);
        return ResponseEntity.ok(GatewayCallbackResponse.success());
    }

    private static Long parseOrderId(String externalId) {
        if (externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("externalId is required");
        }
        try {
            long orderId = Long.parseLong(externalId.trim());
            if (orderId <= 0) {
                throw new IllegalArgumentException("externalId must be a positive order id");
            }
            return orderId;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("externalId must be a numeric order id: " + externalId, e);
        }
    }
}
