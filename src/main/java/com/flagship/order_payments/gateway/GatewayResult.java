package com.flagship.order_payments.gateway;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Synchronous outcome of a gateway submission.
 *
 * success: the payment is confirmed. The transaction id is optional on the wire.
 * no success: the gateway declined; message says why.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GatewayResult {
    boolean success;
    String transactionId;
    String message;

    public static GatewayResult confirmed(String transactionId, String message) {
        String id = transactionId == null || transactionId.isBlank() ? null : transactionId;
        return new GatewayResult(true, id, message);
    }

    public static GatewayResult declined(String message) {
        return new GatewayResult(false, null, message);
    }
}
