package com.flagship.order_payments.webhook;

import com.flagship.order_payments.payment.PaymentStatus;

import java.util.Locale;
import java.util.Map;

/**
 * Translates the gateway's transaction status vocabulary into payment statuses.
 * Anything outside the table maps to PENDING, so an unknown status never completes or fails a payment.
 */
public final class GatewayStatusMapper {

    private static final Map<String, PaymentStatus> STATUS_TABLE = Map.of(
        "success", PaymentStatus.COMPLETED,
        "failed", PaymentStatus.FAILED
    );

    private GatewayStatusMapper() {
    }

    public static PaymentStatus map(String gatewayStatus) {
        if (gatewayStatus == null) {
            return PaymentStatus.PENDING;
        }
        return STATUS_TABLE.getOrDefault(gatewayStatus.trim().toLowerCase(Locale.ROOT), PaymentStatus.PENDING);
    }
}
