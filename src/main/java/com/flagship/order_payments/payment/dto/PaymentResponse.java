package com.flagship.order_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.order_payments.payment.Payment;
import com.flagship.order_payments.payment.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("order_id")
    Long orderId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("phone_number")
    String phoneNumber;

    @JsonProperty("provider")
    String provider;

    @JsonProperty("status")
    PaymentStatus status;

    @JsonProperty("transaction_id")
    String transactionId;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static PaymentResponse from(Payment payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .orderId(payment.getOrderId())
            .amount(payment.getAmount())
            .phoneNumber(payment.getPhoneNumber())
            .provider(payment.getProvider().getGatewayName())
            .status(payment.getStatus())
            .transactionId(payment.getTransactionId())
            .failureReason(payment.getFailureReason())
            .createdAt(payment.getCreatedAt())
            .updatedAt(payment.getUpdatedAt())
            .build();
    }
}
