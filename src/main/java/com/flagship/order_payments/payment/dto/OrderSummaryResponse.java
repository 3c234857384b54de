package com.flagship.order_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.order_payments.order.Order;
import com.flagship.order_payments.order.OrderPaymentStatus;
import com.flagship.order_payments.order.OrderStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Payment view of an order, returned alongside a payment.
 */
@Value
@Builder
public class OrderSummaryResponse {

    @JsonProperty("order_id")
    Long orderId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("amount_paid")
    BigDecimal amountPaid;

    @JsonProperty("remaining_balance")
    BigDecimal remainingBalance;

    @JsonProperty("payment_status")
    OrderPaymentStatus paymentStatus;

    @JsonProperty("status")
    OrderStatus status;

    @JsonProperty("tracking_number")
    String trackingNumber;

    public static OrderSummaryResponse from(Order order) {
        return OrderSummaryResponse.builder()
            .orderId(order.getId())
            .amount(order.getAmount())
            .amountPaid(order.getAmountPaid())
            .remainingBalance(order.remainingBalance())
            .paymentStatus(order.getPaymentStatus())
            .status(order.getStatus())
            .trackingNumber(order.getTrackingNumber())
            .build();
    }
}
