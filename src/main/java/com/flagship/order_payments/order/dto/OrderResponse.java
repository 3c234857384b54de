package com.flagship.order_payments.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.order_payments.order.Order;
import com.flagship.order_payments.order.OrderItem;
import com.flagship.order_payments.order.OrderPaymentStatus;
import com.flagship.order_payments.order.OrderStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class OrderResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("shipping_address")
    String shippingAddress;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("amount_paid")
    BigDecimal amountPaid;

    @JsonProperty("remaining_balance")
    BigDecimal remainingBalance;

    @JsonProperty("status")
    OrderStatus status;

    @JsonProperty("payment_status")
    OrderPaymentStatus paymentStatus;

    @JsonProperty("tracking_number")
    String trackingNumber;

    @JsonProperty("items")
    List<Item> items;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @Value
    public static class Item {
        @JsonProperty("product_id")
        Long productId;

        @JsonProperty("quantity")
        int quantity;

        @JsonProperty("price_at_time")
        BigDecimal priceAtTime;

        @JsonProperty("line_total")
        BigDecimal lineTotal;
    }

    public static OrderResponse from(Order order, List<OrderItem> items) {
        return OrderResponse.builder()
            .id(order.getId())
            .customerId(order.getCustomerId())
            .shippingAddress(order.getShippingAddress())
            .amount(order.getAmount())
            .amountPaid(order.getAmountPaid())
            .remainingBalance(order.remainingBalance())
            .status(order.getStatus())
            .paymentStatus(order.getPaymentStatus())
            .trackingNumber(order.getTrackingNumber())
            .items(items.stream()
                .map(item -> new Item(item.getProductId(), item.getQuantity(), item.getPriceAtTime(), item.lineTotal()))
                .toList())
            .createdAt(order.getCreatedAt())
            .updatedAt(order.getUpdatedAt())
            .build();
    }
}
