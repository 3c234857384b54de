package com.flagship.order_payments.payment.event;

import com.flagship.order_payments.order.Order;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class OrderPlacedEvent implements OrderPaymentEvent {
    UUID eventId;
    Long orderId;
    UUID customerId;
    BigDecimal amount;
    int itemCount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OrderPlaced";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static OrderPlacedEvent fromOrder(Order order, int itemCount) {
        return new OrderPlacedEvent(
            UUID.randomUUID(),
            order.getId(),
            order.getCustomerId(),
            order.getAmount(),
            itemCount,
            Instant.now()
        );
    }
}
