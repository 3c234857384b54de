package com.flagship.order_payments.payment.event;

import com.flagship.order_payments.order.Order;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published once per order, in the transaction that made it PAID and assigned its tracking number.
 * Fulfilment listens for this event.
 */
@Value
public class OrderFullyPaidEvent implements OrderPaymentEvent {
    UUID eventId;
    Long orderId;
    BigDecimal amount;
    String trackingNumber;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OrderFullyPaid";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static OrderFullyPaidEvent fromOrder(Order order) {
        return new OrderFullyPaidEvent(
            UUID.randomUUID(),
            order.getId(),
            order.getAmount(),
            order.getTrackingNumber(),
            Instant.now()
        );
    }
}
