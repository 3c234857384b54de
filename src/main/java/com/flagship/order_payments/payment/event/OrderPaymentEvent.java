package com.flagship.order_payments.payment.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of the events this service publishes. Every event belongs to an order,
 * which is the outbox aggregate and the Kafka message key.
 */
public interface OrderPaymentEvent {

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    Long getOrderId();

    Instant getOccurredAt();

    String getEventType();
}
