package com.flagship.order_payments.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event waiting in (or already relayed from) the outbox table.
 * Written in the same transaction as the state change it describes.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Order"
    String aggregateId;        // order id
    String eventType;          // e.g. "PaymentApplied"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until relayed
    int retryCount;
    String lastError;

    public static OutboxEvent create(String aggregateType, String aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
