package com.flagship.order_payments.payment.event;

import com.flagship.order_payments.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class PaymentFailedEvent implements OrderPaymentEvent {
    UUID eventId;
    Long orderId;
    UUID paymentId;
    BigDecimal amount;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentFailed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentFailedEvent fromPayment(Payment payment) {
        return new PaymentFailedEvent(
            UUID.randomUUID(),
            payment.getOrderId(),
            payment.getId(),
            payment.getAmount(),
            payment.getFailureReason(),
            Instant.now()
        );
    }
}
