package com.flagship.order_payments.payment.event;

import com.flagship.order_payments.order.Order;
import com.flagship.order_payments.order.OrderPaymentStatus;
import com.flagship.order_payments.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a completed payment has been credited to its order.
 * Carries the order's running totals after the credit.
 */
@Value
public class PaymentAppliedEvent implements OrderPaymentEvent {
    UUID eventId;
    Long orderId;
    UUID paymentId;
    String transactionId;
    BigDecimal amount;
    BigDecimal amountPaid;
    BigDecimal remainingBalance;
    OrderPaymentStatus paymentStatus;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentApplied";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentAppliedEvent of(Payment payment, Order creditedOrder) {
        return new PaymentAppliedEvent(
            UUID.randomUUID(),
            creditedOrder.getId(),
            payment.getId(),
            payment.getTransactionId(),
            payment.getAmount(),
            creditedOrder.getAmountPaid(),
            creditedOrder.remainingBalance(),
            creditedOrder.getPaymentStatus(),
            Instant.now()
        );
    }
}
