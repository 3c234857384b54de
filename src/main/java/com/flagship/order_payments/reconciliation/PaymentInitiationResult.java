package com.flagship.order_payments.reconciliation;

import com.flagship.order_payments.order.Order;
import com.flagship.order_payments.payment.Payment;
import lombok.Value;

/**
 * The payment created (or found again by idempotency key) and the order as it stands afterwards.
 */
@Value
public class PaymentInitiationResult {
    Payment payment;
    Order order;
    /**
     * True when the request repeated an idempotency key and no new attempt was made.
     */
    boolean replayed;
}
