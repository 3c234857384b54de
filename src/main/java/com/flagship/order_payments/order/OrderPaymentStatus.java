package com.flagship.order_payments.order;

import java.math.BigDecimal;

/**
 * Payment progress of an order.
 *
 * UNPAID, PARTIALLY_PAID and PAID are derived from the amount paid against the order total
 * and only move forward. REFUNDED is set by a refund flow and is never produced by {@link #derive}.
 */
public enum OrderPaymentStatus {
    UNPAID,
    PARTIALLY_PAID,
    PAID,
    REFUNDED;

    public static OrderPaymentStatus derive(BigDecimal amount, BigDecimal amountPaid) {
        if (amountPaid.compareTo(amount) >= 0) {
            return PAID;
        }
        if (amountPaid.signum() > 0) {
            return PARTIALLY_PAID;
        }
        return UNPAID;
    }
}
