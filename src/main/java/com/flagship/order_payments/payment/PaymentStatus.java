package com.flagship.order_payments.payment;

/**
 * Lifecycle of a single payment attempt.
 *
 * PENDING moves to COMPLETED or FAILED exactly once. COMPLETED and FAILED are terminal
 * for this service; only a refund flow may move COMPLETED on to REFUNDED.
 */
public enum PaymentStatus {
    /**
     * Submitted to the gateway, outcome not yet known. Never counted toward an order's amount paid.
     */
    PENDING,

    /**
     * Confirmed by the gateway. Credited to its order exactly once.
     */
    COMPLETED,

    /**
     * Rejected by the gateway.
     */
    FAILED,

    REFUNDED
}
