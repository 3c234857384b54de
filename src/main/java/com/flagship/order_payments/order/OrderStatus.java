package com.flagship.order_payments.order;

/**
 * Fulfilment workflow of an order. Independent of how much has been paid.
 */
public enum OrderStatus {
    PENDING,
    PROCESSING,
    SHIPPED,
    DELIVERED,
    CANCELLED;

    /**
     * Whether new payment attempts may be started while the order is in this status.
     */
    public boolean acceptsPayments() {
        return this == PENDING || this == PROCESSING;
    }
}
