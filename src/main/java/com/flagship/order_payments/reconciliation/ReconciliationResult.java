package com.flagship.order_payments.reconciliation;

import com.flagship.order_payments.order.Order;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.UUID;

/**
 * Outcome of applying a payment to its order. A payment that was already applied is
 * reported as such rather than as an error.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ReconciliationResult {
    Order order;
    UUID paymentId;
    boolean applied;
    boolean trackingNumberAssigned;

    static ReconciliationResult applied(Order order, UUID paymentId, boolean trackingNumberAssigned) {
        return new ReconciliationResult(order, paymentId, true, trackingNumberAssigned);
    }

    static ReconciliationResult alreadyApplied(Order order, UUID paymentId) {
        return new ReconciliationResult(order, paymentId, false, false);
    }

    public boolean isAlreadyApplied() {
        return !applied;
    }
}
