package com.flagship.order_payments.payment.exception;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Thrown when a payment would push an order's amount paid above its total.
 * Raised before any state is changed.
 */
@Getter
public class OverpaymentException extends RuntimeException {

    private final Long orderId;
    private final BigDecimal requestedAmount;
    private final BigDecimal remainingBalance;

    public OverpaymentException(Long orderId, BigDecimal requestedAmount, BigDecimal remainingBalance) {
        super(String.format("Payment of %s exceeds remaining balance %s for order %s",
            requestedAmount.toPlainString(), remainingBalance.toPlainString(), orderId));
        this.orderId = orderId;
        this.requestedAmount = requestedAmount;
        this.remainingBalance = remainingBalance;
    }
}
