package com.flagship.order_payments.payment.exception;

import lombok.Getter;

/**
 * Thrown when a gateway transaction id is already recorded against another payment.
 */
@Getter
public class DuplicatePaymentException extends RuntimeException {

    private final String transactionId;

    public DuplicatePaymentException(String transactionId) {
        super("Gateway transaction " + transactionId + " is already recorded on another payment");
        this.transactionId = transactionId;
    }
}
