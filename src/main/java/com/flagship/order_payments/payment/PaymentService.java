package com.flagship.order_payments.payment;

import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Enforces the payment state machine:
 * - new payments start PENDING
 * - PENDING → COMPLETED on gateway confirmation
 * - PENDING → FAILED on gateway rejection
 * - COMPLETED and FAILED never change again here
 *
 * Persistence is handled by {@link PaymentPersistenceService}.
 */
@Service
public class PaymentService {

    /**
     * Creates a new payment attempt in PENDING status.
     *
     * @param phoneNumber normalized phone number (digits only, with country code)
     */
    public Payment createPayment(Long orderId, BigDecimal amount, String phoneNumber,
                                 MobileMoneyProvider provider) {
        if (orderId == null) {
            throw new IllegalArgumentException("Order ID is required");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Payment amount must be positive");
        }
        if (phoneNumber == null || phoneNumber.isBlank()) {
            throw new IllegalArgumentException("Phone number is required");
        }
        if (provider == null) {
            throw new IllegalArgumentException("Provider is required");
        }
        return Payment.create(UUID.randomUUID(), orderId, amount, phoneNumber, provider);
    }

    /**
     * @throws IllegalStateException if the payment is not PENDING
     */
    public Payment completePayment(Payment payment, String transactionId) {
        if (payment == null) {
            throw new IllegalArgumentException("Payment cannot be null");
        }
        return payment.complete(transactionId);
    }

    /**
     * @throws IllegalStateException if the payment is not PENDING
     */
    public Payment failPayment(Payment payment, String reason) {
        if (payment == null) {
            throw new IllegalArgumentException("Payment cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Failure reason is required");
        }
        return payment.fail(reason);
    }
}
