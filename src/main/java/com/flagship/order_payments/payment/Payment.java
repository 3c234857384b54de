package com.flagship.order_payments.payment;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Payment domain object: one mobile money payment attempt against an order.
 *
 * Key principles:
 * - Status transitions are explicit and validated
 * - Invalid transitions are rejected
 * - State changes are immutable (create new Payment with new status)
 */
@Value
public class Payment {
    UUID id;
    Long orderId;
    BigDecimal amount;
    String phoneNumber;
    MobileMoneyProvider provider;
    PaymentStatus status;
    String transactionId;
    String failureReason;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new Payment in PENDING status.
     */
    public static Payment create(UUID id, Long orderId, BigDecimal amount,
                                 String phoneNumber, MobileMoneyProvider provider) {
        Instant now = Instant.now();
        return new Payment(
            id,
            orderId,
            amount,
            phoneNumber,
            provider,
            PaymentStatus.PENDING,
            null,
            null,
            now,
            now
        );
    }

    /**
     * Marks the payment as confirmed by the gateway. Only valid from PENDING.
     *
     * @param gatewayTransactionId transaction id reported by the gateway; keeps the current one when null
     * @throws IllegalStateException if the payment is not PENDING
     */
    public Payment complete(String gatewayTransactionId) {
        if (this.status != PaymentStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Cannot complete payment in %s status. Only PENDING payments can be completed.",
                    this.status)
            );
        }
        return new Payment(
            this.id,
            this.orderId,
            this.amount,
            this.phoneNumber,
            this.provider,
            PaymentStatus.COMPLETED,
            gatewayTransactionId != null ? gatewayTransactionId : this.transactionId,
            null,
            this.createdAt,
            Instant.now()
        );
    }

    /**
     * Marks the payment as rejected by the gateway. Only valid from PENDING.
     *
     * @throws IllegalStateException if the payment is not PENDING
     */
    public Payment fail(String reason) {
        if (this.status != PaymentStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Cannot fail payment in %s status. Only PENDING payments can be failed.",
                    this.status)
            );
        }
        return new Payment(
            this.id,
            this.orderId,
            this.amount,
            this.phoneNumber,
            this.provider,
            PaymentStatus.FAILED,
            this.transactionId,
            reason,
            this.createdAt,
            Instant.now()
        );
    }

    public boolean isTerminal() {
        return this.status != PaymentStatus.PENDING;
    }

    public boolean canTransitionTo(PaymentStatus targetStatus) {
        if (this.status == targetStatus) {
            return true;
        }

        return switch (this.status) {
            case PENDING -> targetStatus == PaymentStatus.COMPLETED || targetStatus == PaymentStatus.FAILED;
            case COMPLETED -> targetStatus == PaymentStatus.REFUNDED;
            case FAILED, REFUNDED -> false;
        };
    }
}
