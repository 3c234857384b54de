package com.flagship.order_payments.order;

import com.flagship.order_payments.payment.exception.OverpaymentException;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * Order domain object: the payment ledger of a single order.
 *
 * Key principles:
 * - amount is fixed at creation; amountPaid only grows, through {@link #credit}
 * - paymentStatus is always the value derived from amount and amountPaid
 * - trackingNumber is assigned once, when the order first becomes PAID
 * - state changes return new instances
 */
@Value
public class Order {
    Long id;
    UUID customerId;
    String shippingAddress;
    BigDecimal amount;
    BigDecimal amountPaid;
    OrderStatus status;
    OrderPaymentStatus paymentStatus;
    String trackingNumber;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new unpaid order. The id is assigned when the order is first persisted.
     */
    public static Order place(UUID customerId, String shippingAddress, BigDecimal amount) {
        if (amount == null || amount.compareTo(new BigDecimal("0.01")) < 0) {
            throw new IllegalArgumentException("Order amount must be at least 0.01");
        }
        if (amount.stripTrailingZeros().scale() > 2) {
            throw new IllegalArgumentException("Order amount must have at most two decimal places");
        }
        Instant now = Instant.now();
        return new Order(
            null,
            customerId,
            shippingAddress,
            amount.setScale(2, RoundingMode.UNNECESSARY),
            BigDecimal.ZERO.setScale(2),
            OrderStatus.PENDING,
            OrderPaymentStatus.UNPAID,
            null,
            now,
            now
        );
    }

    public BigDecimal remainingBalance() {
        return amount.subtract(amountPaid).max(BigDecimal.ZERO);
    }

    public boolean isFullyPaid() {
        return amountPaid.compareTo(amount) >= 0;
    }

    public OrderPaymentStatus derivePaymentStatus() {
        return OrderPaymentStatus.derive(amount, amountPaid);
    }

    public boolean acceptsPayments() {
        return status.acceptsPayments();
    }

    /**
     * Adds a confirmed payment to the amount paid and re-derives the payment status.
     *
     * @throws OverpaymentException if the payment exceeds the remaining balance
     * @throws IllegalStateException if the order has been refunded
     */
    public Order credit(BigDecimal paymentAmount) {
        if (paymentAmount == null || paymentAmount.signum() <= 0) {
            throw new IllegalArgumentException("Credited amount must be positive");
        }
        if (paymentStatus == OrderPaymentStatus.REFUNDED) {
            throw new IllegalStateException("Order " + id + " has been refunded and cannot be credited");
        }
        BigDecimal remaining = remainingBalance();
        if (paymentAmount.compareTo(remaining) > 0) {
            throw new OverpaymentException(id, paymentAmount, remaining);
        }
        BigDecimal newAmountPaid = amountPaid.add(paymentAmount);
        return new Order(
            this.id,
            this.customerId,
            this.shippingAddress,
            this.amount,
            newAmountPaid,
            this.status,
            OrderPaymentStatus.derive(amount, newAmountPaid),
            this.trackingNumber,
            this.createdAt,
            Instant.now()
        );
    }

    /**
     * Assigns the tracking number. Only valid once, and only for a fully paid order.
     */
    public Order assignTrackingNumber(String newTrackingNumber) {
        if (this.trackingNumber != null) {
            throw new IllegalStateException(
                String.format("Order %s already has tracking number %s", id, trackingNumber));
        }
        if (paymentStatus != OrderPaymentStatus.PAID) {
            throw new IllegalStateException(
                String.format("Cannot assign a tracking number to order %s in %s payment status", id, paymentStatus));
        }
        return new Order(
            this.id,
            this.customerId,
            this.shippingAddress,
            this.amount,
            this.amountPaid,
            this.status,
            this.paymentStatus,
            newTrackingNumber,
            this.createdAt,
            Instant.now()
        );
    }

    /**
     * Cancels an order on which nothing has been paid yet.
     */
    public Order cancel() {
        if (!status.acceptsPayments()) {
            throw new IllegalStateException(
                String.format("Cannot cancel order %s in %s status", id, status));
        }
        if (amountPaid.signum() > 0) {
            throw new IllegalStateException(
                String.format("Cannot cancel order %s: %s has already been paid", id, amountPaid.toPlainString()));
        }
        return new Order(
            this.id,
            this.customerId,
            this.shippingAddress,
            this.amount,
            this.amountPaid,
            OrderStatus.CANCELLED,
            this.paymentStatus,
            this.trackingNumber,
            this.createdAt,
            Instant.now()
        );
    }
}
