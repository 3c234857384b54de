package com.flagship.order_payments.order;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * JPA entity for orders.
 *
 * No setters: the payment fields change only through {@link #updateFromDomain(Order)},
 * and the id comes from the database identity column on first insert.
 */
@Entity
@Table(name = "orders")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OrderEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private UUID customerId;

    @Column(name = "shipping_address", nullable = false, updatable = false, length = 500)
    private String shippingAddress;

    @Column(nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "amount_paid", nullable = false, precision = 12, scale = 2)
    private BigDecimal amountPaid;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OrderStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private OrderPaymentStatus paymentStatus;

    @Column(name = "tracking_number", unique = true, length = 40)
    private String trackingNumber;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static OrderEntity fromDomain(Order order) {
        if (order.getId() != null) {
            throw new IllegalArgumentException("Order " + order.getId() + " is already persisted");
        }
        return new OrderEntity(
            null, // assigned by the identity column
            order.getCustomerId(),
            order.getShippingAddress(),
            order.getAmount(),
            order.getAmountPaid(),
            order.getStatus(),
            order.getPaymentStatus(),
            order.getTrackingNumber(),
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public Order toDomain() {
        return new Order(
            id,
            customerId,
            shippingAddress,
            amount,
            amountPaid,
            status,
            paymentStatus,
            trackingNumber,
            createdAt,
            updatedAt
        );
    }

    /**
     * Copies the mutable fields from the domain object.
     * amount, customer and address never change; a tracking number, once set, can't be replaced.
     */
    void updateFromDomain(Order order) {
        if (this.trackingNumber != null && !Objects.equals(this.trackingNumber, order.getTrackingNumber())) {
            throw new IllegalStateException(
                "Tracking number already assigned for order " + this.id + ". It cannot be reassigned.");
        }
        if (order.getAmountPaid().compareTo(this.amountPaid) < 0) {
            throw new IllegalStateException(
                "Amount paid for order " + this.id + " cannot decrease");
        }
        this.amountPaid = order.getAmountPaid();
        this.paymentStatus = order.getPaymentStatus();
        this.status = order.getStatus();
        this.trackingNumber = order.getTrackingNumber();
    }
}
