package com.flagship.order_payments.payment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
 * JPA entity for payments.
 *
 * No setters: state changes come from the domain object through {@link #updateFromDomain(Payment)}.
 * The idempotency key and the applied-at marker are persistence concerns and live only here.
 */
@Entity
@Table(name = "payments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "order_id", nullable = false, updatable = false)
    private Long orderId;

    @Column(nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "phone_number", nullable = false, updatable = false, length = 20)
    private String phoneNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private MobileMoneyProvider provider;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Column(name = "transaction_id", unique = true, length = 100)
    private String transactionId;

    @Column(name = "failure_reason", length = 500)
    private String failureReason;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    /**
     * When the payment was credited to its order. Null until then; set exactly once.
     * This is what makes crediting idempotent.
     */
    @Column(name = "applied_at")
    private Instant appliedAt;

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

    static PaymentEntity fromDomain(Payment payment, String idempotencyKey) {
        return new PaymentEntity(
            payment.getId(),
            payment.getOrderId(),
            payment.getAmount(),
            payment.getPhoneNumber(),
            payment.getProvider(),
            payment.getStatus(),
            payment.getTransactionId(),
            payment.getFailureReason(),
            idempotencyKey,
            null, // appliedAt - set when credited to the order
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public Payment toDomain() {
        return new Payment(
            id,
            orderId,
            amount,
            phoneNumber,
            provider,
            status,
            transactionId,
            failureReason,
            createdAt,
            updatedAt
        );
    }

    /**
     * Copies status, transaction id and failure reason from the domain object.
     * A recorded transaction id is never replaced.
     */
    void updateFromDomain(Payment payment) {
        if (this.transactionId != null && !Objects.equals(this.transactionId, payment.getTransactionId())) {
            throw new IllegalStateException(
                "Transaction ID already recorded for payment " + this.id + ". It cannot be replaced.");
        }
        this.status = payment.getStatus();
        this.transactionId = payment.getTransactionId();
        this.failureReason = payment.getFailureReason();
    }

    void markApplied(Instant at) {
        if (this.appliedAt != null) {
            throw new IllegalStateException(
                "Payment " + this.id + " was already applied to order " + this.orderId + ". Cannot apply twice.");
        }
        if (this.status != PaymentStatus.COMPLETED) {
            throw new IllegalStateException(
                "Cannot apply payment " + this.id + " in " + this.status + " status. Payment must be COMPLETED.");
        }
        this.appliedAt = at;
    }

    boolean isApplied() {
        return appliedAt != null;
    }
}
