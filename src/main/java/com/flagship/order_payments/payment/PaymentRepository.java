package com.flagship.order_payments.payment;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, UUID> {

    Optional<PaymentEntity> findByIdempotencyKey(String idempotencyKey);

    Optional<PaymentEntity> findByTransactionId(String transactionId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PaymentEntity p WHERE p.id = :id")
    Optional<PaymentEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<PaymentEntity> findFirstByOrderIdAndStatusOrderByCreatedAtDesc(Long orderId, PaymentStatus status);

    Optional<PaymentEntity> findFirstByOrderIdOrderByCreatedAtDesc(Long orderId);

    List<PaymentEntity> findByOrderIdOrderByCreatedAtAsc(Long orderId);

    boolean existsByOrderIdAndStatus(Long orderId, PaymentStatus status);

    /**
     * Sum of the payments already credited to an order. Equals the order's amount paid.
     */
    @Query("SELECT COALESCE(SUM(p.amount), 0) FROM PaymentEntity p WHERE p.orderId = :orderId AND p.appliedAt IS NOT NULL")
    BigDecimal sumAppliedAmount(@Param("orderId") Long orderId);
}
