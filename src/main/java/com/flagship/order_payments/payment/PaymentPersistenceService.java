package com.flagship.order_payments.payment;

import com.flagship.order_payments.payment.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the {@link Payment} domain object and {@link PaymentEntity}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentPersistenceService {

    private final PaymentRepository paymentRepository;

    /**
     * Inserts a new payment. Flushes immediately so constraint violations surface here.
     *
     * @param idempotencyKey client key, may be null
     */
    @Transactional
    public Payment save(Payment payment, String idempotencyKey) {
        PaymentEntity saved = paymentRepository.saveAndFlush(PaymentEntity.fromDomain(payment, idempotencyKey));
        log.debug("Saved payment {} for order {}", saved.getId(), saved.getOrderId());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findById(UUID paymentId) {
        return paymentRepository.findById(paymentId).map(PaymentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findByTransactionId(String transactionId) {
        return paymentRepository.findByTransactionId(transactionId).map(PaymentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Payment> findByOrderId(Long orderId) {
        return paymentRepository.findByOrderIdOrderByCreatedAtAsc(orderId).stream()
            .map(PaymentEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public boolean hasPendingPayment(Long orderId) {
        return paymentRepository.existsByOrderIdAndStatus(orderId, PaymentStatus.PENDING);
    }

    /**
     * The payment a gateway callback for this order refers to: the latest PENDING one,
     * otherwise the latest one of any status.
     */
    @Transactional(readOnly = true)
    public Optional<Payment> findCallbackCandidate(Long orderId) {
        return paymentRepository.findFirstByOrderIdAndStatusOrderByCreatedAtDesc(orderId, PaymentStatus.PENDING)
            .or(() -> paymentRepository.findFirstByOrderIdOrderByCreatedAtDesc(orderId))
            .map(PaymentEntity::toDomain);
    }

    @Transactional
    public Payment update(Payment payment) {
        PaymentEntity existing = paymentRepository.findById(payment.getId())
            .orElseThrow(() -> new ResourceNotFoundException("Payment", payment.getId()));
        existing.updateFromDomain(payment);
        PaymentEntity updated = paymentRepository.saveAndFlush(existing);
        log.debug("Updated payment {} to {}", updated.getId(), updated.getStatus());
        return updated.toDomain();
    }

    /**
     * Reads a payment under a row lock held by the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Payment lockForUpdate(UUID paymentId) {
        return paymentRepository.findByIdForUpdate(paymentId)
            .map(PaymentEntity::toDomain)
            .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));
    }

    @Transactional(readOnly = true)
    public boolean isApplied(UUID paymentId) {
        return paymentRepository.findById(paymentId)
            .map(PaymentEntity::isApplied)
            .orElse(false);
    }

    /**
     * Records that the payment has been credited to its order.
     *
     * @throws IllegalStateException if it was already credited or is not COMPLETED
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void markApplied(UUID paymentId, Instant appliedAt) {
        PaymentEntity entity = paymentRepository.findById(paymentId)
            .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));
        entity.markApplied(appliedAt);
        paymentRepository.save(entity);
    }

    @Transactional(readOnly = true)
    public BigDecimal sumAppliedAmount(Long orderId) {
        return paymentRepository.sumAppliedAmount(orderId);
    }
}
