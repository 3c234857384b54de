package com.flagship.order_payments.reconciliation;

import com.flagship.order_payments.observability.PaymentMetrics;
import com.flagship.order_payments.order.Order;
import com.flagship.order_payments.order.OrderPaymentStatus;
import com.flagship.order_payments.order.OrderPersistenceService;
import com.flagship.order_payments.order.TrackingNumberGenerator;
import com.flagship.order_payments.outbox.OutboxService;
import com.flagship.order_payments.payment.Payment;
import com.flagship.order_payments.payment.PaymentPersistenceService;
import com.flagship.order_payments.payment.PaymentStatus;
import com.flagship.order_payments.payment.event.OrderFullyPaidEvent;
import com.flagship.order_payments.payment.event.PaymentAppliedEvent;
import com.flagship.order_payments.payment.exception.OverpaymentException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * Credits completed payments to their orders.
 *
 * Each call is one transaction that:
 * 1. Locks the order row, so concurrent credits to the same order run one after another
 * 2. Skips payments that were already credited (duplicate callbacks, retries)
 * 3. Rejects credits larger than the remaining balance
 * 4. Adds the amount, re-derives the payment status and, on the first transition to PAID,
 *    assigns the tracking number
 * 5. Marks the payment as credited and writes the outbox events
 *
 * Any failure rolls back all of it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderReconciliationService {

    private final OrderPersistenceService orderPersistenceService;
    private final PaymentPersistenceService paymentPersistenceService;
    private final TrackingNumberGenerator trackingNumberGenerator;
    private final OutboxService outboxService;
    private final PaymentMetrics paymentMetrics;

    /**
     * Applies a COMPLETED payment to its order exactly once.
     *
     * @return the order after the call; {@link ReconciliationResult#isAlreadyApplied()} when nothing changed
     * @throws OverpaymentException if the payment exceeds the order's remaining balance
     * @throws IllegalStateException if the payment is not COMPLETED
     * @throws IllegalArgumentException if the payment belongs to another order
     * @throws com.flagship.order_payments.payment.exception.ResourceNotFoundException if either record is missing
     */
    @Transactional
    public ReconciliationResult applyPayment(Long orderId, UUID paymentId) {
        long startTime = System.currentTimeMillis();

        // order lock first: every payment flow takes the locks in this order
        Order order = orderPersistenceService.lockForUpdate(orderId);
        Payment payment = paymentPersistenceService.lockForUpdate(paymentId);

        if (!payment.getOrderId().equals(orderId)) {
            throw new IllegalArgumentException(
                String.format("Payment %s belongs to order %s, not %s", paymentId, payment.getOrderId(), orderId));
        }

        if (paymentPersistenceService.isApplied(paymentId)) {
            log.info("Payment already applied, nothing to do: orderId={}, paymentId={}", orderId, paymentId);
            paymentMetrics.recordReconciliation("already_applied");
            return ReconciliationResult.alreadyApplied(order, paymentId);
        }

        if (payment.getStatus() != PaymentStatus.COMPLETED) {
            paymentMetrics.recordReconciliation("invalid_status");
            throw new IllegalStateException(
                String.format("Cannot apply payment %s in %s status. Payment must be COMPLETED.",
                    paymentId, payment.getStatus()));
        }

        Order credited;
        try {
            credited = order.credit(payment.getAmount());
        } catch (OverpaymentException e) {
            paymentMetrics.recordReconciliation("overpayment");
            throw e;
        }

        boolean trackingNumberAssigned = false;
        if (credited.getPaymentStatus() == OrderPaymentStatus.PAID && credited.getTrackingNumber() == null) {
            credited = credited.assignTrackingNumber(trackingNumberGenerator.generate(orderId));
            trackingNumberAssigned = true;
        }

        Order saved = orderPersistenceService.update(credited);
        paymentPersistenceService.markApplied(paymentId, Instant.now());

        outboxService.saveOrderEvent(PaymentAppliedEvent.of(payment, saved));
        if (trackingNumberAssigned) {
            outboxService.saveOrderEvent(OrderFullyPaidEvent.fromOrder(saved));
            paymentMetrics.recordOrderFullyPaid();
        }

        long duration = System.currentTimeMillis() - startTime;
        paymentMetrics.recordReconciliation("applied");
        paymentMetrics.recordPaymentLatency("apply", duration);

        log.info("Payment applied: orderId={}, paymentId={}, amount={}, amountPaid={}/{}, paymentStatus={}, trackingNumber={}",
            orderId, paymentId, payment.getAmount(), saved.getAmountPaid(), saved.getAmount(),
            saved.getPaymentStatus(), saved.getTrackingNumber());

        return ReconciliationResult.applied(saved, paymentId, trackingNumberAssigned);
    }
}
