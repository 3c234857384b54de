package com.flagship.order_payments.webhook;

import com.flagship.order_payments.observability.CorrelationContext;
import com.flagship.order_payments.observability.PaymentMetrics;
import com.flagship.order_payments.order.OrderPersistenceService;
import com.flagship.order_payments.outbox.OutboxService;
import com.flagship.order_payments.payment.Payment;
import com.flagship.order_payments.payment.PaymentPersistenceService;
import com.flagship.order_payments.payment.PaymentService;
import com.flagship.order_payments.payment.PaymentStatus;
import com.flagship.order_payments.payment.event.PaymentFailedEvent;
import com.flagship.order_payments.payment.exception.ResourceNotFoundException;
import com.flagship.order_payments.reconciliation.OrderReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Applies asynchronous status callbacks from the payment gateway.
 *
 * Callbacks can arrive more than once and in any order relative to the synchronous
 * initiation path. Only a success callback for a payment that is not yet COMPLETED
 * changes anything; redeliveries are no-ops.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GatewayCallbackHandler {

    private static final String DEFAULT_FAILURE_REASON = "Payment failed at gateway";

    private final OrderPersistenceService orderPersistenceService;
    private final PaymentPersistenceService paymentPersistenceService;
    private final PaymentService paymentService;
    private final OrderReconciliationService reconciliationService;
    private final OutboxService outboxService;
    private final PaymentMetrics paymentMetrics;

    /**
     * @param orderId       the order id the gateway echoes back as external id
     * @param gatewayStatus the gateway's transaction status, mapped through {@link GatewayStatusMapper}
     * @param transactionId optional gateway transaction id, recorded on completion
     * @param message       optional gateway message, used as the failure reason
     * @throws ResourceNotFoundException if the order has no payments or does not exist
     * @throws IllegalStateException if a success callback arrives for a FAILED payment
     */
    @Transactional
    public CallbackOutcome handleCallback(Long orderId, String gatewayStatus, String transactionId, String message) {
        PaymentStatus mapped = GatewayStatusMapper.map(gatewayStatus);
        MDC.put(CorrelationContext.ORDER_ID_MDC_KEY, String.valueOf(orderId));

        try {
            // lock before reading the payment so a concurrent initiation cannot credit in between
            orderPersistenceService.lockForUpdate(orderId);

            Payment payment = paymentPersistenceService.findCallbackCandidate(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment for order", orderId));
            MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, payment.getId().toString());

            log.info("Gateway callback: gatewayStatus={}, mapped={}, paymentStatus={}",
                gatewayStatus, mapped, payment.getStatus());

            CallbackOutcome outcome;
            if (mapped == PaymentStatus.COMPLETED && payment.getStatus() != PaymentStatus.COMPLETED) {
                Payment completed = paymentPersistenceService.update(
                    paymentService.completePayment(payment, blankToNull(transactionId)));
                reconciliationService.applyPayment(orderId, completed.getId());
                outcome = CallbackOutcome.RECONCILED;
            } else if (mapped == PaymentStatus.FAILED && payment.getStatus() == PaymentStatus.PENDING) {
                String reason = message != null && !message.isBlank() ? message : DEFAULT_FAILURE_REASON;
                Payment failed = paymentPersistenceService.update(paymentService.failPayment(payment, reason));
                outboxService.saveOrderEvent(PaymentFailedEvent.fromPayment(failed));
                outcome = CallbackOutcome.MARKED_FAILED;
            } else {
                outcome = CallbackOutcome.NO_OP;
            }

            paymentMetrics.recordCallback(outcome.name().toLowerCase());
            log.info("Gateway callback handled: outcome={}", outcome);
            return outcome;

        } catch (RuntimeException e) {
            paymentMetrics.recordCallback("error");
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ORDER_ID_MDC_KEY);
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
