package com.flagship.order_payments.reconciliation;

import com.flagship.order_payments.gateway.GatewayException;
import com.flagship.order_payments.gateway.GatewayPaymentRequest;
import com.flagship.order_payments.gateway.GatewayResult;
import com.flagship.order_payments.gateway.PaymentGateway;
import com.flagship.order_payments.observability.CorrelationContext;
import com.flagship.order_payments.observability.PaymentMetrics;
import com.flagship.order_payments.order.Order;
import com.flagship.order_payments.order.OrderPersistenceService;
import com.flagship.order_payments.payment.IdempotencyService;
import com.flagship.order_payments.payment.MobileMoneyProvider;
import com.flagship.order_payments.payment.Payment;
import com.flagship.order_payments.payment.PaymentPersistenceService;
import com.flagship.order_payments.payment.PaymentService;
import com.flagship.order_payments.payment.PhoneNumberNormalizer;
import com.flagship.order_payments.payment.exception.DuplicatePaymentException;
import com.flagship.order_payments.payment.exception.OverpaymentException;
import com.flagship.order_payments.payment.exception.RequestValidationException;
import com.flagship.order_payments.payment.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Starts a mobile money payment for an order.
 *
 * The whole attempt is one transaction holding the order row lock:
 * validate, insert a PENDING payment, submit it to the gateway, and on success
 * complete it and credit the order. The gateway transaction id may be missing.
 * A declined or failed gateway call throws {@link GatewayException}, which rolls back the
 * tentative payment row; the order is untouched.
 */
@Service
@Slf4j
public class PaymentInitiationService {

    private final OrderPersistenceService orderPersistenceService;
    private final PaymentPersistenceService paymentPersistenceService;
    private final PaymentService paymentService;
    private final OrderReconciliationService reconciliationService;
    private final PaymentGateway paymentGateway;
    private final IdempotencyService idempotencyService;
    private final PhoneNumberNormalizer phoneNumberNormalizer;
    private final PaymentMetrics paymentMetrics;
    private final MobileMoneyProvider defaultProvider;

    public PaymentInitiationService(OrderPersistenceService orderPersistenceService,
                                    PaymentPersistenceService paymentPersistenceService,
                                    PaymentService paymentService,
                                    OrderReconciliationService reconciliationService,
                                    PaymentGateway paymentGateway,
                                    IdempotencyService idempotencyService,
                                    PhoneNumberNormalizer phoneNumberNormalizer,
                                    PaymentMetrics paymentMetrics,
                                    @Value("${gateway.azampay.default-provider:Mpesa}") String defaultProvider) {
        this.orderPersistenceService = orderPersistenceService;
        this.paymentPersistenceService = paymentPersistenceService;
        this.paymentService = paymentService;
        this.reconciliationService = reconciliationService;
        this.paymentGateway = paymentGateway;
        this.idempotencyService = idempotencyService;
        this.phoneNumberNormalizer = phoneNumberNormalizer;
        this.paymentMetrics = paymentMetrics;
        this.defaultProvider = MobileMoneyProvider.fromName(defaultProvider)
            .orElseThrow(() -> new IllegalArgumentException("Unknown default mobile money provider: " + defaultProvider));
    }

    /**
     * @param providerName   gateway provider name; the configured default when null
     * @param idempotencyKey optional client key; a repeated key returns the first attempt's payment
     * @throws RequestValidationException on malformed input, with one message per field
     * @throws ResourceNotFoundException if the order does not exist
     * @throws IllegalStateException if the order no longer accepts payments
     * @throws OverpaymentException if amount exceeds the remaining balance
     * @throws GatewayException if the gateway failed or declined; nothing is stored
     * @throws DuplicatePaymentException if the gateway transaction id is already recorded
     */
    @Transactional
    public PaymentInitiationResult initiatePayment(Long orderId, BigDecimal amount, String phoneNumber,
                                                   String providerName, String idempotencyKey) {
        long startTime = System.currentTimeMillis();
        String providerTag = providerName != null ? providerName : defaultProvider.getGatewayName();
        MDC.put(CorrelationContext.ORDER_ID_MDC_KEY, String.valueOf(orderId));

        log.info("Payment initiation requested: amount={}, provider={}, idempotencyKey={}",
            amount, providerTag, idempotencyKey);

        try {
            if (idempotencyKey != null) {
                Optional<PaymentInitiationResult> replay = findReplay(orderId, idempotencyKey);
                if (replay.isPresent()) {
                    paymentMetrics.recordIdempotencyHit();
                    paymentMetrics.recordPaymentInitiated(providerTag, "replayed");
                    return replay.get();
                }
                paymentMetrics.recordIdempotencyMiss();
            }

            String normalizedPhone = null;
            MobileMoneyProvider provider = null;
            Map<String, String> errors = new LinkedHashMap<>();
            validateAmount(amount, errors);
            try {
                normalizedPhone = phoneNumberNormalizer.normalize(phoneNumber);
            } catch (RequestValidationException e) {
                errors.putAll(e.getFieldErrors());
            }
            if (providerName == null) {
                provider = defaultProvider;
            } else {
                provider = MobileMoneyProvider.fromName(providerName).orElse(null);
                if (provider == null) {
                    errors.put("provider", "Unknown mobile money provider: " + providerName);
                }
            }
            if (!errors.isEmpty()) {
                throw new RequestValidationException(errors);
            }

            Order order = orderPersistenceService.lockForUpdate(orderId);
            if (!order.acceptsPayments()) {
                throw new IllegalStateException(
                    String.format("Order %s is %s and does not accept payments", orderId, order.getStatus()));
            }
            if (amount.compareTo(order.remainingBalance()) > 0) {
                throw new OverpaymentException(orderId, amount, order.remainingBalance());
            }

            Payment pending = paymentPersistenceService.save(
                paymentService.createPayment(orderId, amount, normalizedPhone, provider), idempotencyKey);
            MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, pending.getId().toString());

            GatewayResult result = submitToGateway(pending);

            if (result.getTransactionId() != null) {
                ensureTransactionIdUnused(result.getTransactionId(), pending.getId());
            } else {
                log.info("Gateway confirmed the payment without a transaction id");
            }
            Payment completed = paymentPersistenceService.update(
                paymentService.completePayment(pending, result.getTransactionId()));
            ReconciliationResult reconciliation = reconciliationService.applyPayment(orderId, completed.getId());
            PaymentInitiationResult initiated = new PaymentInitiationResult(completed, reconciliation.getOrder(), false);
            paymentMetrics.recordPaymentInitiated(provider.getGatewayName(), "completed");

            if (idempotencyKey != null) {
                idempotencyService.storeIdempotencyKey(idempotencyKey, pending.getId());
            }

            long duration = System.currentTimeMillis() - startTime;
            paymentMetrics.recordPaymentLatency("initiate", duration);
            log.info("Payment initiated: paymentId={}, status={}, duration={}ms",
                pending.getId(), initiated.getPayment().getStatus(), duration);

            return initiated;

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            paymentMetrics.recordPaymentInitiated(providerTag, "rejected");
            paymentMetrics.recordPaymentLatency("initiate", duration);
            log.warn("Payment initiation failed: error={}, duration={}ms", e.getMessage(), duration);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ORDER_ID_MDC_KEY);
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
        }
    }

    private Optional<PaymentInitiationResult> findReplay(Long orderId, String idempotencyKey) {
        Optional<Payment> existing = idempotencyService.checkIdempotencyKey(idempotencyKey)
            .flatMap(paymentPersistenceService::findById);
        if (existing.isEmpty()) {
            return Optional.empty();
        }

        Payment payment = existing.get();
        if (!payment.getOrderId().equals(orderId)) {
            throw RequestValidationException.of("Idempotency-Key",
                "Idempotency key was already used for another order");
        }
        log.info("Idempotency key already used, returning payment {}", payment.getId());
        Order order = orderPersistenceService.findById(orderId)
            .orElseThrow(() -> ResourceNotFoundException.order(orderId));
        return Optional.of(new PaymentInitiationResult(payment, order, true));
    }

    private void validateAmount(BigDecimal amount, Map<String, String> errors) {
        if (amount == null) {
            errors.put("amount", "Amount is required");
        } else if (amount.signum() <= 0) {
            errors.put("amount", "Amount must be greater than 0");
        } else if (amount.stripTrailingZeros().scale() > 2) {
            errors.put("amount", "Amount must have at most two decimal places");
        }
    }

    private GatewayResult submitToGateway(Payment payment) {
        long startTime = System.nanoTime();
        GatewayPaymentRequest request = new GatewayPaymentRequest(
            payment.getAmount(), payment.getPhoneNumber(), payment.getProvider(),
            String.valueOf(payment.getOrderId()));

        GatewayResult result;
        try {
            result = paymentGateway.submit(request);
        } catch (GatewayException e) {
            paymentMetrics.recordGatewayCall("error", Duration.ofNanos(System.nanoTime() - startTime));
            throw e;
        } catch (RuntimeException e) {
            paymentMetrics.recordGatewayCall("error", Duration.ofNanos(System.nanoTime() - startTime));
            throw new GatewayException(GatewayException.Reason.TRANSIENT,
                "Gateway call failed for payment " + payment.getId(), e);
        }

        if (!result.isSuccess()) {
            paymentMetrics.recordGatewayCall("declined", Duration.ofNanos(System.nanoTime() - startTime));
            throw new GatewayException(GatewayException.Reason.DECLINED,
                "Gateway declined payment " + payment.getId() + ": " + result.getMessage());
        }

        paymentMetrics.recordGatewayCall("confirmed", Duration.ofNanos(System.nanoTime() - startTime));
        return result;
    }

    private void ensureTransactionIdUnused(String transactionId, UUID paymentId) {
        paymentPersistenceService.findByTransactionId(transactionId)
            .filter(other -> !other.getId().equals(paymentId))
            .ifPresent(other -> {
                throw new DuplicatePaymentException(transactionId);
            });
    }
}
