package com.flagship.order_payments.payment;

import com.flagship.order_payments.payment.dto.InitiatePaymentRequest;
import com.flagship.order_payments.payment.dto.PaymentInitiationResponse;
import com.flagship.order_payments.payment.dto.PaymentResponse;
import com.flagship.order_payments.payment.exception.ResourceNotFoundException;
import com.flagship.order_payments.reconciliation.PaymentInitiationResult;
import com.flagship.order_payments.reconciliation.PaymentInitiationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for order payments.
 *
 * Key features:
 * - Optional Idempotency-Key header; a repeated key returns the first attempt with 200
 * - A confirmed payment is credited to the order before the response is written
 * - The response carries the order's balance after the attempt
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final PaymentInitiationService initiationService;
    private final PaymentPersistenceService persistenceService;

    /**
     * Starts a mobile money payment for an order.
     *
     * @return 201 with the payment and order summary, or 200 when the idempotency key was seen before
     */
    @PostMapping
    public ResponseEntity<PaymentInitiationResponse> initiatePayment(
            @Valid @RequestBody InitiatePaymentRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received payment request: orderId={}, amount={}, provider={}",
            request.getOrderId(), request.getAmount(), request.getProvider());

        PaymentInitiationResult result = initiationService.initiatePayment(
            request.getOrderId(),
            request.getAmount(),
            request.getPhoneNumber(),
            request.getProvider(),
            idempotencyKey != null && !idempotencyKey.isBlank() ? idempotencyKey : null);

        HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(PaymentInitiationResponse.from(result));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PaymentResponse> getPayment(@PathVariable("id") UUID id) {
        return persistenceService.findById(id)
            .map(payment -> ResponseEntity.ok(PaymentResponse.from(payment)))
            .orElseThrow(() -> new ResourceNotFoundException("Payment", id));
    }
}
