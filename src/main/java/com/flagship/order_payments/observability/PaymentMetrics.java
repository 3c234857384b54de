package com.flagship.order_payments.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for the payment flows.
 *
 * Metrics exposed:
 * - payments.initiated{provider, outcome}: initiation attempts by result
 * - payments.gateway.calls{outcome} and payments.gateway.duration: gateway round trips
 * - payments.reconciled{result}: apply-payment outcomes (applied, already_applied, overpayment)
 * - payments.callbacks{outcome}: gateway callback outcomes
 * - payments.latency{operation}: end-to-end latency of each operation
 * - idempotency.cache{result}: idempotency key hits and misses
 * - orders.placed / orders.fully_paid
 */
@Component
public class PaymentMetrics {

    private final MeterRegistry registry;
    private final Timer gatewayTimer;

    public PaymentMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.gatewayTimer = Timer.builder("payments.gateway.duration")
                .description("Round trip time of payment gateway submissions")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordPaymentInitiated(String provider, String outcome) {
        registry.counter("payments.initiated",
                "provider", sanitizeTag(provider),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordGatewayCall(String outcome, Duration duration) {
        registry.counter("payments.gateway.calls", "outcome", sanitizeTag(outcome)).increment();
        gatewayTimer.record(duration);
    }

    public void recordReconciliation(String result) {
        registry.counter("payments.reconciled", "result", sanitizeTag(result)).increment();
    }

    public void recordCallback(String outcome) {
        registry.counter("payments.callbacks", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordPaymentLatency(String operation, long durationMs) {
        registry.timer("payments.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordOrderPlaced() {
        registry.counter("orders.placed").increment();
    }

    public void recordOrderFullyPaid() {
        registry.counter("orders.fully_paid").increment();
    }

    /**
     * Keeps tag values short and free of special characters to bound cardinality.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
