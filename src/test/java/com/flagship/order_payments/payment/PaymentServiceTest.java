package com.flagship.order_payments.payment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Payment state machine: PENDING -> COMPLETED | FAILED, COMPLETED -> REFUNDED.
 */
class PaymentServiceTest {

    private final PaymentService paymentService = new PaymentService();

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private Payment pending() {
        return paymentService.createPayment(7L, new BigDecimal("60.00"), "255712345678", MobileMoneyProvider.MPESA);
    }

    @Test
    @DisplayName("New payment is PENDING with no transaction id")
    void createPayment() {
        printTestHeader("Create payment");

        Payment payment = pending();

        assertNotNull(payment.getId());
        assertEquals(PaymentStatus.PENDING, payment.getStatus());
        assertNull(payment.getTransactionId());
        assertFalse(payment.isTerminal());
        printSuccess("Payment created in PENDING");
    }

    @Test
    @DisplayName("Invalid input is rejected")
    void createPaymentValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> paymentService.createPayment(null, BigDecimal.TEN, "255712345678", MobileMoneyProvider.MPESA));
        assertThrows(IllegalArgumentException.class,
            () -> paymentService.createPayment(7L, BigDecimal.ZERO, "255712345678", MobileMoneyProvider.MPESA));
        assertThrows(IllegalArgumentException.class,
            () -> paymentService.createPayment(7L, BigDecimal.TEN, " ", MobileMoneyProvider.MPESA));
        assertThrows(IllegalArgumentException.class,
            () -> paymentService.createPayment(7L, BigDecimal.TEN, "255712345678", null));
    }

    @Test
    @DisplayName("PENDING -> COMPLETED records the gateway transaction id")
    void completeRecordsTransactionId() {
        Payment completed = paymentService.completePayment(pending(), "TX-1001");

        assertEquals(PaymentStatus.COMPLETED, completed.getStatus());
        assertEquals("TX-1001", completed.getTransactionId());
        assertTrue(completed.isTerminal());
    }

    @Test
    @DisplayName("PENDING -> FAILED records the reason")
    void failRecordsReason() {
        Payment failed = paymentService.failPayment(pending(), "Insufficient balance");

        assertEquals(PaymentStatus.FAILED, failed.getStatus());
        assertEquals("Insufficient balance", failed.getFailureReason());
        assertThrows(IllegalArgumentException.class, () -> paymentService.failPayment(pending(), ""));
    }

    @Test
    @DisplayName("Terminal payments cannot be completed or failed again")
    void terminalPaymentsRejectTransitions() {
        printTestHeader("Invalid transitions");

        Payment completed = paymentService.completePayment(pending(), "TX-1002");
        Payment failed = paymentService.failPayment(pending(), "Timeout");

        assertThrows(IllegalStateException.class, () -> paymentService.completePayment(completed, "TX-1003"));
        assertThrows(IllegalStateException.class, () -> paymentService.failPayment(completed, "late failure"));
        assertThrows(IllegalStateException.class, () -> paymentService.completePayment(failed, "TX-1004"));
        printSuccess("Terminal states are final");
    }

    @Test
    @DisplayName("Transition table")
    void canTransitionTo() {
        Payment payment = pending();
        assertTrue(payment.canTransitionTo(PaymentStatus.COMPLETED));
        assertTrue(payment.canTransitionTo(PaymentStatus.FAILED));
        assertFalse(payment.canTransitionTo(PaymentStatus.REFUNDED));

        Payment completed = payment.complete("TX-1005");
        assertTrue(completed.canTransitionTo(PaymentStatus.REFUNDED));
        assertFalse(completed.canTransitionTo(PaymentStatus.FAILED));
        assertFalse(payment.fail("x").canTransitionTo(PaymentStatus.COMPLETED));
    }

    @Test
    @DisplayName("Provider lookup accepts gateway and constant names in any case")
    void providerLookup() {
        assertEquals(MobileMoneyProvider.MPESA, MobileMoneyProvider.fromName("mpesa").orElseThrow());
        assertEquals(MobileMoneyProvider.AIRTEL, MobileMoneyProvider.fromName(" AIRTEL ").orElseThrow());
        assertTrue(MobileMoneyProvider.fromName("Vodacom").isEmpty());
        assertTrue(MobileMoneyProvider.fromName(null).isEmpty());
    }
}
