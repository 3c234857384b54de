package com.flagship.order_payments.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.order_payments.catalog.ProductEntity;
import com.flagship.order_payments.catalog.ProductRepository;
import com.flagship.order_payments.gateway.GatewayPaymentRequest;
import com.flagship.order_payments.gateway.GatewayResult;
import com.flagship.order_payments.gateway.PaymentGateway;
import com.flagship.order_payments.order.Order;
import com.flagship.order_payments.order.OrderPaymentStatus;
import com.flagship.order_payments.order.OrderPersistenceService;
import com.flagship.order_payments.order.OrderService;
import com.flagship.order_payments.outbox.OutboxEvent;
import com.flagship.order_payments.outbox.OutboxService;
import com.flagship.order_payments.payment.MobileMoneyProvider;
import com.flagship.order_payments.payment.Payment;
import com.flagship.order_payments.payment.PaymentPersistenceService;
import com.flagship.order_payments.payment.PaymentService;
import com.flagship.order_payments.payment.PaymentStatus;
import com.flagship.order_payments.payment.event.PaymentFailedEvent;
import com.flagship.order_payments.reconciliation.PaymentInitiationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Gateway callbacks: completion of pending payments, safe redelivery and error answers.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class GatewayCallbackControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private OrderService orderService;

    @Autowired
    private OrderPersistenceService orderPersistenceService;

    @Autowired
    private PaymentInitiationService initiationService;

    @Autowired
    private PaymentPersistenceService paymentPersistenceService;

    @Autowired
    private PaymentService paymentService;

    @Autowired
    private OutboxService outboxService;

    @MockBean
    private PaymentGateway paymentGateway;

    private Order order;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM outbox_events");
        jdbcTemplate.update("DELETE FROM payments");
        jdbcTemplate.update("DELETE FROM order_items");
        jdbcTemplate.update("DELETE FROM orders");
        jdbcTemplate.update("DELETE FROM products");

        ProductEntity product = productRepository.save(ProductEntity.create("Water tank", new BigDecimal("100.00"), 3));
        order = orderService.placeOrder(UUID.randomUUID(), "Plot 9, Dodoma",
            List.of(new OrderService.LineRequest(product.getId(), 1)));
    }

    // an attempt whose gateway answer never arrived; only a callback can settle it
    private Payment pendingPayment(String amount) {
        return paymentPersistenceService.save(paymentService.createPayment(
            order.getId(), new BigDecimal(amount), "255712345678", MobileMoneyProvider.MPESA), null);
    }

    private ResultActions callback(Object externalId, String status, String transactionId) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("externalId", externalId);
        body.put("transactionStatus", status);
        if (transactionId != null) {
            body.put("transactionId", transactionId);
        }
        return mockMvc.perform(post("/api/payments/webhook")
            .contentType(MediaType.APPLICATION_JSON)
            .content(objectMapper.writeValueAsString(body)));
    }

    private Order reload() {
        return orderPersistenceService.findById(order.getId()).orElseThrow();
    }

    @Nested
    @DisplayName("Success callbacks")
    class SuccessCallbacks {

        @Test
        @DisplayName("Success completes the pending payment and credits the order")
        void completesPendingPayment() throws Exception {
            printTestHeader("Callback completes pending payment");
            Payment pending = pendingPayment("100.00");

            callback(String.valueOf(order.getId()), "success", "TX-CB-1")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"));

            Payment completed = paymentPersistenceService.findById(pending.getId()).orElseThrow();
            assertEquals(PaymentStatus.COMPLETED, completed.getStatus());
            assertEquals("TX-CB-1", completed.getTransactionId());
            Order paid = reload();
            assertEquals(OrderPaymentStatus.PAID, paid.getPaymentStatus());
            assertNotNull(paid.getTrackingNumber());
            printSuccess("Order PAID through callback");
        }

        @Test
        @DisplayName("Redelivered success callback is a no-op")
        void replayIsNoOp() throws Exception {
            printTestHeader("Callback replay");
            pendingPayment("60.00");

            callback(order.getId(), "SUCCESS", "TX-CB-2").andExpect(status().isOk());
            callback(order.getId(), "success", "TX-CB-2")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"));

            assertEquals(0, new BigDecimal("60.00").compareTo(reload().getAmountPaid()));
            printSuccess("amount_paid unchanged by the replay");
        }

        @Test
        @DisplayName("Callback after a synchronous confirmation does not credit again")
        void callbackAfterSynchronousCompletion() throws Exception {
            when(paymentGateway.submit(any(GatewayPaymentRequest.class)))
                .thenReturn(GatewayResult.confirmed("TX-SYNC", "Success"));
            initiationService.initiatePayment(order.getId(), new BigDecimal("40.00"), "255712345678", "Mpesa", null);

            callback(order.getId(), "success", "TX-SYNC").andExpect(status().isOk());

            assertEquals(0, new BigDecimal("40.00").compareTo(reload().getAmountPaid()));
        }
    }

    @Nested
    @DisplayName("Other statuses")
    class OtherStatuses {

        @Test
        @DisplayName("Unknown status leaves the payment PENDING")
        void unknownStatus() throws Exception {
            Payment pending = pendingPayment("50.00");

            callback(order.getId(), "processing", null).andExpect(status().isOk());

            assertEquals(PaymentStatus.PENDING,
                paymentPersistenceService.findById(pending.getId()).orElseThrow().getStatus());
            assertEquals(0, BigDecimal.ZERO.compareTo(reload().getAmountPaid()));
        }

        @Test
        @DisplayName("Failed status marks the payment FAILED without touching the order")
        void failedStatus() throws Exception {
            Payment pending = pendingPayment("50.00");

            callback(order.getId(), "failed", null).andExpect(status().isOk());

            Payment failed = paymentPersistenceService.findById(pending.getId()).orElseThrow();
            assertEquals(PaymentStatus.FAILED, failed.getStatus());
            assertNotNull(failed.getFailureReason());
            assertEquals(OrderPaymentStatus.UNPAID, reload().getPaymentStatus());
            assertTrue(outboxService.getEventsForOrder(order.getId()).stream()
                .map(OutboxEvent::getEventType)
                .anyMatch(PaymentFailedEvent.EVENT_TYPE::equals));
        }

        @Test
        @DisplayName("Success for a FAILED payment is rejected with 409")
        void successAfterFailure() throws Exception {
            pendingPayment("50.00");
            callback(order.getId(), "failed", null).andExpect(status().isOk());

            callback(order.getId(), "success", "TX-LATE")
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message").exists());

            assertEquals(0, BigDecimal.ZERO.compareTo(reload().getAmountPaid()));
        }
    }

    @Nested
    @DisplayName("Error answers")
    class ErrorAnswers {

        @Test
        @DisplayName("Unknown order answers 404")
        void unknownOrder() throws Exception {
            callback("999999", "success", null)
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("error"));
        }

        @Test
        @DisplayName("Order without payments answers 404")
        void orderWithoutPayments() throws Exception {
            callback(order.getId(), "success", null)
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("error"));
        }

        @Test
        @DisplayName("Non-numeric externalId or missing status answers 400")
        void malformed() throws Exception {
            callback("ORDER-12", "success", null)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"));

            callback(order.getId(), null, null)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"));
        }

        @Test
        @DisplayName("Unparseable body answers 400 in the gateway's shape")
        void unparseableBody() throws Exception {
            mockMvc.perform(post("/api/payments/webhook")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"));
        }
    }
}
