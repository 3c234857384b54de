package com.flagship.order_payments.webhook;

import com.flagship.order_payments.payment.PaymentStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class GatewayStatusMapperTest {

    @Test
    @DisplayName("Known statuses map case-insensitively and trimmed")
    void mapsKnownStatuses() {
        assertEquals(PaymentStatus.COMPLETED, GatewayStatusMapper.map("success"));
        assertEquals(PaymentStatus.COMPLETED, GatewayStatusMapper.map(" SUCCESS "));
        assertEquals(PaymentStatus.FAILED, GatewayStatusMapper.map("failed"));
        assertEquals(PaymentStatus.FAILED, GatewayStatusMapper.map("Failed"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "processing", "successful", "fail", "completed"})
    @DisplayName("Anything else stays PENDING")
    void unknownStatusesArePending(String status) {
        assertEquals(PaymentStatus.PENDING, GatewayStatusMapper.map(status));
    }

    @Test
    void nullIsPending() {
        assertEquals(PaymentStatus.PENDING, GatewayStatusMapper.map(null));
    }
}
