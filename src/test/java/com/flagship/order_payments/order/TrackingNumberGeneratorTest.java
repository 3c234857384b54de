package com.flagship.order_payments.order;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class TrackingNumberGeneratorTest {

    private final TrackingNumberGenerator generator = new TrackingNumberGenerator(
        Clock.fixed(Instant.parse("2026-03-05T10:15:30Z"), ZoneOffset.UTC));

    @Test
    @DisplayName("Prefix, payment date and zero-padded order id")
    void formatsTrackingNumber() {
        assertEquals("SNBL20260305000042", generator.generate(42L));
        assertEquals("SNBL20260305123456", generator.generate(123456L));
    }

    @Test
    @DisplayName("Order ids longer than six digits are not truncated")
    void longOrderIdKeptWhole() {
        assertEquals("SNBL202603051234567", generator.generate(1234567L));
    }

    @Test
    @DisplayName("Unsaved order is rejected")
    void nullOrderIdRejected() {
        assertThrows(IllegalArgumentException.class, () -> generator.generate(null));
    }
}
