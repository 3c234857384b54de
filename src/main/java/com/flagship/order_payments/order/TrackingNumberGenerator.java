package com.flagship.order_payments.order;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Builds shipment tracking numbers: {@code SNBL<yyyyMMdd><order id, zero-padded to 6 digits>}.
 * The date is the day the order became fully paid.
 */
@Component
@RequiredArgsConstructor
public class TrackingNumberGenerator {

    static final String PREFIX = "SNBL";
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

    private final Clock clock;

    public String generate(Long orderId) {
        if (orderId == null) {
            throw new IllegalArgumentException("Order must be persisted before a tracking number is generated");
        }
        return PREFIX + LocalDate.now(clock).format(DATE_FORMAT) + String.format("%06d", orderId);
    }
}
