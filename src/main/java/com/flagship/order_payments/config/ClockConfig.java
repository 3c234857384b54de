package com.flagship.order_payments.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Clock used for business dates, such as the date embedded in tracking numbers.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${order-payments.tracking.zone-id:UTC}") String zoneId) {
        return Clock.system(ZoneId.of(zoneId));
    }
}
