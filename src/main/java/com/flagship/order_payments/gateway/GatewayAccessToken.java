package com.flagship.order_payments.gateway;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
public class GatewayAccessToken {
    String value;
    Instant expiresAt;

    /**
     * A token is usable until {@code skew} before it expires, so it can't lapse mid-request.
     */
    public boolean isUsableAt(Instant now, Duration skew) {
        return value != null && expiresAt != null && now.plus(skew).isBefore(expiresAt);
    }
}
