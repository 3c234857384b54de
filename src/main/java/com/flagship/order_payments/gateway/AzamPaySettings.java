package com.flagship.order_payments.gateway;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Connection settings of the AzamPay gateway, read from gateway.azampay.* properties.
 */
@Value
@Builder
public class AzamPaySettings {
    String authBaseUrl;
    String checkoutBaseUrl;
    String appName;
    String clientId;
    String clientSecret;
    String currency;
    /**
     * Lifetime assumed for a token when the gateway does not say when it expires.
     */
    Duration tokenDefaultTtl;

    @Override
    public String toString() {
        return "AzamPaySettings(authBaseUrl=" + authBaseUrl + ", checkoutBaseUrl=" + checkoutBaseUrl
            + ", appName=" + appName + ", currency=" + currency + ")";
    }
}
