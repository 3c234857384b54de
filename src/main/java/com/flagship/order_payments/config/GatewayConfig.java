package com.flagship.order_payments.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.order_payments.gateway.AzamPayGateway;
import com.flagship.order_payments.gateway.AzamPaySettings;
import com.flagship.order_payments.gateway.AzamPayTokenClient;
import com.flagship.order_payments.gateway.GatewayTokenCache;
import com.flagship.order_payments.gateway.PaymentGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the AzamPay gateway: HTTP client with timeouts, token client, token cache and the gateway itself.
 */
@Configuration
@Slf4j
public class GatewayConfig {

    @Value("${gateway.azampay.auth-base-url}")
    private String authBaseUrl;

    @Value("${gateway.azampay.checkout-base-url}")
    private String checkoutBaseUrl;

    @Value("${gateway.azampay.app-name:order-payments}")
    private String appName;

    @Value("${gateway.azampay.client-id:}")
    private String clientId;

    @Value("${gateway.azampay.client-secret:}")
    private String clientSecret;

    @Value("${gateway.azampay.currency:TZS}")
    private String currency;

    @Value("${gateway.azampay.connect-timeout-ms:5000}")
    private long connectTimeoutMs;

    @Value("${gateway.azampay.read-timeout-ms:30000}")
    private long readTimeoutMs;

    @Value("${gateway.azampay.token-expiry-skew-seconds:60}")
    private long tokenExpirySkewSeconds;

    @Value("${gateway.azampay.token-default-ttl-seconds:3600}")
    private long tokenDefaultTtlSeconds;

    @Bean
    public AzamPaySettings azamPaySettings() {
        if (clientId.isBlank() || clientSecret.isBlank()) {
            log.warn("AzamPay client credentials are not configured; payment initiation will fail");
        }
        return AzamPaySettings.builder()
                .authBaseUrl(authBaseUrl)
                .checkoutBaseUrl(checkoutBaseUrl)
                .appName(appName)
                .clientId(clientId)
                .clientSecret(clientSecret)
                .currency(currency)
                .tokenDefaultTtl(Duration.ofSeconds(tokenDefaultTtlSeconds))
                .build();
    }

    @Bean
    public RestTemplate gatewayRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }

    @Bean
    public AzamPayTokenClient azamPayTokenClient(RestTemplate gatewayRestTemplate, ObjectMapper objectMapper,
                                                 AzamPaySettings azamPaySettings, Clock clock) {
        return new AzamPayTokenClient(gatewayRestTemplate, objectMapper, azamPaySettings, clock);
    }

    @Bean
    public GatewayTokenCache gatewayTokenCache(AzamPayTokenClient azamPayTokenClient, Clock clock) {
        return new GatewayTokenCache(azamPayTokenClient::fetchToken, clock, Duration.ofSeconds(tokenExpirySkewSeconds));
    }

    @Bean
    public PaymentGateway paymentGateway(RestTemplate gatewayRestTemplate, ObjectMapper objectMapper,
                                         AzamPaySettings azamPaySettings, GatewayTokenCache gatewayTokenCache) {
        return new AzamPayGateway(gatewayRestTemplate, objectMapper, azamPaySettings, gatewayTokenCache);
    }
}
