package com.flagship.order_payments.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.order_payments.payment.MobileMoneyProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * AzamPay adapter against a mocked HTTP server: token handling, request shape and
 * interpretation of checkout answers.
 */
class AzamPayGatewayTest {

    private static final String AUTH_URL = "https://authenticator.test";
    private static final String CHECKOUT_URL = "https://checkout.test";
    private static final Instant NOW = Instant.parse("2026-01-01T08:00:00Z");

    private MockRestServiceServer server;
    private AzamPayGateway gateway;

    private final GatewayPaymentRequest request = new GatewayPaymentRequest(
        new BigDecimal("60.00"), "255712345678", MobileMoneyProvider.MPESA, "42");

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        ObjectMapper objectMapper = new ObjectMapper();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

        AzamPaySettings settings = AzamPaySettings.builder()
            .authBaseUrl(AUTH_URL)
            .checkoutBaseUrl(CHECKOUT_URL)
            .appName("shop")
            .clientId("client")
            .clientSecret("secret")
            .currency("TZS")
            .tokenDefaultTtl(Duration.ofHours(1))
            .build();

        AzamPayTokenClient tokenClient = new AzamPayTokenClient(restTemplate, objectMapper, settings, clock);
        GatewayTokenCache tokenCache = new GatewayTokenCache(tokenClient::fetchToken, clock, Duration.ofSeconds(60));
        gateway = new AzamPayGateway(restTemplate, objectMapper, settings, tokenCache);
    }

    private void expectToken(String token) {
        server.expect(requestTo(AUTH_URL + AzamPayTokenClient.TOKEN_PATH))
            .andExpect(method(HttpMethod.POST))
            .andExpect(jsonPath("$.clientId").value("client"))
            .andRespond(withSuccess(
                "{\"success\":true,\"data\":{\"accessToken\":\"" + token + "\",\"expire\":\"2026-01-01T09:00:00Z\"}}",
                MediaType.APPLICATION_JSON));
    }

    private void expectCheckout(String token, String responseBody) {
        server.expect(requestTo(CHECKOUT_URL + AzamPayGateway.CHECKOUT_PATH))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header("Authorization", "Bearer " + token))
            .andRespond(withSuccess(responseBody, MediaType.APPLICATION_JSON));
    }

    @Nested
    @DisplayName("Checkout answers")
    class CheckoutAnswers {

        @Test
        @DisplayName("Success with a transaction id is a confirmed payment")
        void confirmed() {
            expectToken("tok-1");
            server.expect(requestTo(CHECKOUT_URL + AzamPayGateway.CHECKOUT_PATH))
                .andExpect(header("Authorization", "Bearer tok-1"))
                .andExpect(jsonPath("$.accountNumber").value("255712345678"))
                .andExpect(jsonPath("$.amount").value("60.00"))
                .andExpect(jsonPath("$.currency").value("TZS"))
                .andExpect(jsonPath("$.externalId").value("42"))
                .andExpect(jsonPath("$.provider").value("Mpesa"))
                .andRespond(withSuccess("{\"success\":true,\"transactionId\":\"TX-9\",\"message\":\"ok\"}",
                    MediaType.APPLICATION_JSON));

            GatewayResult result = gateway.submit(request);

            assertTrue(result.isSuccess());
            assertEquals("TX-9", result.getTransactionId());
            server.verify();
        }

        @Test
        @DisplayName("Success without a transaction id is still a confirmed payment")
        void confirmedWithoutTransactionId() {
            expectToken("tok-1");
            expectCheckout("tok-1", "{\"success\":true,\"message\":\"Push sent\"}");

            GatewayResult result = gateway.submit(request);

            assertTrue(result.isSuccess());
            assertNull(result.getTransactionId());
            assertEquals("Push sent", result.getMessage());
        }

        @Test
        @DisplayName("success=false is declined with the gateway's message")
        void declined() {
            expectToken("tok-1");
            expectCheckout("tok-1", "{\"success\":false,\"message\":\"Insufficient funds\"}");

            GatewayResult result = gateway.submit(request);

            assertFalse(result.isSuccess());
            assertEquals("Insufficient funds", result.getMessage());
        }

        @Test
        @DisplayName("Body without a boolean success is declined as malformed")
        void malformed() {
            expectToken("tok-1");
            expectCheckout("tok-1", "{\"success\":\"yes\"}");

            assertFalse(gateway.submit(request).isSuccess());
        }

        @Test
        @DisplayName("Server error is declined with the HTTP status")
        void serverError() {
            expectToken("tok-1");
            server.expect(requestTo(CHECKOUT_URL + AzamPayGateway.CHECKOUT_PATH)).andRespond(withServerError());

            GatewayResult result = gateway.submit(request);

            assertFalse(result.isSuccess());
            assertEquals("Checkout answered HTTP 500", result.getMessage());
        }
    }

    @Nested
    @DisplayName("Access token")
    class AccessToken {

        @Test
        @DisplayName("Token is fetched once and reused across submissions")
        void tokenReused() {
            expectToken("tok-1");
            expectCheckout("tok-1", "{\"success\":true,\"transactionId\":\"TX-1\"}");
            expectCheckout("tok-1", "{\"success\":true,\"transactionId\":\"TX-2\"}");

            assertEquals("TX-1", gateway.submit(request).getTransactionId());
            assertEquals("TX-2", gateway.submit(request).getTransactionId());
            server.verify();
        }

        @Test
        @DisplayName("401 from checkout refreshes the token and retries once")
        void unauthorizedRetriesWithFreshToken() {
            expectToken("tok-1");
            server.expect(requestTo(CHECKOUT_URL + AzamPayGateway.CHECKOUT_PATH))
                .andExpect(header("Authorization", "Bearer tok-1"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));
            expectToken("tok-2");
            expectCheckout("tok-2", "{\"success\":true,\"transactionId\":\"TX-3\"}");

            GatewayResult result = gateway.submit(request);

            assertTrue(result.isSuccess());
            assertEquals("TX-3", result.getTransactionId());
            server.verify();
        }

        @Test
        @DisplayName("Network failure on the retry after a 401 is TRANSIENT")
        void retryUnreachableIsTransient() {
            expectToken("tok-1");
            server.expect(requestTo(CHECKOUT_URL + AzamPayGateway.CHECKOUT_PATH))
                .andExpect(header("Authorization", "Bearer tok-1"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));
            expectToken("tok-2");
            server.expect(requestTo(CHECKOUT_URL + AzamPayGateway.CHECKOUT_PATH))
                .andExpect(header("Authorization", "Bearer tok-2"))
                .andRespond(clientRequest -> {
                    throw new SocketTimeoutException("Read timed out");
                });

            GatewayException e = assertThrows(GatewayException.class, () -> gateway.submit(request));

            assertEquals(GatewayException.Reason.TRANSIENT, e.getReason());
            assertInstanceOf(ResourceAccessException.class, e.getCause());
            server.verify();
        }

        @Test
        @DisplayName("Rejected credentials surface as INVALID_CREDENTIALS")
        void invalidCredentials() {
            server.expect(requestTo(AUTH_URL + AzamPayTokenClient.TOKEN_PATH))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

            GatewayException e = assertThrows(GatewayException.class, () -> gateway.submit(request));
            assertEquals(GatewayException.Reason.INVALID_CREDENTIALS, e.getReason());
        }

        @Test
        @DisplayName("Authenticator answering success=false is INVALID_CREDENTIALS")
        void authenticatorRefuses() {
            server.expect(requestTo(AUTH_URL + AzamPayTokenClient.TOKEN_PATH))
                .andRespond(withSuccess("{\"success\":false,\"message\":\"Unknown app\"}", MediaType.APPLICATION_JSON));

            GatewayException e = assertThrows(GatewayException.class, () -> gateway.submit(request));
            assertEquals(GatewayException.Reason.INVALID_CREDENTIALS, e.getReason());
        }

        @Test
        @DisplayName("Authenticator outage is TRANSIENT")
        void authenticatorDown() {
            server.expect(requestTo(AUTH_URL + AzamPayTokenClient.TOKEN_PATH)).andRespond(withServerError());

            GatewayException e = assertThrows(GatewayException.class, () -> gateway.submit(request));
            assertEquals(GatewayException.Reason.TRANSIENT, e.getReason());
        }
    }
}
