package com.flagship.order_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request body for starting a mobile money payment against an order.
 */
@Value
public class InitiatePaymentRequest {

    @NotNull(message = "Order ID is required")
    @Positive(message = "Order ID must be positive")
    @JsonProperty("order_id")
    Long orderId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Phone number is required")
    @JsonProperty("phone_number")
    String phoneNumber;

    /**
     * Optional; the configured default provider is used when absent.
     */
    @JsonProperty("provider")
    String provider;
}
