package com.flagship.order_payments.payment.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Standard API error response.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    String error;
    String message;
    int status;
    String path;
    @JsonProperty("correlation_id")
    String correlationId;
    Map<String, String> details;
    Instant timestamp;
}
