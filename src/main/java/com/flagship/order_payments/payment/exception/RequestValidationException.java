package com.flagship.order_payments.payment.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when request input is malformed. Carries one message per offending field
 * so callers can show field-level detail.
 */
@Getter
public class RequestValidationException extends RuntimeException {

    private final Map<String, String> fieldErrors;

    public RequestValidationException(Map<String, String> fieldErrors) {
        super("Request validation failed: " + fieldErrors.keySet());
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    public static RequestValidationException of(String field, String message) {
        return new RequestValidationException(Map.of(field, message));
    }
}
